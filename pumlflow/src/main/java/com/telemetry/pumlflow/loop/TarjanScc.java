package com.telemetry.pumlflow.loop;

import com.telemetry.pumlflow.event.EventGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tarjan 强连通分量（显式栈，不依赖递归深度）
 */
public final class TarjanScc {

    private TarjanScc() {
    }

    /**
     * 所有强连通分量，按发现顺序
     */
    public static List<SortedSet<String>> components(EventGraph graph) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<SortedSet<String>> result = new ArrayList<>();
        int counter = 0;

        for (String root : graph.getEventTypes()) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<Frame> callStack = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            callStack.push(new Frame(root, graph.successors(root).iterator()));

            while (!callStack.isEmpty()) {
                Frame frame = callStack.peek();
                if (frame.successors.hasNext()) {
                    String next = frame.successors.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        callStack.push(new Frame(next, graph.successors(next).iterator()));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(next)));
                    }
                    continue;
                }
                callStack.pop();
                if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                    SortedSet<String> component = new TreeSet<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node));
                    result.add(component);
                }
                if (!callStack.isEmpty()) {
                    String parent = callStack.peek().node;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.node)));
                }
            }
        }
        return result;
    }

    /**
     * 非平凡强连通分量：多于一个节点，或单节点自环。按最小类型排序。
     */
    public static List<SortedSet<String>> loops(EventGraph graph) {
        List<SortedSet<String>> loops = new ArrayList<>();
        for (SortedSet<String> component : components(graph)) {
            if (component.size() > 1 || graph.hasEdge(component.first(), component.first())) {
                loops.add(component);
            }
        }
        loops.sort((a, b) -> a.first().compareTo(b.first()));
        return loops;
    }

    private static final class Frame {
        private final String node;
        private final Iterator<String> successors;

        private Frame(String node, Iterator<String> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
