package com.telemetry.pumlflow.loop;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.event.Event;
import com.telemetry.pumlflow.event.EventGraph;
import com.telemetry.pumlflow.event.EventSet;
import com.telemetry.pumlflow.event.MarkovGraphBuilder;
import com.telemetry.pumlflow.exception.PumlFlowException;
import com.telemetry.pumlflow.exception.UnreachableLoopException;
import com.telemetry.pumlflow.pipeline.JobContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 循环检测与折叠
 *
 * 每轮：Tarjan 找出一个非平凡强连通分量，计算起点、出口、回边点、结束点和 break 点，
 * 把分量（连同 break 专属路径）抽成自包含子图，在父图中替换为一个 {@link LoopEvent}，
 * 再对子图递归。每次折叠至少减少一个节点，直到没有非平凡分量。
 * 输入图不被修改，返回新的图。
 */
@Slf4j
public class LoopDetector {

    private static final String TAG = PumlFlowConstants.LogTag.LOOP;
    private static final String LOOP_START = PumlFlowConstants.DummyEvent.LOOP_START;
    private static final String LOOP_END = PumlFlowConstants.DummyEvent.LOOP_END;

    private final JobContext context;

    public LoopDetector(JobContext context) {
        this.context = context;
    }

    public EventGraph detect(EventGraph graph) {
        long startTime = System.currentTimeMillis();
        EventGraph folded = detect(graph, 0);
        log.info("{}-> job={} 折叠完成，节点数: {} -> {}, 耗时: {}ms",
                TAG, context.getJobName(), graph.size(), folded.size(), System.currentTimeMillis() - startTime);
        return folded;
    }

    private EventGraph detect(EventGraph graph, int depth) {
        int maxDepth = context.getConfig().getMaxLoopDepth();
        if (depth > maxDepth) {
            throw new PumlFlowException("循环嵌套深度超过上限 " + maxDepth);
        }
        EventGraph current = graph;
        while (true) {
            List<SortedSet<String>> loops = TarjanScc.loops(current);
            if (loops.isEmpty()) {
                return current;
            }
            Loop loop = analyse(current, loops.get(0));
            current = fold(current, loop, depth);
        }
    }

    // ========== 循环分析 ==========

    /**
     * 计算循环的各类关键点
     *
     * @throws UnreachableLoopException 分量没有外部入口
     */
    Loop analyse(EventGraph graph, SortedSet<String> scc) {
        Set<String> starts = new LinkedHashSet<>();
        Set<String> exits = new LinkedHashSet<>();
        Set<String> continuationCandidates = new LinkedHashSet<>();
        for (String node : scc) {
            for (String predecessor : graph.predecessors(node)) {
                if (!scc.contains(predecessor)) {
                    starts.add(node);
                }
            }
            for (String successor : graph.successors(node)) {
                if (!scc.contains(successor)) {
                    exits.add(node);
                    continuationCandidates.add(successor);
                }
            }
        }
        if (starts.isEmpty()) {
            log.error("{}-> 循环 {} 没有外部入口", TAG, scc);
            throw new UnreachableLoopException(scc);
        }

        Set<String> loopBacks = new LinkedHashSet<>();
        for (String node : scc) {
            for (String successor : graph.successors(node)) {
                if (starts.contains(successor)) {
                    loopBacks.add(node);
                }
            }
        }

        Set<String> ends = endPoints(graph, scc, starts, loopBacks);
        Set<LoopEdge> loopEdges = new LinkedHashSet<>();
        for (String end : ends) {
            for (String start : starts) {
                if (graph.hasEdge(end, start)) {
                    loopEdges.add(new LoopEdge(end, start));
                }
            }
        }

        Set<String> continuation = new LinkedHashSet<>();
        for (String end : ends) {
            for (String successor : graph.successors(end)) {
                if (!scc.contains(successor)) {
                    continuation.add(successor);
                }
            }
        }
        Set<String> breakOuts = new LinkedHashSet<>(exits);
        breakOuts.removeAll(ends);

        Set<String> breakPoints;
        if (continuation.isEmpty()) {
            // 没有结束点离开循环：所有出口都是 break，外部后继就是循环之后的去向
            continuation.addAll(continuationCandidates);
            breakPoints = new LinkedHashSet<>();
        } else {
            breakPoints = breakOnlyNodes(graph, scc, breakOuts, continuation);
        }
        Loop loop = new Loop(scc, starts, exits, loopBacks, ends, breakOuts, breakPoints, continuation, loopEdges);
        log.debug("{}-> {}", TAG, loop);
        return loop;
    }

    /**
     * 结束点：回边点 i 若存在另一回边点 j，使 i 能到达 j 而 j 不能到达 i，则 i 不是结束点。
     * 可达性在去掉所有指向起点的边后的分量内计算，互相可达的回边点同为结束点。
     */
    private static Set<String> endPoints(EventGraph graph, Set<String> scc, Set<String> starts,
                                         Set<String> loopBacks) {
        Map<String, Set<String>> reach = new HashMap<>();
        for (String node : loopBacks) {
            reach.put(node, reachableWithin(graph, node, scc, starts));
        }
        Set<String> ends = new LinkedHashSet<>();
        for (String candidate : loopBacks) {
            boolean isEnd = true;
            for (String other : loopBacks) {
                if (other.equals(candidate)) {
                    continue;
                }
                int forward = reach.get(candidate).contains(other) ? 1 : 0;
                int backward = reach.get(other).contains(candidate) ? 1 : 0;
                if (backward - forward < 0) {
                    isEnd = false;
                    break;
                }
            }
            if (isEnd) {
                ends.add(candidate);
            }
        }
        return ends;
    }

    private static Set<String> reachableWithin(EventGraph graph, String from, Set<String> scc, Set<String> starts) {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            for (String successor : graph.successors(node)) {
                if (scc.contains(successor) && !starts.contains(successor) && visited.add(successor)) {
                    queue.add(successor);
                }
            }
        }
        return visited;
    }

    /**
     * 只能经由 break 到达的外部节点：前驱全部在循环内（或已并入），
     * 不是正常去向，也不能从正常去向到达
     */
    private static Set<String> breakOnlyNodes(EventGraph graph, Set<String> scc, Set<String> breakOuts,
                                              Set<String> continuation) {
        Set<String> afterLoop = reachable(graph, continuation);
        Set<String> absorbed = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String node : graph.getEventTypes()) {
                if (scc.contains(node) || absorbed.contains(node) || afterLoop.contains(node)) {
                    continue;
                }
                Set<String> predecessors = graph.predecessors(node);
                if (predecessors.isEmpty()) {
                    continue;
                }
                boolean onlyFromBreak = true;
                boolean touchesBreak = false;
                for (String predecessor : predecessors) {
                    if (breakOuts.contains(predecessor) || absorbed.contains(predecessor)) {
                        touchesBreak = true;
                    } else if (!scc.contains(predecessor)) {
                        onlyFromBreak = false;
                    }
                }
                if (onlyFromBreak && touchesBreak) {
                    absorbed.add(node);
                    changed = true;
                }
            }
        }
        return absorbed;
    }

    private static Set<String> reachable(EventGraph graph, Collection<String> from) {
        Set<String> visited = new HashSet<>(from);
        Deque<String> queue = new ArrayDeque<>(from);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            for (String successor : graph.successors(node)) {
                if (visited.add(successor)) {
                    queue.add(successor);
                }
            }
        }
        return visited;
    }

    // ========== 循环折叠 ==========

    private EventGraph fold(EventGraph graph, Loop loop, int depth) {
        String loopType = context.nextLoopType();
        Set<String> interior = loop.getInterior();
        log.info("{}-> 折叠 {}: 节点 {}, 起点 {}, 结束点 {}, break出口 {}, break点 {}",
                TAG, loopType, loop.getNodes(), loop.getStartPoints(), loop.getEndPoints(),
                loop.getBreakOutPoints(), loop.getBreakPoints());

        Set<String> breakTypes = new LinkedHashSet<>();
        EventGraph subGraph = buildSubGraph(graph, loop, breakTypes);
        EventGraph foldedSubGraph = detect(subGraph, depth + 1);

        // 父图：循环外的事件改写对循环内类型的引用
        Map<String, Event> parentEvents = new LinkedHashMap<>();
        boolean loopPlaced = false;
        for (Event event : graph.getEvents().values()) {
            if (interior.contains(event.getEventType())) {
                if (!loopPlaced) {
                    parentEvents.put(loopType, buildLoopEvent(graph, loop, loopType, foldedSubGraph, breakTypes));
                    loopPlaced = true;
                }
                continue;
            }
            List<EventSet> outgoing = new ArrayList<>();
            for (EventSet eventSet : event.getOutgoing()) {
                outgoing.add(eventSet.replace(interior, loopType));
            }
            List<EventSet> incoming = new ArrayList<>();
            for (EventSet eventSet : event.getIncoming()) {
                incoming.add(eventSet.replace(interior, loopType));
            }
            parentEvents.put(event.getEventType(), new Event(event.getEventType(), outgoing, incoming));
        }
        return MarkovGraphBuilder.build(parentEvents);
    }

    private static LoopEvent buildLoopEvent(EventGraph graph, Loop loop, String loopType, EventGraph subGraph,
                                            Set<String> breakTypes) {
        Set<String> interior = loop.getInterior();
        Set<String> outside = new HashSet<>(graph.getEventTypes());
        outside.removeAll(interior);

        Set<EventSet> incoming = new LinkedHashSet<>();
        for (String start : loop.getStartPoints()) {
            for (EventSet eventSet : graph.getEvent(start).getIncoming()) {
                EventSet projected = eventSet.project(outside);
                if (projected != null) {
                    incoming.add(projected);
                }
            }
        }

        Set<String> leaving = new LinkedHashSet<>(loop.getEndPoints());
        leaving.addAll(loop.getBreakOutPoints());
        leaving.addAll(loop.getBreakPoints());
        Set<EventSet> outgoing = new LinkedHashSet<>();
        for (String node : leaving) {
            for (EventSet eventSet : graph.getEvent(node).getOutgoing()) {
                EventSet projected = eventSet.project(outside);
                if (projected != null) {
                    outgoing.add(projected);
                }
            }
        }
        return new LoopEvent(loopType, outgoing, incoming, subGraph,
                new LinkedHashSet<>(loop.getStartPoints()), new LinkedHashSet<>(loop.getEndPoints()), breakTypes);
    }

    /**
     * 抽取循环子图
     *
     * 去掉回边；起点的外部前驱替换为合成起点，结束点的外部后继替换为合成终点，
     * 其余离开循环的边指向每个来源各自的 break 标记；若来源的事件集合显示该外部后继与循环内后继同时发生，
     * 则保留该外部后继作为 break 桩节点。
     *
     * @param breakTypes 输出：子图中的 break 终止节点
     */
    private static EventGraph buildSubGraph(EventGraph graph, Loop loop, Set<String> breakTypes) {
        Set<String> interior = loop.getInterior();
        Map<String, Event> events = new LinkedHashMap<>();
        Map<String, Set<EventSet>> terminalIncoming = new LinkedHashMap<>();

        // 合成起点：外部前驱的事件集合在起点上的投影
        Set<EventSet> startOutgoing = new LinkedHashSet<>();
        for (String start : loop.getStartPoints()) {
            for (String predecessor : graph.predecessors(start)) {
                if (interior.contains(predecessor)) {
                    continue;
                }
                for (EventSet eventSet : graph.getEvent(predecessor).getOutgoing()) {
                    EventSet projected = eventSet.project(loop.getStartPoints());
                    if (projected != null) {
                        startOutgoing.add(projected);
                    }
                }
            }
        }
        events.put(LOOP_START, new Event(LOOP_START, startOutgoing, new ArrayList<>()));

        for (String node : interior) {
            Event event = graph.getEvent(node);
            boolean isEnd = loop.getEndPoints().contains(node);
            boolean isStart = loop.getStartPoints().contains(node);

            Set<String> overlapping = overlappingOutside(event, interior);
            Set<String> loopBackTargets = loop.loopBackTargets(node);
            Set<EventSet> outgoing = new LinkedHashSet<>();
            for (EventSet eventSet : event.getOutgoing()) {
                EventSet kept = withoutTypes(eventSet, loopBackTargets);
                if (kept == null) {
                    continue;
                }
                Map<String, String> renames = new HashMap<>();
                for (String type : kept.getEventTypes()) {
                    if (interior.contains(type)) {
                        continue;
                    }
                    String target;
                    if (isEnd) {
                        target = LOOP_END;
                    } else if (overlapping.contains(type)) {
                        target = type;
                    } else {
                        target = PumlFlowConstants.DummyEvent.BREAK_PREFIX + node;
                    }
                    renames.put(type, target);
                    if (!LOOP_END.equals(target)) {
                        breakTypes.add(target);
                        terminalIncoming.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(EventSet.of(node));
                    }
                }
                outgoing.add(kept.rename(renames));
            }
            if (isEnd && !mentions(outgoing, LOOP_END)) {
                outgoing.add(EventSet.of(LOOP_END));
            }

            Set<String> loopBackSources = loop.loopBackSources(node);
            Set<EventSet> incoming = new LinkedHashSet<>();
            for (EventSet eventSet : event.getIncoming()) {
                EventSet kept = withoutTypes(eventSet, loopBackSources);
                if (kept == null) {
                    continue;
                }
                Set<String> external = new HashSet<>(kept.getEventTypes());
                external.removeAll(interior);
                incoming.add(kept.replace(external, LOOP_START));
            }
            if (isStart && !mentions(incoming, LOOP_START)) {
                incoming.add(EventSet.of(LOOP_START));
            }
            events.put(node, new Event(node, outgoing, incoming));
        }

        // 合成终点与 break 终止节点
        Set<EventSet> endIncoming = new LinkedHashSet<>();
        for (String end : loop.getEndPoints()) {
            endIncoming.add(EventSet.of(end));
        }
        events.put(LOOP_END, new Event(LOOP_END, new ArrayList<>(), endIncoming));
        for (Map.Entry<String, Set<EventSet>> entry : terminalIncoming.entrySet()) {
            events.put(entry.getKey(), new Event(entry.getKey(), new ArrayList<>(), entry.getValue()));
        }
        return MarkovGraphBuilder.build(events);
    }

    /**
     * 与循环内后继出现在同一事件集合中的外部后继
     */
    private static Set<String> overlappingOutside(Event event, Set<String> interior) {
        Set<String> overlapping = new TreeSet<>();
        for (EventSet eventSet : event.getOutgoing()) {
            if (!eventSet.containsAny(interior)) {
                continue;
            }
            for (String type : eventSet.getEventTypes()) {
                if (!interior.contains(type)) {
                    overlapping.add(type);
                }
            }
        }
        return overlapping;
    }

    private static EventSet withoutTypes(EventSet eventSet, Set<String> types) {
        if (types.isEmpty() || !eventSet.containsAny(types)) {
            return eventSet;
        }
        Set<String> kept = new HashSet<>(eventSet.getEventTypes());
        kept.removeAll(types);
        return eventSet.project(kept);
    }

    private static boolean mentions(Collection<EventSet> eventSets, String type) {
        for (EventSet eventSet : eventSets) {
            if (eventSet.contains(type)) {
                return true;
            }
        }
        return false;
    }
}
