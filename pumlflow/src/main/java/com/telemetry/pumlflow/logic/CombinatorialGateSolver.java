package com.telemetry.pumlflow.logic;

import com.telemetry.pumlflow.event.EventSet;
import com.telemetry.pumlflow.exception.AmbiguousLogicException;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 组合式逻辑门推断
 *
 * 只看每个事件集合里出现了哪些类型（出现模式），自顶向下切分类型全集：
 * 1. 共现图不连通 -> XOR，每个连通分量递归
 * 2. 按出现签名（包含该类型的模式下标集合）把类型归为原子，签名相同的类型总是同时出现
 * 3. 在原子上建互斥图（从不同时出现则相连），互斥连通块彼此独立；
 *    每个块在所有模式中都出现 -> AND，否则 -> OR（必现块合并为一个 AND 分支）
 * 4. 只有一个互斥块时无法切分，抛出 {@link AmbiguousLogicException}
 * 切分总取最细的划分，同类型嵌套合并，嵌套深度最小。
 */
public class CombinatorialGateSolver implements LogicGateSolver {

    @Override
    public GateTree inferGroups(Collection<EventSet> eventSets) {
        if (eventSets == null || eventSets.isEmpty()) {
            throw new IllegalArgumentException("事件集合不能为空");
        }
        Map<String, SortedSet<Integer>> counts = new TreeMap<>();
        Set<Set<String>> distinct = new LinkedHashSet<>();
        for (EventSet eventSet : eventSets) {
            distinct.add(new TreeSet<>(eventSet.getEventTypes()));
            for (Map.Entry<String, Integer> entry : eventSet.getCounts().entrySet()) {
                counts.computeIfAbsent(entry.getKey(), k -> new TreeSet<>()).add(entry.getValue());
            }
        }
        List<Set<String>> patterns = new ArrayList<>(distinct);
        patterns.sort((a, b) -> a.toString().compareTo(b.toString()));

        GateTree tree = solve(patterns, counts);
        for (EventSet eventSet : eventSets) {
            if (!tree.accepts(eventSet)) {
                throw new AmbiguousLogicException("推断结果 " + tree + " 无法产生事件集合 " + eventSet);
            }
        }
        return tree;
    }

    private GateTree solve(List<Set<String>> patterns, Map<String, SortedSet<Integer>> counts) {
        SortedSet<String> universe = new TreeSet<>();
        for (Set<String> pattern : patterns) {
            universe.addAll(pattern);
        }
        if (universe.size() == 1) {
            String type = universe.first();
            return GateTree.leaf(type, counts.get(type));
        }

        // 切分1: 共现连通分量 -> XOR
        List<SortedSet<String>> components = coOccurrenceComponents(patterns, universe);
        if (components.size() > 1) {
            List<GateTree> children = new ArrayList<>();
            for (SortedSet<String> component : components) {
                children.add(solve(patternsWithin(patterns, component), counts));
            }
            return GateTree.gate(GateType.XOR, children);
        }

        // 所有模式相同：全部同时发生
        if (patterns.size() == 1) {
            return GateTree.gate(GateType.AND, leaves(universe, counts));
        }

        // 切分2: 原子与互斥块
        List<SortedSet<String>> atoms = new ArrayList<>();
        List<BitSet> signatures = new ArrayList<>();
        groupAtoms(patterns, universe, atoms, signatures);
        List<SortedSet<String>> blocks = exclusionBlocks(atoms, signatures);
        if (blocks.size() < 2) {
            throw new AmbiguousLogicException("无法切分的事件类型组合: " + patterns);
        }

        List<GateTree> mandatory = new ArrayList<>();
        List<GateTree> optional = new ArrayList<>();
        for (SortedSet<String> block : blocks) {
            List<Set<String>> projections = new ArrayList<>();
            boolean always = true;
            for (Set<String> pattern : patterns) {
                Set<String> projection = new TreeSet<>(pattern);
                projection.retainAll(block);
                if (projection.isEmpty()) {
                    always = false;
                } else if (!projections.contains(projection)) {
                    projections.add(projection);
                }
            }
            GateTree child = solve(projections, counts);
            if (always) {
                mandatory.add(child);
            } else {
                optional.add(child);
            }
        }
        if (optional.isEmpty()) {
            return GateTree.gate(GateType.AND, mandatory);
        }
        List<GateTree> orChildren = new ArrayList<>(optional);
        if (mandatory.size() == 1) {
            orChildren.add(mandatory.get(0));
        } else if (mandatory.size() > 1) {
            orChildren.add(GateTree.gate(GateType.AND, mandatory));
        }
        if (orChildren.size() == 1) {
            return orChildren.get(0);
        }
        return GateTree.gate(GateType.OR, orChildren);
    }

    private static List<GateTree> leaves(Collection<String> types, Map<String, SortedSet<Integer>> counts) {
        List<GateTree> leaves = new ArrayList<>();
        for (String type : types) {
            leaves.add(GateTree.leaf(type, counts.get(type)));
        }
        return leaves;
    }

    private static List<Set<String>> patternsWithin(List<Set<String>> patterns, Set<String> component) {
        List<Set<String>> within = new ArrayList<>();
        for (Set<String> pattern : patterns) {
            if (component.containsAll(pattern)) {
                within.add(pattern);
            }
        }
        return within;
    }

    /**
     * 同一模式中出现的类型相连，返回连通分量（按首个类型排序）
     */
    private static List<SortedSet<String>> coOccurrenceComponents(List<Set<String>> patterns,
                                                                  SortedSet<String> universe) {
        UnionFind<String> unionFind = new UnionFind<>(universe);
        for (Set<String> pattern : patterns) {
            String first = null;
            for (String type : pattern) {
                if (first == null) {
                    first = type;
                } else {
                    unionFind.union(first, type);
                }
            }
        }
        return unionFind.groups();
    }

    private static void groupAtoms(List<Set<String>> patterns, SortedSet<String> universe,
                                   List<SortedSet<String>> atoms, List<BitSet> signatures) {
        Map<BitSet, SortedSet<String>> bySignature = new LinkedHashMap<>();
        for (String type : universe) {
            BitSet signature = new BitSet(patterns.size());
            for (int i = 0; i < patterns.size(); i++) {
                if (patterns.get(i).contains(type)) {
                    signature.set(i);
                }
            }
            bySignature.computeIfAbsent(signature, k -> new TreeSet<>()).add(type);
        }
        for (Map.Entry<BitSet, SortedSet<String>> entry : bySignature.entrySet()) {
            signatures.add(entry.getKey());
            atoms.add(entry.getValue());
        }
    }

    /**
     * 从不同时出现的原子相连，返回连通块（按首个类型排序）
     */
    private static List<SortedSet<String>> exclusionBlocks(List<SortedSet<String>> atoms, List<BitSet> signatures) {
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < atoms.size(); i++) {
            indexes.add(i);
        }
        UnionFind<Integer> unionFind = new UnionFind<>(indexes);
        for (int i = 0; i < atoms.size(); i++) {
            for (int j = i + 1; j < atoms.size(); j++) {
                if (!signatures.get(i).intersects(signatures.get(j))) {
                    unionFind.union(i, j);
                }
            }
        }
        List<SortedSet<String>> blocks = new ArrayList<>();
        for (SortedSet<Integer> group : unionFind.groups()) {
            SortedSet<String> block = new TreeSet<>();
            for (Integer index : group) {
                block.addAll(atoms.get(index));
            }
            blocks.add(block);
        }
        blocks.sort((a, b) -> a.first().compareTo(b.first()));
        return blocks;
    }

    /**
     * 简单并查集，分组结果保持元素的自然顺序
     */
    private static final class UnionFind<T extends Comparable<T>> {
        private final Map<T, T> parent = new LinkedHashMap<>();

        UnionFind(Collection<T> elements) {
            for (T element : elements) {
                parent.put(element, element);
            }
        }

        T find(T element) {
            T root = element;
            while (!parent.get(root).equals(root)) {
                root = parent.get(root);
            }
            while (!parent.get(element).equals(root)) {
                T next = parent.get(element);
                parent.put(element, root);
                element = next;
            }
            return root;
        }

        void union(T a, T b) {
            T rootA = find(a);
            T rootB = find(b);
            if (!rootA.equals(rootB)) {
                if (rootA.compareTo(rootB) < 0) {
                    parent.put(rootB, rootA);
                } else {
                    parent.put(rootA, rootB);
                }
            }
        }

        List<SortedSet<T>> groups() {
            Map<T, SortedSet<T>> groups = new TreeMap<>();
            for (T element : parent.keySet()) {
                groups.computeIfAbsent(find(element), k -> new TreeSet<>()).add(element);
            }
            return new ArrayList<>(groups.values());
        }
    }
}
