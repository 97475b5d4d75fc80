package com.telemetry.pumlflow.logic;

import com.telemetry.pumlflow.event.EventSet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 逻辑门树
 *
 * 叶子是一个事件类型及其观测到的次数集合（次数大于 1 即分支计数），
 * 内部节点是 AND / OR / XOR 门。子节点的类型集合两两不相交。
 */
public final class GateTree {

    private final GateType gate;
    private final String eventType;
    private final SortedSet<Integer> counts;
    private final List<GateTree> children;

    private GateTree(GateType gate, String eventType, SortedSet<Integer> counts, List<GateTree> children) {
        this.gate = gate;
        this.eventType = eventType;
        this.counts = counts;
        this.children = children;
    }

    public static GateTree leaf(String eventType, Collection<Integer> counts) {
        if (counts.isEmpty()) {
            throw new IllegalArgumentException("叶子至少需要一个次数: " + eventType);
        }
        return new GateTree(null, eventType, Collections.unmodifiableSortedSet(new TreeSet<>(counts)),
                Collections.emptyList());
    }

    public static GateTree leaf(String eventType) {
        return leaf(eventType, Collections.singleton(1));
    }

    /**
     * 构建门节点，同类型子门合并（AND(AND(a,b),c) == AND(a,b,c)），子节点按首个类型排序
     */
    public static GateTree gate(GateType gate, List<GateTree> children) {
        List<GateTree> flat = new ArrayList<>();
        for (GateTree child : children) {
            if (child.gate == gate) {
                flat.addAll(child.children);
            } else {
                flat.add(child);
            }
        }
        return nested(gate, flat);
    }

    /**
     * 构建门节点但保留同类型嵌套
     */
    public static GateTree nested(GateType gate, List<GateTree> children) {
        if (children.size() < 2) {
            throw new IllegalArgumentException(gate + " 门至少需要两个分支: " + children);
        }
        List<GateTree> sorted = new ArrayList<>(children);
        sorted.sort((a, b) -> a.firstType().compareTo(b.firstType()));
        return new GateTree(gate, null, null, Collections.unmodifiableList(sorted));
    }

    public boolean isLeaf() {
        return gate == null;
    }

    public GateType getGate() {
        return gate;
    }

    public String getEventType() {
        return eventType;
    }

    public SortedSet<Integer> getCounts() {
        return counts;
    }

    public List<GateTree> getChildren() {
        return children;
    }

    /**
     * 叶子次数恒定且大于 1，或者次数不固定
     */
    public boolean hasBranchCount() {
        return isLeaf() && (counts.size() > 1 || counts.first() > 1);
    }

    /**
     * 树中所有叶子类型（字典序）
     */
    public SortedSet<String> getLeafTypes() {
        SortedSet<String> types = new TreeSet<>();
        collectLeafTypes(types);
        return types;
    }

    private void collectLeafTypes(SortedSet<String> types) {
        if (isLeaf()) {
            types.add(eventType);
            return;
        }
        for (GateTree child : children) {
            child.collectLeafTypes(types);
        }
    }

    /**
     * 所有叶子（先序）
     */
    public List<GateTree> getLeaves() {
        List<GateTree> leaves = new ArrayList<>();
        collectLeaves(leaves);
        return leaves;
    }

    private void collectLeaves(List<GateTree> leaves) {
        if (isLeaf()) {
            leaves.add(this);
            return;
        }
        for (GateTree child : children) {
            child.collectLeaves(leaves);
        }
    }

    private String firstType() {
        return isLeaf() ? eventType : getLeafTypes().first();
    }

    /**
     * 该树能否产生这个事件集合
     */
    public boolean accepts(EventSet eventSet) {
        return accepts(eventSet.getCounts());
    }

    private boolean accepts(Map<String, Integer> occurrence) {
        if (isLeaf()) {
            Integer count = occurrence.get(eventType);
            return occurrence.size() == 1 && count != null && counts.contains(count);
        }
        Map<GateTree, Map<String, Integer>> projections = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : occurrence.entrySet()) {
            GateTree owner = childOwning(entry.getKey());
            if (owner == null) {
                return false;
            }
            projections.computeIfAbsent(owner, k -> new TreeMap<>()).put(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<GateTree, Map<String, Integer>> entry : projections.entrySet()) {
            if (!entry.getKey().accepts(entry.getValue())) {
                return false;
            }
        }
        switch (gate) {
            case AND:
                return projections.size() == children.size();
            case XOR:
                return projections.size() == 1;
            case OR:
                return !projections.isEmpty();
            default:
                throw new IllegalStateException("未知逻辑门: " + gate);
        }
    }

    private GateTree childOwning(String type) {
        for (GateTree child : children) {
            if (child.getLeafTypes().contains(type)) {
                return child;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GateTree)) {
            return false;
        }
        GateTree other = (GateTree) o;
        return gate == other.gate
                && Objects.equals(eventType, other.eventType)
                && Objects.equals(counts, other.counts)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gate, eventType, counts, children);
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return hasBranchCount() ? eventType + "x" + counts : eventType;
        }
        StringBuilder sb = new StringBuilder(gate.name()).append('(');
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
