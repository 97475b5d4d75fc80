package com.telemetry.pumlflow.puml;

import com.telemetry.pumlflow.logic.GateType;
import com.telemetry.pumlflow.node.PumlEventTag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * 输出图
 *
 * 简单有向图（边去重），终止节点没有出边；每个逻辑块的 START/END 成对出现，
 * 非首个分支由 PATH 节点引出。后继按加入顺序保存，决定分支输出顺序。
 * 除起点外每个节点至少有一条入边，唯一的例外是所有分支都已终止的逻辑块的 END：
 * 它仍然输出以闭合 PlantUML 块，但没有入边也没有出边。
 */
public class PumlGraph {

    private final Map<String, PumlNode> nodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> outEdges = new LinkedHashMap<>();
    private final Map<String, Set<String>> inEdges = new LinkedHashMap<>();
    private final Map<Integer, PumlNode> blockEnds = new HashMap<>();

    /** 每个事件类型已输出的次数，用于生成节点 id */
    private final Map<String, Integer> eventCounters = new HashMap<>();

    private int blockCounter;
    private int branchCounter;
    private int killCounter;
    private PumlNode startNode;

    public PumlNode addEvent(String eventType, Set<PumlEventTag> tags, SortedSet<Integer> counts) {
        boolean branch = counts != null && (counts.size() > 1 || counts.first() > 1);
        Integer branchNumber = branch ? ++branchCounter : null;
        return add(PumlNode.event(nextEventId(eventType), eventType, tags, branchNumber,
                branch ? counts : null, null));
    }

    /**
     * 循环占位节点，循环体稍后按 subGraphUid 回填
     */
    public PumlNode addSubGraphEvent(String eventType, Set<PumlEventTag> tags, String subGraphUid) {
        return add(PumlNode.event(nextEventId(eventType), eventType, tags, null, null, subGraphUid));
    }

    public int nextBlockId() {
        return ++blockCounter;
    }

    public PumlNode addOperator(GateType gate, PumlNode.Role role, int blockId) {
        PumlNode node = add(PumlNode.operator(gate + "_" + role + "_" + blockId
                + (role == PumlNode.Role.PATH ? "_" + nodes.size() : ""), gate, role, blockId));
        if (role == PumlNode.Role.END) {
            blockEnds.put(blockId, node);
        }
        return node;
    }

    public PumlNode addKill(boolean breakLoop) {
        killCounter++;
        return add(PumlNode.kill((breakLoop ? "BREAK_" : "KILL_") + killCounter, breakLoop));
    }

    private String nextEventId(String eventType) {
        int occurrence = eventCounters.merge(eventType, 1, Integer::sum);
        return eventType + "_" + occurrence;
    }

    private PumlNode add(PumlNode node) {
        nodes.put(node.getId(), node);
        outEdges.put(node.getId(), new LinkedHashSet<>());
        inEdges.put(node.getId(), new LinkedHashSet<>());
        if (startNode == null) {
            startNode = node;
        }
        return node;
    }

    public void addEdge(PumlNode source, PumlNode target) {
        if (source.getKind() == PumlNode.Kind.KILL) {
            throw new IllegalStateException("终止节点不能有出边: " + source.getId());
        }
        outEdges.get(source.getId()).add(target.getId());
        inEdges.get(target.getId()).add(source.getId());
    }

    public List<PumlNode> successors(PumlNode node) {
        List<PumlNode> result = new ArrayList<>();
        for (String id : outEdges.get(node.getId())) {
            result.add(nodes.get(id));
        }
        return result;
    }

    public List<PumlNode> predecessors(PumlNode node) {
        List<PumlNode> result = new ArrayList<>();
        for (String id : inEdges.get(node.getId())) {
            result.add(nodes.get(id));
        }
        return result;
    }

    public boolean hasEdge(PumlNode source, PumlNode target) {
        return outEdges.get(source.getId()).contains(target.getId());
    }

    public PumlNode getNode(String id) {
        return nodes.get(id);
    }

    public Collection<PumlNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public PumlNode getStartNode() {
        return startNode;
    }

    public PumlNode blockEnd(int blockId) {
        return blockEnds.get(blockId);
    }

    /**
     * 引用某个循环节点的所有占位节点
     */
    public List<PumlNode> placeholdersFor(String subGraphUid) {
        List<PumlNode> result = new ArrayList<>();
        for (PumlNode node : nodes.values()) {
            if (subGraphUid.equals(node.getSubGraphUid())) {
                result.add(node);
            }
        }
        return result;
    }

    public int countOperators(PumlNode.Role role) {
        int count = 0;
        for (PumlNode node : nodes.values()) {
            if (node.isOperator(role)) {
                count++;
            }
        }
        return count;
    }

    public int getKillCount() {
        return killCounter;
    }

    public int getBranchCount() {
        return branchCounter;
    }

    public int edgeCount() {
        int count = 0;
        for (Set<String> targets : outEdges.values()) {
            count += targets.size();
        }
        return count;
    }

    public int size() {
        return nodes.size();
    }
}
