package com.telemetry.pumlflow.node;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 节点图（循环已折叠，无环）
 *
 * 节点按 uid 存储；循环子图的根是合成起点，出口是合成终点，顶层图没有出口
 */
public class NodeGraph {

    /** 节点存储：uid -> Node */
    private final Map<String, Node> nodes = new LinkedHashMap<>();

    /** eventType -> Node，同一层图内类型唯一 */
    private final Map<String, Node> nodesByType = new LinkedHashMap<>();

    @Getter
    @Setter
    private Node root;

    @Getter
    @Setter
    private Node exit;

    public void addNode(Node node) {
        nodes.put(node.getUid(), node);
        nodesByType.put(node.getEventType(), node);
    }

    public Node getNode(String uid) {
        return nodes.get(uid);
    }

    public Node getNodeByType(String eventType) {
        return nodesByType.get(eventType);
    }

    public Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * 拓扑序（Kahn），同层按插入顺序，结果确定
     *
     * @throws IllegalStateException 图中仍有环
     */
    public List<Node> topologicalOrder() {
        Map<Node, Integer> inDegree = new HashMap<>();
        for (Node node : nodes.values()) {
            inDegree.put(node, node.getIncoming().size());
        }
        Deque<Node> ready = new ArrayDeque<>();
        for (Node node : nodes.values()) {
            if (inDegree.get(node) == 0) {
                ready.add(node);
            }
        }
        List<Node> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            Node node = ready.poll();
            order.add(node);
            for (Node successor : node.getOutgoing()) {
                int remaining = inDegree.merge(successor, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(successor);
                }
            }
        }
        if (order.size() != nodes.size()) {
            throw new IllegalStateException("节点图存在环，循环未完全折叠");
        }
        return order;
    }
}
