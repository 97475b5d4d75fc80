package com.telemetry.pumlflow.walker;

import com.telemetry.pumlflow.node.Node;
import com.telemetry.pumlflow.node.NodeGraph;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 无环节点图上的可达性（含自身），按拓扑序编号
 */
class Reachability {

    private final List<Node> order;
    private final Map<Node, Integer> index = new HashMap<>();
    private final Map<Node, BitSet> reach = new HashMap<>();

    Reachability(NodeGraph graph) {
        this.order = graph.topologicalOrder();
        for (int i = 0; i < order.size(); i++) {
            index.put(order.get(i), i);
        }
        for (int i = order.size() - 1; i >= 0; i--) {
            Node node = order.get(i);
            BitSet bits = new BitSet(order.size());
            bits.set(i);
            for (Node successor : node.getOutgoing()) {
                bits.or(reach.get(successor));
            }
            reach.put(node, bits);
        }
    }

    /**
     * 从 node 出发可达的节点（含自身），返回副本
     */
    BitSet from(Node node) {
        return (BitSet) reach.get(node).clone();
    }

    boolean reaches(Node from, Node to) {
        return reach.get(from).get(index.get(to));
    }

    boolean reaches(BitSet bits, Node to) {
        return bits.get(index.get(to));
    }

    int indexOf(Node node) {
        return index.get(node);
    }

    /**
     * 集合中不被集合内其他节点到达的节点，按拓扑序
     */
    List<Node> earliest(BitSet nodes) {
        List<Node> result = new ArrayList<>();
        for (int i = nodes.nextSetBit(0); i >= 0; i = nodes.nextSetBit(i + 1)) {
            boolean reachedByOther = false;
            for (int j = nodes.nextSetBit(0); j >= 0; j = nodes.nextSetBit(j + 1)) {
                if (j != i && reach.get(order.get(j)).get(i)) {
                    reachedByOther = true;
                    break;
                }
            }
            if (!reachedByOther) {
                result.add(order.get(i));
            }
        }
        return result;
    }
}
