package com.telemetry.pumlflow.node;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.event.Event;
import com.telemetry.pumlflow.event.EventGraph;
import com.telemetry.pumlflow.event.EventSet;
import com.telemetry.pumlflow.exception.PumlFlowException;
import com.telemetry.pumlflow.logic.GateTree;
import com.telemetry.pumlflow.logic.GateType;
import com.telemetry.pumlflow.logic.LogicInference;
import com.telemetry.pumlflow.loop.LoopEvent;
import com.telemetry.pumlflow.pipeline.JobContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 嵌套节点图构建器：折叠后的事件图 -> 节点图
 *
 * 循环事件变为 {@link SubGraphNode}，其内嵌图由本构建器对循环子图递归构建（自底向上，每个节点只访问一次）
 */
@Slf4j
public class NodeGraphBuilder {

    private static final String TAG = PumlFlowConstants.LogTag.NODE_GRAPH;

    private final JobContext context;
    private final LogicInference logicInference;

    public NodeGraphBuilder(JobContext context, LogicInference logicInference) {
        this.context = context;
        this.logicInference = logicInference;
    }

    public NodeGraph build(EventGraph graph) {
        NodeGraph nodeGraph = build(graph, Collections.emptySet());
        log.info("{}-> job={} 顶层节点数: {}", TAG, context.getJobName(), nodeGraph.size());
        return nodeGraph;
    }

    private NodeGraph build(EventGraph graph, Set<String> breakTypes) {
        NodeGraph nodeGraph = new NodeGraph();

        // 阶段1: 创建节点（循环节点先递归构建内嵌图）
        for (Event event : graph.getEvents().values()) {
            Node node;
            if (event instanceof LoopEvent) {
                LoopEvent loopEvent = (LoopEvent) event;
                NodeGraph subGraph = build(loopEvent.getSubGraph(), loopEvent.getBreakTypes());
                node = new SubGraphNode(context.nextUid(event.getEventType()), event.getEventType(), subGraph,
                        loopEvent.getStartTypes(), loopEvent.getEndTypes(), loopEvent.getBreakTypes());
                log.debug("{}-> 循环节点 {} 内嵌 {} 个节点", TAG, node.getUid(), subGraph.size());
            } else {
                node = new Node(context.nextUid(event.getEventType()), event.getEventType());
            }
            if (breakTypes.contains(event.getEventType())) {
                node.addTag(PumlEventTag.BREAK);
                node.setStub(!node.isDummy());
            }
            for (EventSet eventSet : event.getIncoming()) {
                node.addIncomingSet(eventSet);
                if (hasMultipleInstances(eventSet)) {
                    node.addTag(PumlEventTag.MERGE);
                }
            }
            node.setOutgoingTree(logicInference.inferOutgoing(event));
            node.setIncomingTree(logicInference.inferIncoming(event));
            nodeGraph.addNode(node);
        }

        // 阶段2: 连边
        for (Event event : graph.getEvents().values()) {
            Node source = nodeGraph.getNodeByType(event.getEventType());
            for (String target : graph.successors(event.getEventType())) {
                source.addOutgoing(nodeGraph.getNodeByType(target));
            }
        }
        for (Node node : nodeGraph.getNodes()) {
            if (node.getTags().isEmpty()) {
                node.addTag(PumlEventTag.NORMAL);
            }
        }

        // 阶段3: 根与出口
        nodeGraph.setRoot(findRoot(nodeGraph));
        nodeGraph.setExit(nodeGraph.getNodeByType(PumlFlowConstants.DummyEvent.LOOP_END));
        return nodeGraph;
    }

    private static boolean hasMultipleInstances(EventSet eventSet) {
        for (Integer count : eventSet.getCounts().values()) {
            if (count > 1) {
                return true;
            }
        }
        return false;
    }

    /**
     * 合成起点优先；否则取唯一的无入边节点；多个无入边节点时补充一个合成根，以 OR 连接它们
     */
    private Node findRoot(NodeGraph nodeGraph) {
        Node start = nodeGraph.getNodeByType(PumlFlowConstants.DummyEvent.START);
        if (start == null) {
            start = nodeGraph.getNodeByType(PumlFlowConstants.DummyEvent.LOOP_START);
        }
        if (start != null) {
            return start;
        }
        List<Node> roots = new ArrayList<>();
        for (Node node : nodeGraph.getNodes()) {
            if (node.getIncoming().isEmpty()) {
                roots.add(node);
            }
        }
        if (roots.isEmpty()) {
            throw new PumlFlowException("节点图没有根节点: job=" + context.getJobName());
        }
        if (roots.size() == 1) {
            return roots.get(0);
        }
        log.warn("{}-> job={} 存在多个根节点 {}，补充合成根并以 OR 连接", TAG, context.getJobName(), roots);
        Node root = new Node(context.nextUid(PumlFlowConstants.DummyEvent.ROOT), PumlFlowConstants.DummyEvent.ROOT);
        List<GateTree> leaves = new ArrayList<>();
        for (Node node : roots) {
            root.addOutgoing(node);
            node.addIncomingSet(EventSet.of(PumlFlowConstants.DummyEvent.ROOT));
            leaves.add(GateTree.leaf(node.getEventType()));
        }
        root.setOutgoingTree(GateTree.gate(GateType.OR, leaves));
        root.addTag(PumlEventTag.NORMAL);
        nodeGraph.addNode(root);
        return root;
    }

    /**
     * 按类型统计节点（含内嵌图），用于日志和测试
     */
    public static int countNodes(NodeGraph graph, Map<String, Integer> counter) {
        int total = 0;
        for (Node node : graph.getNodes()) {
            counter.merge(node.getEventType(), 1, Integer::sum);
            total++;
            if (node instanceof SubGraphNode) {
                total += countNodes(((SubGraphNode) node).getSubGraph(), counter);
            }
        }
        return total;
    }
}
