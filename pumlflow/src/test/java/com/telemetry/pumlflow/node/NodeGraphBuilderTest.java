package com.telemetry.pumlflow.node;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.event.EventGraph;
import com.telemetry.pumlflow.event.EventModelBuilder;
import com.telemetry.pumlflow.event.MarkovGraphBuilder;
import com.telemetry.pumlflow.logic.CombinatorialGateSolver;
import com.telemetry.pumlflow.logic.GateType;
import com.telemetry.pumlflow.logic.LogicInference;
import com.telemetry.pumlflow.loop.LoopDetector;
import com.telemetry.pumlflow.model.PvEvent;
import com.telemetry.pumlflow.pipeline.JobContext;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.telemetry.pumlflow.PumlFlowTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * NodeGraphBuilder 单元测试
 */
public class NodeGraphBuilderTest {

    private static final Logger log = LoggerFactory.getLogger(NodeGraphBuilderTest.class);

    private static NodeGraph build(EventGraph graph) {
        JobContext context = context();
        EventGraph folded = new LoopDetector(context).detect(graph);
        return new NodeGraphBuilder(context, new LogicInference(new CombinatorialGateSolver(), context))
                .build(folded);
    }

    private static List<String> types(List<Node> nodes) {
        List<String> types = new ArrayList<>();
        for (Node node : nodes) {
            types.add(node.getEventType());
        }
        return types;
    }

    @Test
    void testBuild_GateTreesAndNeighbours() {
        NodeGraph nodeGraph = build(graph(andSequence("j1")));

        Node a = nodeGraph.getNodeByType("A");
        Node d = nodeGraph.getNodeByType("D");
        assertEquals(PumlFlowConstants.DummyEvent.START, nodeGraph.getRoot().getEventType());
        assertNull(nodeGraph.getExit(), "顶层图没有出口");
        assertEquals(GateType.AND, a.getOutgoingTree().getGate());
        assertEquals(Arrays.asList("B", "C"), types(a.getOutgoing()));
        assertEquals(GateType.AND, d.getIncomingTree().getGate());
        assertTrue(nodeGraph.getNodeByType("B").getOutgoingTree().isLeaf(), "单个后继是顺序连接");
        assertTrue(a.hasTag(PumlEventTag.NORMAL));
        assertNotEquals(a.getUid(), d.getUid());
    }

    @Test
    void testBuild_RepeatedPredecessorTaggedMerge() {
        List<PvEvent> fanOut = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "B", "1"),
                event("j1", "4", "C", "2", "3"));

        NodeGraph nodeGraph = build(graph(fanOut));

        assertTrue(nodeGraph.getNodeByType("C").hasTag(PumlEventTag.MERGE));
        assertFalse(nodeGraph.getNodeByType("C").hasTag(PumlEventTag.NORMAL));
        assertTrue(nodeGraph.getNodeByType("A").getOutgoingTree().hasBranchCount());
    }

    @Test
    void testBuild_LoopBecomesSubGraphNode() {
        log.info("=== 测试: 循环节点内嵌子图 ===");
        NodeGraph nodeGraph = build(graph(selfLoopSequence("j1")));

        Node loop = nodeGraph.getNodeByType("LOOP_1");
        assertTrue(loop instanceof SubGraphNode);
        assertTrue(loop.hasTag(PumlEventTag.LOOP));
        NodeGraph body = ((SubGraphNode) loop).getSubGraph();
        assertEquals(PumlFlowConstants.DummyEvent.LOOP_START, body.getRoot().getEventType());
        assertEquals(PumlFlowConstants.DummyEvent.LOOP_END, body.getExit().getEventType());

        Map<String, Integer> counter = new HashMap<>();
        int total = NodeGraphBuilder.countNodes(nodeGraph, counter);
        log.info("节点统计: {}", counter);
        assertEquals(7, total, "顶层 START, A, LOOP_1, C 加循环体 LOOP_START, B, LOOP_END");
        assertEquals(1, counter.get("B").intValue());
    }

    @Test
    void testBuild_BreakMarkerTagged() {
        List<PvEvent> loop = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "C", "2"),
                event("j1", "4", "B", "3"),
                event("j1", "5", "C", "4"),
                event("j1", "6", "D", "5"));
        List<PvEvent> early = sequence(
                event("j2", "1", "A"),
                event("j2", "2", "B", "1"),
                event("j2", "3", "D", "2"));

        NodeGraph nodeGraph = build(graph(loop, early));
        NodeGraph body = ((SubGraphNode) nodeGraph.getNodeByType("LOOP_1")).getSubGraph();
        Node marker = body.getNodeByType(PumlFlowConstants.DummyEvent.BREAK_PREFIX + "B");

        assertNotNull(marker);
        assertTrue(marker.hasTag(PumlEventTag.BREAK));
        assertTrue(marker.isBreakMarker());
        assertFalse(marker.isStub(), "合成标记不是桩节点");
        assertEquals(GateType.XOR, body.getNodeByType("B").getOutgoingTree().getGate());
    }

    @Test
    void testBuild_SeveralRootsGetSyntheticRoot() {
        List<PvEvent> twoRoots = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B"),
                event("j1", "3", "C", "1", "2"));
        EventGraph graph = MarkovGraphBuilder.build(
                new EventModelBuilder(false).build(JOB, Collections.singletonList(twoRoots)));

        NodeGraph nodeGraph = build(graph);

        Node root = nodeGraph.getRoot();
        assertEquals(PumlFlowConstants.DummyEvent.ROOT, root.getEventType());
        assertEquals(GateType.OR, root.getOutgoingTree().getGate());
        assertEquals(Arrays.asList("A", "B"), types(root.getOutgoing()));
    }

    @Test
    void testTopologicalOrder_RootFirst() {
        NodeGraph nodeGraph = build(graph(andSequence("j1")));

        List<Node> order = nodeGraph.topologicalOrder();

        assertEquals(nodeGraph.size(), order.size());
        assertSame(nodeGraph.getRoot(), order.get(0));
        assertTrue(order.indexOf(nodeGraph.getNodeByType("D")) > order.indexOf(nodeGraph.getNodeByType("C")));
    }
}
