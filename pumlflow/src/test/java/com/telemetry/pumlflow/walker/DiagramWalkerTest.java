package com.telemetry.pumlflow.walker;

import com.telemetry.pumlflow.event.EventGraph;
import com.telemetry.pumlflow.exception.DiagramWarning;
import com.telemetry.pumlflow.logic.CombinatorialGateSolver;
import com.telemetry.pumlflow.logic.GateType;
import com.telemetry.pumlflow.logic.LogicInference;
import com.telemetry.pumlflow.loop.LoopDetector;
import com.telemetry.pumlflow.model.PvEvent;
import com.telemetry.pumlflow.node.NodeGraph;
import com.telemetry.pumlflow.node.NodeGraphBuilder;
import com.telemetry.pumlflow.pipeline.JobContext;
import com.telemetry.pumlflow.puml.PumlGraph;
import com.telemetry.pumlflow.puml.PumlNode;
import com.telemetry.pumlflow.puml.PumlWriter;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.telemetry.pumlflow.PumlFlowTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * DiagramWalker 单元测试
 *
 * 验证目标：
 * 1. 每个逻辑块的 START/END 成对，非首个分支由 PATH 引出
 * 2. 汇合点计算（AND/XOR/嵌套/首尾相接）
 * 3. 终止节点没有出边，无法汇合的分支强制终止并告警
 * 4. 相同输入的输出完全相同
 */
public class DiagramWalkerTest {

    private static final Logger log = LoggerFactory.getLogger(DiagramWalkerTest.class);

    @SafeVarargs
    private static PumlGraph walk(JobContext context, List<PvEvent>... sequences) {
        EventGraph folded = new LoopDetector(context).detect(graph(sequences));
        NodeGraph nodeGraph = new NodeGraphBuilder(context,
                new LogicInference(new CombinatorialGateSolver(), context)).build(folded);
        return new DiagramWalker(context).walk(nodeGraph);
    }

    private static List<String> render(PumlGraph diagram) {
        List<String> lines = contentLines(PumlWriter.write(diagram, JOB, 4));
        // 去掉 @startuml / partition / group 包裹
        return lines.subList(3, lines.size() - 3);
    }

    private static void assertWellFormed(PumlGraph diagram) {
        assertEquals(diagram.countOperators(PumlNode.Role.START), diagram.countOperators(PumlNode.Role.END),
                "逻辑块 START/END 必须成对");
        for (PumlNode node : diagram.getNodes()) {
            if (node.getKind() == PumlNode.Kind.KILL) {
                assertTrue(diagram.successors(node).isEmpty(), "终止节点不能有出边: " + node);
            }
            if (node.isOperator(PumlNode.Role.PATH)) {
                assertEquals(1, diagram.predecessors(node).size());
                assertTrue(diagram.predecessors(node).get(0).isOperator(PumlNode.Role.START));
            }
        }
    }

    @Test
    void testAndBlock_ForkAndMerge() {
        log.info("=== 测试: A -> AND(B, C) -> D ===");
        JobContext context = context();

        PumlGraph diagram = walk(context, andSequence("j1"));
        List<String> lines = render(diagram);
        log.info("输出: {}", lines);

        assertEquals(Arrays.asList(":A;", "fork", ":B;", "fork again", ":C;", "end fork", ":D;"), lines);
        assertEquals(1, diagram.countOperators(PumlNode.Role.START));
        assertEquals(1, diagram.countOperators(PumlNode.Role.PATH));
        assertEquals(0, diagram.getKillCount());
        assertTrue(context.getWarnings().isEmpty());
        assertWellFormed(diagram);
        log.info("✅ 测试通过");
    }

    @Test
    void testXorBlock_IfElseif() {
        List<PvEvent> viaB = sequence(event("j1", "1", "A"), event("j1", "2", "B", "1"), event("j1", "3", "D", "2"));
        List<PvEvent> viaC = sequence(event("j2", "1", "A"), event("j2", "2", "C", "1"), event("j2", "3", "D", "2"));

        List<String> lines = render(walk(context(), viaB, viaC));

        assertEquals(Arrays.asList(":A;", "if (XOR) then (true)", ":B;", "elseif (XOR) then (true)", ":C;",
                "endif", ":D;"), lines);
    }

    @Test
    void testBranchCount_RepeatWrapper() {
        List<PvEvent> fanOut = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "B", "1"),
                event("j1", "4", "B", "1"),
                event("j1", "5", "C", "2", "3", "4"));

        PumlGraph diagram = walk(context(), fanOut);

        assertEquals(Arrays.asList(":A;", "repeat", ":B;", "repeat while (BC1 = 3)", ":C;"), render(diagram));
        assertEquals(1, diagram.getBranchCount());
    }

    @Test
    void testBranchCount_VaryingRange() {
        List<PvEvent> two = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "B", "1"));
        List<PvEvent> three = sequence(
                event("j2", "1", "A"),
                event("j2", "2", "B", "1"),
                event("j2", "3", "B", "1"),
                event("j2", "4", "B", "1"));

        assertTrue(render(walk(context(), two, three)).contains("repeat while (BC1 in 2..3)"));
    }

    @Test
    void testDeadBranch_KilledInsideBlock() {
        log.info("=== 测试: AND 分支中的 XOR 有一条路径不再汇合 ===");
        List<PvEvent> joined = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "C", "1"),
                event("j1", "4", "D", "2", "3"));
        List<PvEvent> stopped = sequence(
                event("j2", "1", "A"),
                event("j2", "2", "B", "1"),
                event("j2", "3", "C", "1"),
                event("j2", "4", "E", "3"),
                event("j2", "5", "D", "2"));
        JobContext context = context();

        PumlGraph diagram = walk(context, joined, stopped);
        List<String> lines = render(diagram);
        log.info("输出: {}", lines);

        assertEquals(Arrays.asList(":A;", "fork", ":B;", "fork again", ":C;",
                "if (XOR) then (true)", "elseif (XOR) then (true)", ":E;", "detach", "endif",
                "end fork", ":D;"), lines);
        assertEquals(1, diagram.getKillCount());
        assertTrue(context.getWarnings().isEmpty(), "走到尽头的分支是正常的终止路径");
        assertWellFormed(diagram);
    }

    @Test
    void testAllBranchesKilled_EndWithoutIncomingEdge() {
        log.info("=== 测试: XOR 分支中的 AND 两条路径都不再汇合 ===");
        List<PvEvent> joined = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "C", "1"),
                event("j1", "4", "D", "2", "3"));
        List<PvEvent> stopped = sequence(
                event("j2", "1", "A"),
                event("j2", "2", "B", "1"),
                event("j2", "3", "C", "1"),
                event("j2", "4", "E", "3"),
                event("j2", "5", "F", "3"),
                event("j2", "6", "D", "2"));

        PumlGraph diagram = walk(context(), joined, stopped);
        List<String> lines = render(diagram);
        log.info("输出: {}", lines);

        assertEquals("detach", lines.get(lines.indexOf(":E;") + 1));
        assertEquals("detach", lines.get(lines.indexOf(":F;") + 1));
        assertEquals(":D;", lines.get(lines.size() - 1));
        assertEquals(2, diagram.getKillCount());
        assertWellFormed(diagram);

        List<PumlNode> orphanEnds = new ArrayList<>();
        for (PumlNode node : diagram.getNodes()) {
            if (node != diagram.getStartNode() && diagram.predecessors(node).isEmpty()) {
                assertTrue(node.isOperator(PumlNode.Role.END), "只有全部终止的逻辑块 END 没有入边: " + node);
                orphanEnds.add(node);
            }
        }
        assertEquals(1, orphanEnds.size());
        assertEquals(GateType.AND, orphanEnds.get(0).getGate());
        assertTrue(diagram.successors(orphanEnds.get(0)).isEmpty());
        log.info("✅ 测试通过");
    }

    @Test
    void testNoCommonSuccessor_BranchesEndTogether() {
        List<PvEvent> viaB = sequence(event("j1", "1", "A"), event("j1", "2", "B", "1"), event("j1", "3", "D", "2"));
        List<PvEvent> viaC = sequence(event("j2", "1", "A"), event("j2", "2", "C", "1"));

        PumlGraph diagram = walk(context(), viaB, viaC);

        assertEquals(Arrays.asList(":A;", "if (XOR) then (true)", ":B;", ":D;", "elseif (XOR) then (true)", ":C;",
                "endif"), render(diagram));
        assertEquals(0, diagram.getKillCount());
    }

    @Test
    void testBunchedSameType_KeptAsTwoBlocksWithWarning() {
        log.info("=== 测试: AND 块结束后紧接着打开 AND 块 ===");
        List<PvEvent> bunched = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "C", "1"),
                event("j1", "4", "X", "2", "3"),
                event("j1", "5", "Y", "2", "3"),
                event("j1", "6", "Z", "4", "5"));
        JobContext context = context();

        PumlGraph diagram = walk(context, bunched);
        List<String> lines = render(diagram);
        log.info("输出: {}", lines);

        assertEquals(Arrays.asList(":A;", "fork", ":B;", "fork again", ":C;", "end fork",
                "fork", ":X;", "fork again", ":Y;", "end fork", ":Z;"), lines);
        assertTrue(context.hasWarning(DiagramWarning.Kind.BUNCHED_AMBIGUITY));
        assertWellFormed(diagram);
    }

    @Test
    void testEscapingBranch_ForcedKillWithWarning() {
        log.info("=== 测试: 内层分支越过内层汇合点直接到达外层汇合点 ===");
        List<PvEvent> viaP = sequence(
                event("j1", "1", "R"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "C", "1"),
                event("j1", "4", "P", "3"),
                event("j1", "5", "K", "4"),
                event("j1", "6", "M", "2", "5"));
        List<PvEvent> viaQ = sequence(
                event("j2", "1", "R"),
                event("j2", "2", "B", "1"),
                event("j2", "3", "C", "1"),
                event("j2", "4", "Q", "3"),
                event("j2", "5", "K", "4"),
                event("j2", "6", "M", "2", "5", "4"));
        JobContext context = context();

        PumlGraph diagram = walk(context, viaP, viaQ);
        List<String> lines = render(diagram);
        log.info("输出: {}", lines);

        assertTrue(context.hasWarning(DiagramWarning.Kind.MERGE_NOT_FOUND));
        assertEquals(1, diagram.getKillCount());
        assertTrue(lines.contains("detach"));
        assertEquals(":M;", lines.get(lines.size() - 1));
        assertWellFormed(diagram);
    }

    @Test
    void testLoopBody_SplicedIntoPlaceholder() {
        PumlGraph diagram = walk(context(), selfLoopSequence("j1"));

        PumlNode placeholder = null;
        for (PumlNode node : diagram.getNodes()) {
            if (node.getSubGraphUid() != null) {
                placeholder = node;
            }
        }
        assertNotNull(placeholder);
        assertEquals("LOOP_1", placeholder.getEventType());
        assertNotNull(placeholder.getSubDiagram(), "循环体已回填");
        assertEquals(1, placeholder.getSubDiagram().size(), "循环体只有 B，合成起止不输出");
        assertEquals(Arrays.asList(":A;", "repeat", ":B;", "repeat while", ":C;"), render(diagram));
    }

    @Test
    void testNestedLoop_BodiesSplicedAtBothLevels() {
        log.info("=== 测试: 循环内嵌循环逐层回填 ===");
        List<PvEvent> nested = sequence(
                event("j1", "1", "A"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "C", "2"),
                event("j1", "4", "C", "3"),
                event("j1", "5", "B", "4"),
                event("j1", "6", "C", "5"),
                event("j1", "7", "D", "6"));

        PumlGraph diagram = walk(context(), nested);
        List<String> lines = render(diagram);
        log.info("输出: {}", lines);

        assertEquals(Arrays.asList(":A;", "repeat", ":B;", "repeat", ":C;", "repeat while", "repeat while", ":D;"),
                lines);
        assertWellFormed(diagram);
        log.info("✅ 测试通过");
    }

    @Test
    void testLoopBreak_RendersBreak() {
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
                event("j2", "3", "E", "2"));

        List<String> lines = render(walk(context(), loop, early));
        log.info("输出: {}", lines);

        assertEquals(Arrays.asList(":A;", "repeat", ":B;", "if (XOR) then (true)", "elseif (XOR) then (true)",
                ":E;", "break", "endif", ":C;", "repeat while", ":D;"), lines);
    }

    @Test
    void testWalk_Deterministic() {
        List<PvEvent> viaP = sequence(
                event("j1", "1", "R"),
                event("j1", "2", "B", "1"),
                event("j1", "3", "C", "1"),
                event("j1", "4", "B", "2"),
                event("j1", "5", "D", "3", "4"));

        String first = PumlWriter.write(walk(context(), viaP, andSequence("j2")), JOB, 4);
        String second = PumlWriter.write(walk(context(), viaP, andSequence("j2")), JOB, 4);

        assertEquals(first, second);
    }
}
