package com.telemetry.pumlflow.puml;

import com.telemetry.pumlflow.config.PumlFlowConfig;
import com.telemetry.pumlflow.logic.GateType;
import com.telemetry.pumlflow.node.PumlEventTag;
import com.telemetry.pumlflow.pipeline.DiagramPipeline;
import com.telemetry.pumlflow.pipeline.JobContext;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.TreeSet;

import static com.telemetry.pumlflow.PumlFlowTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * PumlWriter / PumlGraph 单元测试
 */
public class PumlWriterTest {

    @Test
    void testWrite_WrapperAndIndentation() {
        String puml = new DiagramPipeline().run(context(), model(andSequence("j1")));

        String expected = String.join("\n",
                "@startuml",
                "    partition \"job\" {",
                "        group \"job\"",
                "            :A;",
                "            fork",
                "                :B;",
                "            fork again",
                "                :C;",
                "            end fork",
                "            :D;",
                "        end group",
                "    }",
                "@enduml") + "\n";
        assertEquals(expected, puml);
    }

    @Test
    void testWrite_LoopBodyIndentedWithConfiguredTab() {
        PumlFlowConfig config = new PumlFlowConfig();
        config.setTabSize(2);

        String puml = new DiagramPipeline().run(new JobContext(JOB, config), model(selfLoopSequence("j1")));

        String expected = String.join("\n",
                "@startuml",
                "  partition \"job\" {",
                "    group \"job\"",
                "      :A;",
                "      repeat",
                "        :B;",
                "      repeat while",
                "      :C;",
                "    end group",
                "  }",
                "@enduml") + "\n";
        assertEquals(expected, puml);
    }

    @Test
    void testGraph_KillHasNoOutgoingEdge() {
        PumlGraph graph = new PumlGraph();
        PumlNode a = graph.addEvent("A", Collections.singleton(PumlEventTag.NORMAL), null);
        PumlNode kill = graph.addKill(false);
        graph.addEdge(a, kill);

        assertThrows(IllegalStateException.class, () -> graph.addEdge(kill, a));
        assertSame(a, graph.getStartNode());
        assertEquals("KILL_1", kill.getId());
    }

    @Test
    void testGraph_EdgesDeduplicated() {
        PumlGraph graph = new PumlGraph();
        PumlNode a = graph.addEvent("A", Collections.emptySet(), null);
        PumlNode b = graph.addEvent("B", Collections.emptySet(), new TreeSet<>(Arrays.asList(1)));
        graph.addEdge(a, b);
        graph.addEdge(a, b);

        assertEquals(1, graph.edgeCount());
        assertTrue(graph.hasEdge(a, b));
        assertNull(b.getBranchNumber(), "次数为 1 不是分支计数");
        assertEquals("A_1", a.getId());
    }

    @Test
    void testWrite_EmptyBranchAndDetach() {
        PumlGraph graph = new PumlGraph();
        PumlNode a = graph.addEvent("A", Collections.emptySet(), null);
        int block = graph.nextBlockId();
        PumlNode start = graph.addOperator(GateType.OR, PumlNode.Role.START, block);
        PumlNode end = graph.addOperator(GateType.OR, PumlNode.Role.END, block);
        graph.addEdge(a, start);
        PumlNode b = graph.addEvent("B", Collections.emptySet(), null);
        graph.addEdge(start, b);
        graph.addEdge(b, end);
        PumlNode path = graph.addOperator(GateType.OR, PumlNode.Role.PATH, block);
        graph.addEdge(start, path);
        PumlNode c = graph.addEvent("C", Collections.emptySet(), null);
        graph.addEdge(path, c);
        graph.addEdge(c, graph.addKill(false));

        assertEquals(Arrays.asList(":A;", "split", ":B;", "split again", ":C;", "detach", "end split"),
                contentLines(PumlWriter.write(graph, JOB, 4)).subList(3, 10));
        assertSame(end, graph.blockEnd(block));
    }
}
