package com.telemetry.pumlflow.pipeline;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.event.Event;
import com.telemetry.pumlflow.event.EventGraph;
import com.telemetry.pumlflow.event.EventModel;
import com.telemetry.pumlflow.event.MarkovGraphBuilder;
import com.telemetry.pumlflow.logic.CombinatorialGateSolver;
import com.telemetry.pumlflow.logic.LogicGateSolver;
import com.telemetry.pumlflow.logic.LogicInference;
import com.telemetry.pumlflow.loop.LoopDetector;
import com.telemetry.pumlflow.node.NodeGraph;
import com.telemetry.pumlflow.node.NodeGraphBuilder;
import com.telemetry.pumlflow.puml.PumlGraph;
import com.telemetry.pumlflow.puml.PumlWriter;
import com.telemetry.pumlflow.walker.DiagramWalker;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 单个 job 的处理流水线
 *
 * 马尔可夫图 -> 循环折叠 -> 嵌套节点图 -> 遍历 -> PlantUML 文本，每个阶段消费上一阶段的完整输出
 */
@Slf4j
public class DiagramPipeline {

    private static final String TAG = PumlFlowConstants.LogTag.PIPELINE;

    private final LogicGateSolver solver;

    public DiagramPipeline() {
        this(new CombinatorialGateSolver());
    }

    public DiagramPipeline(LogicGateSolver solver) {
        this.solver = solver;
    }

    /**
     * 从接入的事件模型生成 PlantUML 文本
     */
    public String run(JobContext context, EventModel model) {
        return render(context, buildDiagram(context, MarkovGraphBuilder.build(model)));
    }

    /**
     * 从聚合好的事件集合视图（事件类型 -> 出向/入向事件集合）生成 PlantUML 文本
     */
    public String run(JobContext context, Map<String, ? extends Event> events) {
        return render(context, buildDiagram(context, MarkovGraphBuilder.build(events)));
    }

    /**
     * 事件图 -> 输出图
     */
    public PumlGraph buildDiagram(JobContext context, EventGraph graph) {
        long startTime = System.currentTimeMillis();
        log.info("{}-> job={} 开始, 事件类型数: {}, 边数: {}", TAG, context.getJobName(),
                graph.size(), graph.edgeCount());

        EventGraph folded = new LoopDetector(context).detect(graph);
        NodeGraph nodeGraph = new NodeGraphBuilder(context, new LogicInference(solver, context)).build(folded);
        PumlGraph diagram = new DiagramWalker(context).walk(nodeGraph);

        log.info("{}-> job={} 完成, 告警数: {}, 耗时: {}ms", TAG, context.getJobName(),
                context.getWarnings().size(), System.currentTimeMillis() - startTime);
        return diagram;
    }

    public String render(JobContext context, PumlGraph diagram) {
        return PumlWriter.write(diagram, context.getJobName(), context.getConfig().getTabSize());
    }
}
