package com.telemetry.pumlflow.logic;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.event.Event;
import com.telemetry.pumlflow.event.EventSet;
import com.telemetry.pumlflow.exception.AmbiguousLogicException;
import com.telemetry.pumlflow.exception.DiagramWarning;
import com.telemetry.pumlflow.pipeline.JobContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 逻辑门标注
 *
 * 为事件推断出向、入向逻辑门树；推断失败时退化为全部分支的 OR 并记录告警。
 * 不修改事件本身。
 */
@Slf4j
public class LogicInference {

    private static final String TAG = PumlFlowConstants.LogTag.LOGIC;

    private final LogicGateSolver solver;
    private final JobContext context;

    public LogicInference(LogicGateSolver solver, JobContext context) {
        this.solver = solver;
        this.context = context;
    }

    /**
     * @return 出向逻辑门树，没有后继时返回 null
     */
    public GateTree inferOutgoing(Event event) {
        return infer(event.getEventType(), event.getOutgoing());
    }

    /**
     * 入向逻辑只用于汇合判断，无法确定时直接退化为 OR，不记录告警
     *
     * @return 入向逻辑门树，没有前驱时返回 null
     */
    public GateTree inferIncoming(Event event) {
        if (event.getIncoming().isEmpty()) {
            return null;
        }
        try {
            return solver.inferGroups(event.getIncoming());
        } catch (AmbiguousLogicException e) {
            log.debug("{}-> {} 入向逻辑退化为 OR: {}", TAG, event.getEventType(), e.getMessage());
            return fallbackOr(event.getIncoming());
        }
    }

    private GateTree infer(String eventType, Collection<EventSet> eventSets) {
        if (eventSets.isEmpty()) {
            return null;
        }
        try {
            GateTree tree = solver.inferGroups(eventSets);
            log.debug("{}-> {} 出向逻辑: {}", TAG, eventType, tree);
            return tree;
        } catch (AmbiguousLogicException e) {
            log.warn("{}-> {} 出向逻辑无法确定，退化为 OR: {}", TAG, eventType, e.getMessage());
            context.addWarning(DiagramWarning.Kind.AMBIGUOUS_LOGIC, eventType, e.getMessage());
            return fallbackOr(eventSets);
        }
    }

    /**
     * 所有出现过的类型组成的 OR，必然接受每个事件集合
     */
    static GateTree fallbackOr(Collection<EventSet> eventSets) {
        Map<String, SortedSet<Integer>> counts = new TreeMap<>();
        for (EventSet eventSet : eventSets) {
            for (Map.Entry<String, Integer> entry : eventSet.getCounts().entrySet()) {
                counts.computeIfAbsent(entry.getKey(), k -> new TreeSet<>()).add(entry.getValue());
            }
        }
        List<GateTree> leaves = new ArrayList<>();
        for (Map.Entry<String, SortedSet<Integer>> entry : counts.entrySet()) {
            leaves.add(GateTree.leaf(entry.getKey(), entry.getValue()));
        }
        return leaves.size() == 1 ? leaves.get(0) : GateTree.gate(GateType.OR, leaves);
    }
}
