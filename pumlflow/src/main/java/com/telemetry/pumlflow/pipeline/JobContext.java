package com.telemetry.pumlflow.pipeline;

import com.telemetry.pumlflow.config.PumlFlowConfig;
import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.exception.DiagramWarning;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个 job 的处理上下文
 *
 * 贯穿所有阶段：循环命名计数、节点 uid 计数、可恢复问题的记录。
 * 每个 job 独占一个实例，只在处理该 job 的线程中使用。
 */
public class JobContext {

    @Getter
    private final String jobName;

    @Getter
    private final PumlFlowConfig config;

    private final List<DiagramWarning> warnings = new ArrayList<>();

    private int loopCounter;
    private int uidCounter;

    public JobContext(String jobName, PumlFlowConfig config) {
        this.jobName = jobName;
        this.config = config;
    }

    /**
     * 下一个循环事件类型：LOOP_1, LOOP_2 ...
     */
    public String nextLoopType() {
        loopCounter++;
        return PumlFlowConstants.Loop.EVENT_PREFIX + loopCounter;
    }

    /**
     * 节点图中全局唯一的节点 id
     */
    public String nextUid(String eventType) {
        uidCounter++;
        return eventType + "#" + uidCounter;
    }

    public void addWarning(DiagramWarning.Kind kind, String subject, String message) {
        warnings.add(new DiagramWarning(kind, subject, message));
    }

    public List<DiagramWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasWarning(DiagramWarning.Kind kind) {
        for (DiagramWarning warning : warnings) {
            if (warning.getKind() == kind) {
                return true;
            }
        }
        return false;
    }
}
