package com.telemetry.pumlflow.exception;

import lombok.Getter;

import java.util.Set;

/**
 * 强连通分量没有任何外部入口（上游存在脱离的环，致命）
 */
@Getter
public class UnreachableLoopException extends PumlFlowException {

    private final Set<String> loopNodes;

    public UnreachableLoopException(Set<String> loopNodes) {
        super("循环没有可计算的起点: " + loopNodes);
        this.loopNodes = loopNodes;
    }
}
