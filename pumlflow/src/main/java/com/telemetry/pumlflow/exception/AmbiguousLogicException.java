package com.telemetry.pumlflow.exception;

/**
 * 找不到能复现全部观测事件集合的逻辑门分组
 *
 * 可恢复：调用方退化为所有分支的 OR，并在结果中标记该事件
 */
public class AmbiguousLogicException extends PumlFlowException {

    public AmbiguousLogicException(String message) {
        super(message);
    }
}
