package com.telemetry.pumlflow.exception;

/**
 * 图生成异常基类
 *
 * 致命异常只中止触发它的单个 job，其余 job 不受影响
 */
public class PumlFlowException extends RuntimeException {

    public PumlFlowException(String message) {
        super(message);
    }

    public PumlFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
