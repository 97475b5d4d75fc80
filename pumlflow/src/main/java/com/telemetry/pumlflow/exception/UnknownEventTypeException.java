package com.telemetry.pumlflow.exception;

import lombok.Getter;

/**
 * 事件集合引用了从未作为节点出现的事件类型（输入数据不一致，致命）
 */
@Getter
public class UnknownEventTypeException extends PumlFlowException {

    private final String eventType;
    private final String referencedBy;

    public UnknownEventTypeException(String eventType, String referencedBy) {
        super("未知事件类型: " + eventType + " (被 " + referencedBy + " 的事件集合引用)");
        this.eventType = eventType;
        this.referencedBy = referencedBy;
    }
}
