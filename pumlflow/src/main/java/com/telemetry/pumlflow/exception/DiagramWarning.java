package com.telemetry.pumlflow.exception;

import lombok.Getter;

/**
 * 可恢复问题的记录，随图一起返回给调用方
 */
@Getter
public class DiagramWarning {

    public enum Kind {
        /** 逻辑门推断失败，退化为 OR */
        AMBIGUOUS_LOGIC,
        /** 分支找不到汇合点，强制 detach */
        MERGE_NOT_FOUND,
        /** 同类型逻辑块首尾相接，无法区分嵌套还是同一块 */
        BUNCHED_AMBIGUITY
    }

    private final Kind kind;
    private final String subject;
    private final String message;

    public DiagramWarning(Kind kind, String subject, String message) {
        this.kind = kind;
        this.subject = subject;
        this.message = message;
    }

    @Override
    public String toString() {
        return kind + "[" + subject + "]: " + message;
    }
}
