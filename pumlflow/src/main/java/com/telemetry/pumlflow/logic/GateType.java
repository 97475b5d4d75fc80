package com.telemetry.pumlflow.logic;

/**
 * 逻辑门类型
 */
public enum GateType {
    /** 所有分支都发生 */
    AND,
    /** 至少一个分支发生 */
    OR,
    /** 恰好一个分支发生 */
    XOR
}
