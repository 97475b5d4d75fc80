package com.telemetry.pumlflow.node;

/**
 * 节点在图中的事件角色
 */
public enum PumlEventTag {
    NORMAL,
    /** 汇合同一类型的多个并发实例 */
    MERGE,
    /** 循环内的 break 终止点 */
    BREAK,
    /** 循环 */
    LOOP
}
