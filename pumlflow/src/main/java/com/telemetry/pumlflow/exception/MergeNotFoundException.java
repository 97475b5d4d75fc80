package com.telemetry.pumlflow.exception;

import lombok.Getter;

/**
 * 遍历时分支离开了当前逻辑块却没有到达它的汇合点
 *
 * 可恢复：遍历器强制生成 detach 并标记
 */
@Getter
public class MergeNotFoundException extends PumlFlowException {

    private final String nodeUid;

    public MergeNotFoundException(String nodeUid, String message) {
        super(message);
        this.nodeUid = nodeUid;
    }
}
