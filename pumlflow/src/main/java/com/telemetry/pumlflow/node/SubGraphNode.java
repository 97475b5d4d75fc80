package com.telemetry.pumlflow.node;

import lombok.Getter;

import java.util.Collections;
import java.util.Set;

/**
 * 循环节点：内嵌循环体的节点图
 *
 * 内嵌图的起点/终点/break 与产生它的循环事件一致
 */
@Getter
public class SubGraphNode extends Node {

    private final NodeGraph subGraph;
    private final Set<String> startTypes;
    private final Set<String> endTypes;
    private final Set<String> breakTypes;

    public SubGraphNode(String uid, String eventType, NodeGraph subGraph,
                        Set<String> startTypes, Set<String> endTypes, Set<String> breakTypes) {
        super(uid, eventType);
        this.subGraph = subGraph;
        this.startTypes = Collections.unmodifiableSet(startTypes);
        this.endTypes = Collections.unmodifiableSet(endTypes);
        this.breakTypes = Collections.unmodifiableSet(breakTypes);
        addTag(PumlEventTag.LOOP);
    }
}
