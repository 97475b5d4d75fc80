package com.telemetry.pumlflow.loop;

import com.telemetry.pumlflow.event.Event;
import com.telemetry.pumlflow.event.EventGraph;
import com.telemetry.pumlflow.event.EventSet;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;

/**
 * 在父图中代替整个循环的事件
 *
 * 持有循环内部的子图，子图自包含：外部连接已替换为合成起点/终点/break 标记
 */
@Getter
public class LoopEvent extends Event {

    private final EventGraph subGraph;
    private final Set<String> startTypes;
    private final Set<String> endTypes;
    private final Set<String> breakTypes;

    public LoopEvent(String eventType, Collection<EventSet> outgoing, Collection<EventSet> incoming,
                     EventGraph subGraph, Set<String> startTypes, Set<String> endTypes, Set<String> breakTypes) {
        super(eventType, outgoing, incoming);
        this.subGraph = subGraph;
        this.startTypes = Collections.unmodifiableSet(startTypes);
        this.endTypes = Collections.unmodifiableSet(endTypes);
        this.breakTypes = Collections.unmodifiableSet(breakTypes);
    }
}
