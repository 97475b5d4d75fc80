package com.telemetry.pumlflow.event;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.exception.UnknownEventTypeException;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * 马尔可夫图构建器：事件模型 -> 事件图
 */
@Slf4j
public class MarkovGraphBuilder {

    private static final String TAG = PumlFlowConstants.LogTag.MARKOV;

    private MarkovGraphBuilder() {
    }

    public static EventGraph build(EventModel model) {
        EventGraph graph = build(model.getEvents());
        log.info("{}-> job={} 节点数: {}, 边数: {}", TAG, model.getJobName(), graph.size(), graph.edgeCount());
        return graph;
    }

    /**
     * 校验事件集合中的引用并构建事件图
     *
     * @throws UnknownEventTypeException 事件集合引用了没有对应事件的类型
     */
    public static EventGraph build(Map<String, ? extends Event> events) {
        for (Event event : events.values()) {
            for (EventSet eventSet : event.getOutgoing()) {
                checkReferences(events, event, eventSet);
            }
            for (EventSet eventSet : event.getIncoming()) {
                checkReferences(events, event, eventSet);
            }
        }
        return new EventGraph(events);
    }

    private static void checkReferences(Map<String, ? extends Event> events, Event owner, EventSet eventSet) {
        for (String type : eventSet.getEventTypes()) {
            if (!events.containsKey(type)) {
                log.error("{}-> 事件 {} 的事件集合 {} 引用了未知类型 {}", TAG, owner.getEventType(), eventSet, type);
                throw new UnknownEventTypeException(type, owner.getEventType());
            }
        }
    }
}
