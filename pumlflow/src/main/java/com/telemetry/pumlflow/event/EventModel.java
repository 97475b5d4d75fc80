package com.telemetry.pumlflow.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个 job 的事件模型：eventType -> Event
 *
 * 每个 job 一份，不在 job 之间共享
 */
public class EventModel {

    private final String jobName;
    private final Map<String, Event> events = new LinkedHashMap<>();

    public EventModel(String jobName) {
        this.jobName = jobName;
    }

    public Event getOrCreate(String eventType) {
        return events.computeIfAbsent(eventType, Event::new);
    }

    /**
     * 直接登记一条出向事件集合
     */
    public EventModel addOutgoing(String eventType, EventSet eventSet) {
        getOrCreate(eventType).addOutgoing(eventSet);
        return this;
    }

    public EventModel addIncoming(String eventType, EventSet eventSet) {
        getOrCreate(eventType).addIncoming(eventSet);
        return this;
    }

    public Event getEvent(String eventType) {
        return events.get(eventType);
    }

    public Map<String, Event> getEvents() {
        return Collections.unmodifiableMap(events);
    }

    public String getJobName() {
        return jobName;
    }

    public int size() {
        return events.size();
    }
}
