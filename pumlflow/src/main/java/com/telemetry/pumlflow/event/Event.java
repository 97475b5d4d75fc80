package com.telemetry.pumlflow.event;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * 事件类型的聚合行为：所有观测到的出向、入向事件集合
 *
 * 集合只增不减，推断阶段读取之后不再修改
 */
@Getter
public class Event {

    private final String eventType;
    private final Set<EventSet> outgoing;
    private final Set<EventSet> incoming;

    public Event(String eventType) {
        this.eventType = eventType;
        this.outgoing = new LinkedHashSet<>();
        this.incoming = new LinkedHashSet<>();
    }

    public Event(String eventType, Collection<EventSet> outgoing, Collection<EventSet> incoming) {
        this(eventType);
        this.outgoing.addAll(outgoing);
        this.incoming.addAll(incoming);
    }

    public void addOutgoing(EventSet eventSet) {
        if (eventSet != null) {
            outgoing.add(eventSet);
        }
    }

    public void addIncoming(EventSet eventSet) {
        if (eventSet != null) {
            incoming.add(eventSet);
        }
    }

    public Set<EventSet> getOutgoing() {
        return Collections.unmodifiableSet(outgoing);
    }

    public Set<EventSet> getIncoming() {
        return Collections.unmodifiableSet(incoming);
    }

    /**
     * 所有出向事件集合中出现过的类型（字典序）
     */
    public Set<String> getOutgoingTypes() {
        Set<String> types = new TreeSet<>();
        for (EventSet eventSet : outgoing) {
            types.addAll(eventSet.getEventTypes());
        }
        return types;
    }

    public boolean isDummy() {
        return PumlFlowConstants.DummyEvent.isDummy(eventType);
    }

    @Override
    public String toString() {
        return "Event{" + eventType + ", out=" + outgoing + ", in=" + incoming + "}";
    }
}
