package com.telemetry.pumlflow.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 事件图（有向图）
 *
 * 采用邻接表表示，节点键为事件类型。
 * 边完全由出向事件集合推导：事件指向其任一出向事件集合中出现的每个类型，不存在没有事件集合支撑的边。
 * 构建后只读。
 */
public class EventGraph {

    /** 节点存储：eventType -> Event */
    private final Map<String, Event> nodes;

    /** 出边（邻接表）：eventType -> 后继类型（字典序） */
    private final Map<String, Set<String>> outEdges;

    /** 入边（反向邻接表）：eventType -> 前驱类型（字典序） */
    private final Map<String, Set<String>> inEdges;

    /**
     * 由已校验的事件构建。引用校验由 {@link MarkovGraphBuilder} 负责。
     */
    EventGraph(Map<String, ? extends Event> events) {
        this.nodes = new LinkedHashMap<>(events);
        this.outEdges = new LinkedHashMap<>();
        this.inEdges = new LinkedHashMap<>();
        for (String type : nodes.keySet()) {
            outEdges.put(type, new TreeSet<>());
            inEdges.put(type, new TreeSet<>());
        }
        for (Event event : nodes.values()) {
            for (String target : event.getOutgoingTypes()) {
                outEdges.get(event.getEventType()).add(target);
                inEdges.get(target).add(event.getEventType());
            }
        }
    }

    public Event getEvent(String eventType) {
        return nodes.get(eventType);
    }

    public boolean containsEvent(String eventType) {
        return nodes.containsKey(eventType);
    }

    public Map<String, Event> getEvents() {
        return Collections.unmodifiableMap(nodes);
    }

    public Set<String> getEventTypes() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public Set<String> successors(String eventType) {
        Set<String> targets = outEdges.get(eventType);
        return targets == null ? Collections.emptySet() : Collections.unmodifiableSet(targets);
    }

    public Set<String> predecessors(String eventType) {
        Set<String> sources = inEdges.get(eventType);
        return sources == null ? Collections.emptySet() : Collections.unmodifiableSet(sources);
    }

    public boolean hasEdge(String source, String target) {
        return successors(source).contains(target);
    }

    /**
     * 没有入边的节点
     */
    public List<String> roots() {
        List<String> roots = new ArrayList<>();
        for (String type : nodes.keySet()) {
            if (inEdges.get(type).isEmpty()) {
                roots.add(type);
            }
        }
        return roots;
    }

    public int size() {
        return nodes.size();
    }

    public int edgeCount() {
        int count = 0;
        for (Set<String> targets : outEdges.values()) {
            count += targets.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "EventGraph{nodes=" + nodes.size() + ", edges=" + edgeCount() + "}";
    }
}
