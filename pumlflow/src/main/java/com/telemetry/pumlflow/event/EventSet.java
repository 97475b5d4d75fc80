package com.telemetry.pumlflow.event;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 事件集合
 *
 * 一次因果步骤中同时出现的后继（或前驱）事件类型的多重集：eventType -> 次数。
 * 按内容比较相等，不可变，键按字典序排列保证输出稳定。
 */
public final class EventSet {

    private final SortedMap<String, Integer> counts;

    private EventSet(SortedMap<String, Integer> counts) {
        if (counts.isEmpty()) {
            throw new IllegalArgumentException("事件集合不能为空");
        }
        this.counts = Collections.unmodifiableSortedMap(counts);
    }

    /**
     * 由类型列表构建，重复出现的类型累加次数
     */
    public static EventSet of(String... eventTypes) {
        SortedMap<String, Integer> map = new TreeMap<>();
        for (String type : eventTypes) {
            map.merge(type, 1, Integer::sum);
        }
        return new EventSet(map);
    }

    public static EventSet ofTypes(Collection<String> eventTypes) {
        return of(eventTypes.toArray(new String[0]));
    }

    public static EventSet ofCounts(Map<String, Integer> typeCounts) {
        SortedMap<String, Integer> map = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : typeCounts.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 1) {
                throw new IllegalArgumentException("事件次数必须为正数: " + entry);
            }
            map.put(entry.getKey(), entry.getValue());
        }
        return new EventSet(map);
    }

    public int getCount(String eventType) {
        return counts.getOrDefault(eventType, 0);
    }

    public boolean contains(String eventType) {
        return counts.containsKey(eventType);
    }

    public boolean containsAny(Set<String> eventTypes) {
        for (String type : counts.keySet()) {
            if (eventTypes.contains(type)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getEventTypes() {
        return counts.keySet();
    }

    public Map<String, Integer> getCounts() {
        return counts;
    }

    /**
     * 只保留给定类型，结果为空时返回 null
     */
    public EventSet project(Set<String> eventTypes) {
        SortedMap<String, Integer> map = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (eventTypes.contains(entry.getKey())) {
                map.put(entry.getKey(), entry.getValue());
            }
        }
        return map.isEmpty() ? null : new EventSet(map);
    }

    /**
     * 把给定类型整体替换为一个类型。
     * 只有一个被替换类型时沿用它的次数，多个被替换类型折叠为 1 次。
     */
    public EventSet replace(Set<String> eventTypes, String replacement) {
        SortedMap<String, Integer> map = new TreeMap<>();
        int replaced = 0;
        int replacedCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (eventTypes.contains(entry.getKey())) {
                replaced++;
                replacedCount = entry.getValue();
            } else {
                map.put(entry.getKey(), entry.getValue());
            }
        }
        if (replaced == 0) {
            return this;
        }
        map.merge(replacement, replaced == 1 ? replacedCount : 1, Math::max);
        return new EventSet(map);
    }

    /**
     * 按映射逐个重命名类型，映射到同一目标的类型折叠为 1 次
     */
    public EventSet rename(Map<String, String> renames) {
        SortedMap<String, Integer> map = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            String target = renames.get(entry.getKey());
            if (target == null) {
                map.merge(entry.getKey(), entry.getValue(), Math::max);
            } else if (map.containsKey(target)) {
                map.put(target, 1);
            } else {
                map.put(target, entry.getValue());
            }
        }
        return new EventSet(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventSet)) {
            return false;
        }
        return counts.equals(((EventSet) o).counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append(':').append(entry.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }
}
