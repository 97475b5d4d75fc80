package com.telemetry.pumlflow.event;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.model.PvEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 事件模型构建器
 *
 * 把带 previousEventIds 链接的事件序列聚合为每个事件类型的出向、入向事件集合
 */
@Slf4j
public class EventModelBuilder {

    private static final String TAG = PumlFlowConstants.LogTag.INGEST;

    private final boolean addDummyStart;

    public EventModelBuilder(boolean addDummyStart) {
        this.addDummyStart = addDummyStart;
    }

    /**
     * 构建 job 的事件模型
     *
     * @param jobName job 名称
     * @param sequences 该 job 的所有执行序列，每个序列是一组通过 previousEventIds 关联的事件
     */
    public EventModel build(String jobName, Collection<List<PvEvent>> sequences) {
        EventModel model = new EventModel(jobName);
        int skippedLinks = 0;
        for (List<PvEvent> sequence : sequences) {
            skippedLinks += addSequence(model, sequence);
        }
        log.info("{}-> job={} 序列数: {}, 事件类型数: {}, 跳过的无效链接: {}",
                TAG, jobName, sequences.size(), model.size(), skippedLinks);
        return model;
    }

    /**
     * 加入一条序列
     *
     * @return 被跳过的前驱链接数（前驱不在本序列内）
     */
    private int addSequence(EventModel model, List<PvEvent> sequence) {
        Map<String, PvEvent> byId = new LinkedHashMap<>();
        for (PvEvent event : sequence) {
            byId.put(event.getEventId(), event);
        }

        // 阶段1: 建立 父 -> 子 关系
        Map<String, List<PvEvent>> children = new LinkedHashMap<>();
        Map<String, List<PvEvent>> parents = new LinkedHashMap<>();
        List<PvEvent> roots = new ArrayList<>();
        int skipped = 0;
        for (PvEvent event : sequence) {
            List<PvEvent> eventParents = new ArrayList<>();
            for (String previousId : event.getPreviousEventIds()) {
                PvEvent parent = byId.get(previousId);
                if (parent == null) {
                    log.warn("{}-> 事件 {} 的前驱 {} 不在序列 {} 中，忽略该链接",
                            TAG, event.getEventId(), previousId, event.getJobId());
                    skipped++;
                    continue;
                }
                eventParents.add(parent);
                children.computeIfAbsent(parent.getEventId(), k -> new ArrayList<>()).add(event);
            }
            parents.put(event.getEventId(), eventParents);
            if (eventParents.isEmpty()) {
                roots.add(event);
            }
        }

        // 阶段2: 生成事件集合
        for (PvEvent event : sequence) {
            Event aggregated = model.getOrCreate(event.getEventType());
            List<PvEvent> eventChildren = children.get(event.getEventId());
            if (eventChildren != null && !eventChildren.isEmpty()) {
                aggregated.addOutgoing(toEventSet(eventChildren));
            }
            List<PvEvent> eventParents = parents.get(event.getEventId());
            if (!eventParents.isEmpty()) {
                aggregated.addIncoming(toEventSet(eventParents));
            } else if (addDummyStart) {
                aggregated.addIncoming(EventSet.of(PumlFlowConstants.DummyEvent.START));
            }
        }

        // 阶段3: 合成起点
        if (addDummyStart && !roots.isEmpty()) {
            model.getOrCreate(PumlFlowConstants.DummyEvent.START).addOutgoing(toEventSet(roots));
        }
        return skipped;
    }

    private static EventSet toEventSet(List<PvEvent> events) {
        List<String> types = new ArrayList<>(events.size());
        for (PvEvent event : events) {
            types.add(event.getEventType());
        }
        return EventSet.ofTypes(types);
    }
}
