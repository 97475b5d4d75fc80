package com.telemetry.pumlflow.service;

import com.telemetry.pumlflow.model.PvEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 事件分组：jobName -> jobId -> 序列
 *
 * 每个 jobName 生成一张图，同一 jobName 下每个 jobId 是一条独立的执行序列
 */
@Slf4j
public final class JobEventGrouper {

    private JobEventGrouper() {
    }

    public static Map<String, List<List<PvEvent>>> group(List<PvEvent> events) {
        Map<String, Map<String, List<PvEvent>>> byJob = new TreeMap<>();
        int skipped = 0;
        for (PvEvent event : events) {
            if (event == null || isBlank(event.getJobName()) || isBlank(event.getEventId())
                    || isBlank(event.getEventType())) {
                skipped++;
                continue;
            }
            String jobId = isBlank(event.getJobId()) ? "" : event.getJobId();
            byJob.computeIfAbsent(event.getJobName(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(jobId, k -> new ArrayList<>())
                    .add(event);
        }
        if (skipped > 0) {
            log.warn("【事件接入】-> 跳过 {} 个缺少 jobName/eventId/eventType 的事件", skipped);
        }
        Map<String, List<List<PvEvent>>> result = new TreeMap<>();
        for (Map.Entry<String, Map<String, List<PvEvent>>> entry : byJob.entrySet()) {
            result.put(entry.getKey(), new ArrayList<>(entry.getValue().values()));
        }
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
