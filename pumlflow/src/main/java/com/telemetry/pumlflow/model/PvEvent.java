package com.telemetry.pumlflow.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 接入的原始事件
 *
 * jobName 决定归属哪张图，jobId 区分同一 job 的不同执行序列，
 * previousEventIds 指向同一序列内的因果前驱
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PvEvent {
    private String jobId;
    private String jobName;
    private String eventId;
    private String eventType;
    private String applicationName;

    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> previousEventIds = new ArrayList<>();

    public PvEvent(String jobId, String jobName, String eventId, String eventType, String... previousEventIds) {
        this.jobId = jobId;
        this.jobName = jobName;
        this.eventId = eventId;
        this.eventType = eventType;
        this.previousEventIds = new ArrayList<>(Arrays.asList(previousEventIds));
    }

    public void setPreviousEventIds(List<String> previousEventIds) {
        this.previousEventIds = previousEventIds != null ? previousEventIds : new ArrayList<>();
    }

    @Override
    public String toString() {
        return eventType + "(" + eventId + ")";
    }
}
