package com.telemetry.pumlflow.model;

import com.telemetry.pumlflow.exception.DiagramWarning;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个 job 的生成结果
 *
 * success=false 时 puml 为空，errorMessage 为导致该 job 中止的错误
 */
@Getter
@Setter
@NoArgsConstructor
public class JobDiagramResult {
    private String jobName;
    private String puml;
    private List<DiagramWarning> warnings = new ArrayList<>();
    private boolean success;
    private String errorMessage;

    public static JobDiagramResult success(String jobName, String puml, List<DiagramWarning> warnings) {
        JobDiagramResult result = new JobDiagramResult();
        result.setJobName(jobName);
        result.setPuml(puml);
        result.setWarnings(new ArrayList<>(warnings));
        result.setSuccess(true);
        return result;
    }

    public static JobDiagramResult failure(String jobName, String errorMessage, List<DiagramWarning> warnings) {
        JobDiagramResult result = new JobDiagramResult();
        result.setJobName(jobName);
        result.setWarnings(new ArrayList<>(warnings));
        result.setSuccess(false);
        result.setErrorMessage(errorMessage);
        return result;
    }
}
