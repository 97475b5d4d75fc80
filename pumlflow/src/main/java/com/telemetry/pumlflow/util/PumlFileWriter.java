package com.telemetry.pumlflow.util;

import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.exception.PumlFlowException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 把 PlantUML 文本写到 {outputDir}/{jobName}.puml
 */
@Slf4j
public final class PumlFileWriter {

    private PumlFileWriter() {
    }

    public static Path write(Path outputDir, String jobName, String puml) {
        Path file = outputDir.resolve(fileName(jobName));
        try {
            Files.createDirectories(outputDir);
            Files.write(file, puml.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new PumlFlowException("写入 PlantUML 文件失败: " + file, e);
        }
        log.info("{}-> 已写入 {}", PumlFlowConstants.LogTag.PIPELINE, file);
        return file;
    }

    /**
     * job 名中不能出现在文件名里的字符替换为下划线
     */
    static String fileName(String jobName) {
        return jobName.replaceAll("[\\\\/:*?\"<>|]", "_") + PumlFlowConstants.Puml.FILE_EXTENSION;
    }
}
