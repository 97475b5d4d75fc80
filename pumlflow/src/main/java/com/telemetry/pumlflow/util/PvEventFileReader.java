package com.telemetry.pumlflow.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.exception.PumlFlowException;
import com.telemetry.pumlflow.model.PvEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 读取 job 事件文件：单个 JSON 数组文件，或目录下所有 *.json 文件
 */
@Slf4j
public final class PvEventFileReader {

    private static final String TAG = PumlFlowConstants.LogTag.INGEST;

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PvEventFileReader() {
    }

    public static List<PvEvent> read(Path path) {
        if (!Files.exists(path)) {
            throw new PumlFlowException("输入路径不存在: " + path);
        }
        if (!Files.isDirectory(path)) {
            return readFile(path);
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(path)) {
            files = stream.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PumlFlowException("读取目录失败: " + path, e);
        }
        List<PvEvent> events = new ArrayList<>();
        for (Path file : files) {
            events.addAll(readFile(file));
        }
        log.info("{}-> 目录 {} 共 {} 个文件, {} 个事件", TAG, path, files.size(), events.size());
        return events;
    }

    public static List<PvEvent> readFile(Path file) {
        try {
            List<PvEvent> events = objectMapper.readValue(file.toFile(), new TypeReference<List<PvEvent>>() {
            });
            log.debug("{}-> 读取 {}: {} 个事件", TAG, file, events.size());
            return events;
        } catch (IOException e) {
            throw new PumlFlowException("解析事件文件失败: " + file, e);
        }
    }
}
