package com.telemetry.pumlflow;

import com.telemetry.pumlflow.config.PumlFlowConfig;
import com.telemetry.pumlflow.model.JobDiagramResult;
import com.telemetry.pumlflow.model.PvEvent;
import com.telemetry.pumlflow.service.impl.PumlFlowServiceImpl;
import com.telemetry.pumlflow.util.PvEventFileReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.List;

/**
 * 启动时处理 puml-flow.input-path 指定的 job 文件，输出到 puml-flow.output-dir
 */
@Slf4j
@Component
public class PumlFlowRunner implements ApplicationRunner {

    @Autowired
    private PumlFlowConfig config;

    @Autowired
    private PumlFlowServiceImpl pumlFlowService;

    @Override
    public void run(ApplicationArguments args) {
        String inputPath = config.getInputPath();
        if (inputPath == null || inputPath.trim().isEmpty()) {
            log.debug("【图生成】-> 未配置 input-path，跳过启动处理");
            return;
        }
        log.info("【图生成】-> 启动处理: {} -> {}", inputPath, config.getOutputDir());
        List<PvEvent> events = PvEventFileReader.read(Paths.get(inputPath));
        List<JobDiagramResult> results = pumlFlowService.generate(events);
        int written = pumlFlowService.writeDiagrams(results, config.getOutputDir());
        log.info("【图生成】-> 启动处理完成, 写入 {} 个文件", written);
    }
}
