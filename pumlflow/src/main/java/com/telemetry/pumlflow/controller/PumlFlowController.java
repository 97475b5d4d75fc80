package com.telemetry.pumlflow.controller;

import com.telemetry.pumlflow.model.JobDiagramResult;
import com.telemetry.pumlflow.model.PvEvent;
import com.telemetry.pumlflow.service.impl.PumlFlowServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;

/**
 * 图生成 REST API 控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/pumlflow")
public class PumlFlowController {

    @Autowired
    private PumlFlowServiceImpl pumlFlowService;

    /**
     * 为请求中的每个 job 生成图
     *
     * @param events 事件列表（可包含多个 job）
     * @return 每个 job 的生成结果，按 job 名排序
     */
    @PostMapping("/generate")
    public List<JobDiagramResult> generate(@RequestBody List<PvEvent> events) {
        log.info("收到图生成请求, 事件数: {}", events == null ? 0 : events.size());

        // 输入验证
        if (events == null || events.isEmpty()) {
            log.error("【输入验证失败】-> 事件列表为空");
            return Collections.emptyList();
        }

        return pumlFlowService.generate(events);
    }

    /**
     * 生成并直接返回拼接后的 PlantUML 文本
     */
    @PostMapping(value = "/generate/puml", produces = MediaType.TEXT_PLAIN_VALUE)
    public String generatePuml(@RequestBody List<PvEvent> events) {
        log.info("收到 PlantUML 文本生成请求, 事件数: {}", events == null ? 0 : events.size());

        if (events == null || events.isEmpty()) {
            log.error("【输入验证失败】-> 事件列表为空");
            return "";
        }

        return pumlFlowService.generatePuml(events);
    }
}
