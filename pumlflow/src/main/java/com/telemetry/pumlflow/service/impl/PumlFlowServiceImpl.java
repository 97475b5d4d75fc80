package com.telemetry.pumlflow.service.impl;

import com.telemetry.pumlflow.config.PumlFlowConfig;
import com.telemetry.pumlflow.constants.PumlFlowConstants;
import com.telemetry.pumlflow.event.EventModel;
import com.telemetry.pumlflow.event.EventModelBuilder;
import com.telemetry.pumlflow.exception.PumlFlowException;
import com.telemetry.pumlflow.model.JobDiagramResult;
import com.telemetry.pumlflow.model.PvEvent;
import com.telemetry.pumlflow.pipeline.DiagramPipeline;
import com.telemetry.pumlflow.pipeline.JobContext;
import com.telemetry.pumlflow.service.JobEventGrouper;
import com.telemetry.pumlflow.util.PumlFileWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 图生成服务
 *
 * 按 jobName 分组后每个 job 独立跑一条流水线，job 之间没有共享状态，在固定大小的线程池上并行；
 * 单个 job 的致命错误只让该 job 失败
 */
@Slf4j
@Service
public class PumlFlowServiceImpl {

    private static final String TAG = PumlFlowConstants.LogTag.PIPELINE;

    @Autowired
    private PumlFlowConfig config;

    public PumlFlowServiceImpl() {
    }

    public PumlFlowServiceImpl(PumlFlowConfig config) {
        this.config = config;
    }

    /**
     * 为输入事件中的每个 job 生成图，结果按 job 名排序
     */
    public List<JobDiagramResult> generate(List<PvEvent> events) {
        if (events == null || events.isEmpty()) {
            log.warn("{}-> 输入事件为空", TAG);
            return Collections.emptyList();
        }
        Map<String, List<List<PvEvent>>> jobs = JobEventGrouper.group(events);
        log.info("{}-> ========================================", TAG);
        log.info("{}-> 开始生成, 事件数: {}, job 数: {}, 并行度: {}", TAG, events.size(), jobs.size(),
                config.getJobParallelism());
        long startTime = System.currentTimeMillis();

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, config.getJobParallelism()));
        List<JobDiagramResult> results = new ArrayList<>();
        try {
            List<CompletableFuture<JobDiagramResult>> futures = new ArrayList<>();
            for (Map.Entry<String, List<List<PvEvent>>> job : jobs.entrySet()) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> processJob(job.getKey(), job.getValue()), executor));
            }
            for (CompletableFuture<JobDiagramResult> future : futures) {
                results.add(future.join());
            }
        } finally {
            executor.shutdown();
        }
        results.sort(Comparator.comparing(JobDiagramResult::getJobName));

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("{}-> 生成结束, 成功: {}, 失败: {}, 耗时: {}ms", TAG, results.size() - failed, failed,
                System.currentTimeMillis() - startTime);
        log.info("{}-> ========================================", TAG);
        return results;
    }

    /**
     * 所有成功 job 的 PlantUML 文本按 job 名顺序拼接
     */
    public String generatePuml(List<PvEvent> events) {
        StringBuilder builder = new StringBuilder();
        for (JobDiagramResult result : generate(events)) {
            if (result.isSuccess()) {
                builder.append(result.getPuml());
            }
        }
        return builder.toString();
    }

    /**
     * 处理单个 job；致命错误在这里截获，转换为失败结果
     */
    public JobDiagramResult processJob(String jobName, List<List<PvEvent>> sequences) {
        JobContext context = new JobContext(jobName, config);
        try {
            EventModel model = new EventModelBuilder(config.isAddDummyStart()).build(jobName, sequences);
            String puml = createPipeline().run(context, model);
            return JobDiagramResult.success(jobName, puml, context.getWarnings());
        } catch (PumlFlowException e) {
            log.error("{}-> job={} 生成失败: {}", TAG, jobName, e.getMessage(), e);
            return JobDiagramResult.failure(jobName, e.getMessage(), context.getWarnings());
        } catch (Exception e) {
            log.error("{}-> job={} 处理异常: {}", TAG, jobName, e.getMessage(), e);
            return JobDiagramResult.failure(jobName, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    context.getWarnings());
        }
    }

    protected DiagramPipeline createPipeline() {
        return new DiagramPipeline();
    }

    /**
     * 把成功的结果写到输出目录
     *
     * @return 写入的文件数
     */
    public int writeDiagrams(List<JobDiagramResult> results, String outputDir) {
        Path dir = Paths.get(outputDir);
        int written = 0;
        for (JobDiagramResult result : results) {
            if (!result.isSuccess()) {
                log.warn("{}-> job={} 生成失败，不写文件: {}", TAG, result.getJobName(), result.getErrorMessage());
                continue;
            }
            PumlFileWriter.write(dir, result.getJobName(), result.getPuml());
            written++;
        }
        return written;
    }
}
