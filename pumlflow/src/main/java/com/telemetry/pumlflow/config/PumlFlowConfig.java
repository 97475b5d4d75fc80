package com.telemetry.pumlflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 图生成配置类
 */
@Configuration
@ConfigurationProperties(prefix = "puml-flow")
public class PumlFlowConfig {

    /**
     * PlantUML 每级缩进的空格数
     */
    private int tabSize = 4;

    /**
     * 并行处理 job 的线程数
     */
    private int jobParallelism = 4;

    /**
     * 接入序列时是否为每条序列补充合成起点
     */
    private boolean addDummyStart = true;

    /**
     * 循环嵌套最大深度
     */
    private int maxLoopDepth = 32;

    /**
     * 启动时处理的 job 文件或目录，为空则不处理
     */
    private String inputPath = "";

    /**
     * 启动时输出 .puml 文件的目录
     */
    private String outputDir = "puml_output";

    // Getters and Setters
    public int getTabSize() {
        return tabSize;
    }

    public void setTabSize(int tabSize) {
        this.tabSize = tabSize;
    }

    public int getJobParallelism() {
        return jobParallelism;
    }

    public void setJobParallelism(int jobParallelism) {
        this.jobParallelism = jobParallelism;
    }

    public boolean isAddDummyStart() {
        return addDummyStart;
    }

    public void setAddDummyStart(boolean addDummyStart) {
        this.addDummyStart = addDummyStart;
    }

    public int getMaxLoopDepth() {
        return maxLoopDepth;
    }

    public void setMaxLoopDepth(int maxLoopDepth) {
        this.maxLoopDepth = maxLoopDepth;
    }

    public String getInputPath() {
        return inputPath;
    }

    public void setInputPath(String inputPath) {
        this.inputPath = inputPath;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }
}
