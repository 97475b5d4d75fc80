package com.telemetry.pumlflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 事件流图生成系统 - SpringBoot启动类
 */
@SpringBootApplication
public class PumlFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(PumlFlowApplication.class, args);
        System.out.println("========================================");
        System.out.println("事件流图生成系统启动成功！");
        System.out.println("========================================");
    }
}
