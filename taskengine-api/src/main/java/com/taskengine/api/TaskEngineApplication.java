package com.taskengine.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the task engine.
 * Every pass is started by an external scheduler calling the {@code /api/cron} endpoints.
 */
@SpringBootApplication(scanBasePackages = {
    "com.taskengine.api",
    "com.taskengine.engine",
    "com.taskengine.recovery"
})
public class TaskEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskEngineApplication.class, args);
    }
}
