package com.pipeline.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for the Pipeline Orchestrator.
 */
@SpringBootApplication(scanBasePackages = {
    "com.pipeline.api",
    "com.pipeline.engine"
})
public class PipelineApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(PipelineApplication.class, args);
    }
}
