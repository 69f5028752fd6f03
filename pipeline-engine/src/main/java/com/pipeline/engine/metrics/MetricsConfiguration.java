package com.pipeline.engine.metrics;

import com.pipeline.core.repository.CacheStore;
import com.pipeline.engine.history.RunEventLog;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the pipeline orchestrator.
 *
 * Configures:
 * - Common tags for all metrics
 * - The run-log fed pipeline metrics binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "pipeline-orchestrator");
    }

    @Bean
    public PipelineMetrics pipelineMetrics(CacheStore cacheStore, RunEventLog runEventLog) {
        PipelineMetrics metrics = new PipelineMetrics(cacheStore);
        runEventLog.addListener(metrics);
        return metrics;
    }
}
