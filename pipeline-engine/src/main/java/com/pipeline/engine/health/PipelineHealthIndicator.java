package com.pipeline.engine.health;

import com.pipeline.core.model.RunState;
import com.pipeline.core.repository.CacheStore;
import com.pipeline.core.repository.RunRepository;
import com.pipeline.engine.coordinator.JobGraphEngine;
import com.pipeline.engine.lifecycle.GracefulShutdownHandler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Custom health indicator for the pipeline orchestrator.
 * Reports health status based on:
 * - Shutdown state
 * - Active and long-running runs
 * - Cache usage
 */
@Component
public class PipelineHealthIndicator implements HealthIndicator {

    private static final Duration STUCK_AFTER = Duration.ofHours(1);

    private final JobGraphEngine engine;
    private final RunRepository runRepository;
    private final CacheStore cacheStore;
    private final GracefulShutdownHandler shutdownHandler;

    public PipelineHealthIndicator(
            JobGraphEngine engine,
            RunRepository runRepository,
            CacheStore cacheStore,
            GracefulShutdownHandler shutdownHandler) {
        this.engine = engine;
        this.runRepository = runRepository;
        this.cacheStore = cacheStore;
        this.shutdownHandler = shutdownHandler;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        try {
            if (shutdownHandler.isShuttingDown()) {
                details.put("shutdown", "in progress");
                return Health.outOfService()
                    .withDetails(details)
                    .build();
            }

            checkRunHealth(details);
            checkCacheHealth(details);

            return Health.up()
                .withDetails(details)
                .build();

        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private void checkRunHealth(Map<String, Object> details) {
        details.put("activeRuns", engine.activeRunIds().size());
        details.put("queuedRuns", runRepository.findByState(RunState.QUEUED, Integer.MAX_VALUE).size());

        // Runs executing for over an hour usually wait on a hung command
        Instant threshold = Instant.now().minus(STUCK_AFTER);
        long stuck = runRepository.findActive().stream()
            .filter(run -> run.startedAt() != null && run.startedAt().isBefore(threshold))
            .count();
        details.put("longRunningRuns", stuck);
    }

    private void checkCacheHealth(Map<String, Object> details) {
        details.put("cacheEntries", cacheStore.entryCount());
        details.put("cacheSizeBytes", cacheStore.totalSizeBytes());
    }
}
