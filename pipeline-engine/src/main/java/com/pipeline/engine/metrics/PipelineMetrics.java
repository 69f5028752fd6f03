package com.pipeline.engine.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.core.model.RunEvent;
import com.pipeline.core.repository.CacheStore;
import com.pipeline.engine.history.RunEventLog;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for the pipeline orchestrator, fed from the run log.
 *
 * Metrics exposed:
 * - Run starts, outcomes and durations
 * - Job outcomes and durations
 * - Step outcomes
 * - Cache hits, misses, stores and stored bytes
 * - Deployments and quality reports
 */
public class PipelineMetrics implements MeterBinder, RunEventLog.RunEventListener {

    // Metric names
    public static final String RUNS_STARTED = "pipeline.runs.started";
    public static final String RUNS_COMPLETED = "pipeline.runs.completed";
    public static final String RUNS_ACTIVE = "pipeline.runs.active";
    public static final String RUN_DURATION = "pipeline.runs.duration";

    public static final String JOBS_COMPLETED = "pipeline.jobs.completed";
    public static final String JOB_DURATION = "pipeline.jobs.duration";
    public static final String STEPS = "pipeline.steps";

    public static final String CACHE_LOOKUPS = "pipeline.cache.lookups";
    public static final String CACHE_STORES = "pipeline.cache.stores";
    public static final String CACHE_SIZE = "pipeline.cache.size.bytes";
    public static final String CACHE_ENTRIES = "pipeline.cache.entries";

    public static final String DEPLOYMENTS = "pipeline.deployments";
    public static final String QUALITY_REPORTS = "pipeline.quality.reports";

    private final CacheStore cacheStore;
    private final AtomicInteger activeRuns = new AtomicInteger();
    private MeterRegistry registry;

    public PipelineMetrics(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder(RUNS_ACTIVE, activeRuns, AtomicInteger::get)
            .description("Runs currently executing")
            .register(registry);
        Gauge.builder(CACHE_SIZE, cacheStore, CacheStore::totalSizeBytes)
            .description("Bytes held by the dependency cache")
            .baseUnit("bytes")
            .register(registry);
        Gauge.builder(CACHE_ENTRIES, cacheStore, CacheStore::entryCount)
            .description("Entries held by the dependency cache")
            .register(registry);
    }

    @Override
    public void onEvent(RunEvent event) {
        if (registry == null) {
            return;
        }
        JsonNode payload = event.payload();
        switch (event.type()) {
            case RUN_STARTED -> runStarted();
            case RUN_COMPLETED, RUN_FAILED, RUN_CANCELLED, RUN_SKIPPED ->
                runCompleted(text(payload, "state", event.type().name()), millis(payload));
            case JOB_SUCCEEDED, JOB_FAILED, JOB_SKIPPED, JOB_CANCELLED, JOB_TIMED_OUT ->
                jobCompleted(text(payload, "state", event.type().name()), millis(payload));
            case STEP_SUCCEEDED, STEP_FAILED, STEP_SKIPPED -> stepCompleted(text(payload, "outcome", "unknown"));
            case CACHE_HIT -> cacheLookup("hit");
            case CACHE_MISS -> cacheLookup("miss");
            case CACHE_STORED -> cacheStored();
            case DEPLOYMENT_PUBLISHED -> deployment(payload != null && payload.path("noop").asBoolean()
                ? "noop" : "published");
            case DEPLOYMENT_DENIED -> deployment("denied");
            case QUALITY_REPORTED -> qualityReported(text(payload, "status", "unknown"));
            default -> {
                // not measured
            }
        }
    }

    public int getActiveRuns() {
        return activeRuns.get();
    }

    // ========== Run Metrics ==========

    public void runStarted() {
        Counter.builder(RUNS_STARTED)
            .description("Total runs started")
            .register(registry)
            .increment();
        activeRuns.incrementAndGet();
    }

    public void runCompleted(String state, Long durationMs) {
        Counter.builder(RUNS_COMPLETED)
            .tag("state", state)
            .description("Total runs finished, by final state")
            .register(registry)
            .increment();
        if (durationMs != null) {
            Timer.builder(RUN_DURATION)
                .tag("state", state)
                .description("Run wall-clock duration")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
        }
        activeRuns.updateAndGet(n -> Math.max(0, n - 1));
    }

    // ========== Job Metrics ==========

    public void jobCompleted(String state, Long durationMs) {
        Counter.builder(JOBS_COMPLETED)
            .tag("state", state)
            .description("Total jobs finished, by final state")
            .register(registry)
            .increment();
        if (durationMs != null) {
            Timer.builder(JOB_DURATION)
                .tag("state", state)
                .description("Job wall-clock duration")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
        }
    }

    public void stepCompleted(String outcome) {
        Counter.builder(STEPS)
            .tag("outcome", outcome)
            .description("Total steps, by outcome")
            .register(registry)
            .increment();
    }

    // ========== Cache Metrics ==========

    public void cacheLookup(String result) {
        Counter.builder(CACHE_LOOKUPS)
            .tag("result", result)
            .description("Cache restore lookups")
            .register(registry)
            .increment();
    }

    public void cacheStored() {
        Counter.builder(CACHE_STORES)
            .description("Cache entries saved")
            .register(registry)
            .increment();
    }

    // ========== Deployment and Quality Metrics ==========

    public void deployment(String outcome) {
        Counter.builder(DEPLOYMENTS)
            .tag("outcome", outcome)
            .description("Deployment attempts, by outcome")
            .register(registry)
            .increment();
    }

    public void qualityReported(String status) {
        Counter.builder(QUALITY_REPORTS)
            .tag("status", status)
            .description("Quality gate reports, by status")
            .register(registry)
            .increment();
    }

    // ========== Internal Methods ==========

    private static String text(JsonNode payload, String field, String fallback) {
        if (payload == null || !payload.hasNonNull(field)) {
            return fallback;
        }
        return payload.get(field).asText();
    }

    private static Long millis(JsonNode payload) {
        if (payload == null || !payload.hasNonNull("durationMs")) {
            return null;
        }
        return payload.get("durationMs").asLong();
    }
}
