package com.pipeline.engine.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include the run, job and step they belong to.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forJob(runId, "build")) {
 *     log.info("Provisioning environment"); // Automatically includes runId, jobId
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [job-2] INFO  c.p.e.c.JobGraphEngine - Job succeeded
 *   runId=abc-123 workflow=deploy-pages jobId=build traceId=9f1c2d3e
 *
 * Closing a context removes only the keys it added, so a step context
 * nested in a job context leaves the job keys in place.
 */
public final class LoggingContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String WORKFLOW = "workflow";
    public static final String JOB_ID = "jobId";
    public static final String STEP_ID = "stepId";
    public static final String TRACE_ID = "traceId";

    private final List<String> addedKeys = new ArrayList<>();

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for run-level operations.
     */
    public static LoggingContext forRun(UUID runId, String workflowName, String traceId) {
        LoggingContext ctx = new LoggingContext();
        if (runId != null) {
            ctx.put(RUN_ID, runId.toString());
        }
        ctx.put(WORKFLOW, workflowName);
        ctx.put(TRACE_ID, traceId);
        return ctx;
    }

    /**
     * Create a logging context for a job. Called on executor threads, which
     * do not inherit the submitting thread's MDC.
     */
    public static LoggingContext forJob(UUID runId, String workflowName, String traceId, String jobId) {
        LoggingContext ctx = forRun(runId, workflowName, traceId);
        ctx.put(JOB_ID, jobId);
        return ctx;
    }

    /**
     * Create a logging context for a step within the current job context.
     */
    public static LoggingContext forStep(String stepId) {
        LoggingContext ctx = new LoggingContext();
        ctx.put(STEP_ID, stepId);
        return ctx;
    }

    /**
     * Get current run ID from context.
     */
    public static String getRunId() {
        return MDC.get(RUN_ID);
    }

    public static String getJobId() {
        return MDC.get(JOB_ID);
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private void put(String key, String value) {
        if (value != null && MDC.get(key) == null) {
            MDC.put(key, value);
            addedKeys.add(key);
        }
    }

    @Override
    public void close() {
        addedKeys.forEach(MDC::remove);
        addedKeys.clear();
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
