package com.pipeline.core.model;

import java.time.Instant;
import java.util.List;

/**
 * State and outcome of a job within a run.
 * 
 * Invariants:
 * - failedStepId set only if state == FAILED
 * - completedAt set iff state is terminal
 */
public record JobResult(
    String jobId,
    JobState state,
    List<StepResult> steps,
    
    // Produced resources
    List<String> artifacts,
    List<String> cacheKeys,
    
    // Failure detail
    String failedStepId,
    String errorCode,
    String errorMessage,
    
    // Timing
    Instant startedAt,
    Instant completedAt
) {
    public static final String ERROR_JOB_TIMEOUT = "JOB_TIMEOUT";
    public static final String ERROR_UPSTREAM_FAILED = "UPSTREAM_NOT_SUCCEEDED";
    public static final String ERROR_STEP_FAILED = "STEP_FAILED";

    public JobResult {
        steps = steps != null ? List.copyOf(steps) : List.of();
        artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
        cacheKeys = cacheKeys != null ? List.copyOf(cacheKeys) : List.of();
    }

    /**
     * Create a new job result in PENDING state.
     */
    public static JobResult pending(String jobId) {
        return new JobResult(jobId, JobState.PENDING, List.of(), List.of(), List.of(),
            null, null, null, null, null);
    }

    public JobResult withQueued() {
        return new JobResult(jobId, JobState.QUEUED, steps, artifacts, cacheKeys,
            failedStepId, errorCode, errorMessage, startedAt, completedAt);
    }

    public JobResult withRunning() {
        return new JobResult(jobId, JobState.RUNNING, steps, artifacts, cacheKeys,
            null, null, null, Instant.now(), null);
    }

    /**
     * Create a copy with the job completed successfully.
     */
    public JobResult withSucceeded(List<StepResult> stepResults, List<String> producedArtifacts,
                                   List<String> producedCacheKeys) {
        return new JobResult(jobId, JobState.SUCCEEDED, stepResults, producedArtifacts, producedCacheKeys,
            null, null, null, startedAt, Instant.now());
    }

    /**
     * Create a copy with the job failed.
     */
    public JobResult withFailed(List<StepResult> stepResults, String stepId, String code, String message) {
        return new JobResult(jobId, JobState.FAILED, stepResults, artifacts, cacheKeys,
            stepId, code, message, startedAt, Instant.now());
    }

    /**
     * Create a copy with the job skipped, carrying the reason.
     */
    public JobResult withSkipped(String reason) {
        return new JobResult(jobId, JobState.SKIPPED, steps, artifacts, cacheKeys,
            null, null, reason, startedAt, Instant.now());
    }

    public JobResult withCancelled(String reason) {
        return new JobResult(jobId, JobState.CANCELLED, steps, artifacts, cacheKeys,
            null, null, reason, startedAt, Instant.now());
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
