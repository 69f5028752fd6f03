package com.pipeline.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Recorded result of one step execution.
 *
 * Invariants:
 * - errorMessage set iff outcome == FAILURE
 * - log lines are already secret-masked
 */
public record StepResult(
    String stepId,
    String name,
    StepOutcome outcome,
    boolean bestEffort,
    Integer exitCode,
    Map<String, String> outputs,
    List<String> log,
    String errorCode,
    String errorMessage,
    Instant startedAt,
    Instant completedAt
) {
    public StepResult {
        outputs = outputs != null ? Map.copyOf(outputs) : Map.of();
        log = log != null ? List.copyOf(log) : List.of();
    }

    public static StepResult success(String stepId, String name, Integer exitCode,
                                     Map<String, String> outputs, List<String> log, Instant startedAt) {
        return new StepResult(stepId, name, StepOutcome.SUCCESS, false, exitCode,
            outputs, log, null, null, startedAt, Instant.now());
    }

    public static StepResult failure(String stepId, String name, boolean bestEffort, Integer exitCode,
                                     Map<String, String> outputs, List<String> log,
                                     String errorCode, String errorMessage, Instant startedAt) {
        return new StepResult(stepId, name, StepOutcome.FAILURE, bestEffort, exitCode,
            outputs, log, errorCode, errorMessage, startedAt, Instant.now());
    }

    public static StepResult skipped(String stepId, String name) {
        Instant now = Instant.now();
        return new StepResult(stepId, name, StepOutcome.SKIPPED, false, null,
            Map.of(), List.of(), null, null, now, now);
    }

    public boolean isFailure() {
        return outcome == StepOutcome.FAILURE;
    }

    /**
     * A failure that aborts the job (not marked best-effort).
     */
    public boolean isFatal() {
        return outcome == StepOutcome.FAILURE && !bestEffort;
    }
}
