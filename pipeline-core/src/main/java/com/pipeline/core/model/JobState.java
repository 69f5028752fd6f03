package com.pipeline.core.model;

/**
 * Lifecycle states for a job within a run.
 */
public enum JobState {
    PENDING,
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(JobState target) {
        return switch (this) {
            case PENDING -> target == QUEUED || target == SKIPPED || target == CANCELLED || target == FAILED;
            case QUEUED -> target == RUNNING || target == SKIPPED || target == CANCELLED;
            case RUNNING -> target == SUCCEEDED || target == FAILED || target == CANCELLED;
            case SUCCEEDED, FAILED, SKIPPED, CANCELLED -> false;
        };
    }
}
