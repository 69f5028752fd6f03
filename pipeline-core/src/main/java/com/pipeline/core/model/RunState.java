package com.pipeline.core.model;

/**
 * Lifecycle states for a workflow run.
 * Transitions follow a strict state machine.
 */
public enum RunState {
    /**
     * Run accepted by the trigger, waiting for the executor.
     * Transitions: -> RUNNING, CANCELLED
     */
    QUEUED,

    /**
     * Jobs are being scheduled.
     * Transitions: -> SUCCESS, FAILED, SKIPPED, CANCELLED
     */
    RUNNING,

    /**
     * Every executed job succeeded. Terminal state.
     */
    SUCCESS,

    /**
     * At least one job failed, or the workflow configuration was rejected. Terminal state.
     */
    FAILED,

    /**
     * Cancelled by user request or shutdown. Terminal state.
     */
    CANCELLED,

    /**
     * Every job was skipped by its condition. Terminal state.
     */
    SKIPPED;

    /**
     * Check if this state is terminal.
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == CANCELLED || this == SKIPPED;
    }

    /**
     * Check if this state can transition to the target state.
     */
    public boolean canTransitionTo(RunState target) {
        return switch (this) {
            case QUEUED -> target == RUNNING || target == CANCELLED || target == FAILED;
            case RUNNING -> target == SUCCESS || target == FAILED || target == SKIPPED || target == CANCELLED;
            case SUCCESS, FAILED, CANCELLED, SKIPPED -> false;
        };
    }
}
