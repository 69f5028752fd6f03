package com.pipeline.core.exception;

/**
 * A run or job was asked to move to a state its lifecycle does not allow,
 * e.g. cancelling a run that already finished.
 */
public class InvalidStateTransitionException extends PipelineException {

    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";

    private final String currentState;
    private final String targetState;

    public InvalidStateTransitionException(String entityType, Object entityId, Enum<?> currentState, Enum<?> targetState) {
        super(ERROR_CODE, String.format("%s %s is %s and cannot become %s",
            entityType, entityId, currentState, targetState));
        this.currentState = currentState.name();
        this.targetState = targetState.name();
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getTargetState() {
        return targetState;
    }
}
