package com.pipeline.engine.service;

import com.pipeline.core.exception.PipelineException;

/**
 * Thrown when a manual dispatch is refused by the workflow's trigger filter.
 * Event deliveries report rejections as data instead.
 */
public class TriggerRejectedException extends PipelineException {

    public static final String ERROR_CODE = "TRIGGER_REJECTED";

    private final String workflowName;

    public TriggerRejectedException(String workflowName, String reason) {
        super(ERROR_CODE, String.format("Workflow %s not started: %s", workflowName, reason));
        this.workflowName = workflowName;
    }

    public String getWorkflowName() {
        return workflowName;
    }
}
