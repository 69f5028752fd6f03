package com.pipeline.engine.service;

import com.pipeline.core.exception.PipelineException;

/**
 * Thrown when a run is requested while the orchestrator is shutting down.
 */
public class ShuttingDownException extends PipelineException {

    public static final String ERROR_CODE = "SHUTTING_DOWN";

    public ShuttingDownException() {
        super(ERROR_CODE, "Orchestrator is shutting down and accepts no new runs");
    }
}
