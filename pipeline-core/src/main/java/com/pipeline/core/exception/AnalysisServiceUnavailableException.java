package com.pipeline.core.exception;

/**
 * Thrown by an analysis service that cannot produce a report.
 * The quality gate turns this into an indeterminate report rather than a failure.
 */
public class AnalysisServiceUnavailableException extends PipelineException {
    
    public static final String ERROR_CODE = "ANALYSIS_SERVICE_UNAVAILABLE";
    
    public AnalysisServiceUnavailableException(String message) {
        super(ERROR_CODE, message);
    }
    
    public AnalysisServiceUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
