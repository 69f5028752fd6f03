package com.pipeline.core.exception;

/**
 * Thrown when a workflow declaration is invalid: cyclic or undefined {@code needs},
 * unresolvable action reference, missing required action input, or an artifact
 * consumed before any job produced it.
 *
 * <p>Never retried. The {@code location} points at the offending declaration
 * (e.g. {@code jobs.build.steps[2]}).
 */
public class ConfigurationException extends PipelineException {
    
    public static final String ERROR_CODE = "CONFIGURATION_ERROR";
    
    private final String location;
    
    public ConfigurationException(String message) {
        super(ERROR_CODE, message);
        this.location = null;
    }
    
    public ConfigurationException(String location, String reason) {
        super(ERROR_CODE, String.format("Invalid workflow configuration at %s: %s", location, reason));
        this.location = location;
    }
    
    protected ConfigurationException(String errorCode, String location, String message) {
        super(errorCode, message);
        this.location = location;
    }
    
    public String getLocation() {
        return location;
    }
}
