package com.pipeline.core.exception;

/**
 * Thrown when a run lacks the environment-scoped write authorization a deployment needs.
 * Fatal for the job and never retried automatically.
 */
public class AuthorizationException extends PipelineException {
    
    public static final String ERROR_CODE = "AUTHORIZATION_DENIED";
    
    private final String environment;
    
    public AuthorizationException(String environment, String reason) {
        super(ERROR_CODE, String.format(
            "Not authorized to publish to environment '%s': %s",
            environment, reason
        ));
        this.environment = environment;
    }
    
    public String getEnvironment() {
        return environment;
    }
}
