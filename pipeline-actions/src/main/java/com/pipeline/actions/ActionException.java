package com.pipeline.actions;

/**
 * Exception thrown by composite actions on failure.
 * Never retried: a failing action fails its step.
 */
public class ActionException extends Exception {
    
    private final String errorCode;
    
    public ActionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public ActionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
