package com.pipeline.api.rest;

import com.pipeline.core.exception.AuthorizationException;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.exception.InvalidStateTransitionException;
import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.exception.PipelineException;
import com.pipeline.engine.service.ShuttingDownException;
import com.pipeline.engine.service.TriggerRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps pipeline error codes to HTTP statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(AuthorizationException e) {
        return respond(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidStateTransitionException.class, TriggerRejectedException.class})
    public ResponseEntity<ErrorResponse> handleConflict(PipelineException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(ShuttingDownException.class)
    public ResponseEntity<ErrorResponse> handleShuttingDown(ShuttingDownException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handleOther(PipelineException e) {
        log.error("Unmapped pipeline error [{}]", e.getErrorCode(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, PipelineException e) {
        log.debug("{} -> {}: {}", e.getErrorCode(), status.value(), e.getMessage());
        return ResponseEntity.status(status)
            .body(new ErrorResponse(e.getErrorCode(), e.getMessage(), Instant.now()));
    }

    public record ErrorResponse(String errorCode, String message, Instant timestamp) {}
}
