package com.pipeline.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of something that happened during a run.
 * Append-only log for audit and troubleshooting.
 * 
 * Primary Key: eventId
 * Index: (runId, sequenceNumber)
 * 
 * Invariants:
 * - sequenceNumber is contiguous within a run
 * - events are never modified
 */
public record RunEvent(
    UUID eventId,
    UUID runId,
    long sequenceNumber,
    RunEventType type,
    Instant timestamp,
    
    // Scope within the run (null for run-level events)
    String jobId,
    String stepId,
    
    JsonNode payload,
    String traceId
) {
    public static RunEvent create(
            UUID runId,
            long sequenceNumber,
            RunEventType type,
            String jobId,
            String stepId,
            JsonNode payload,
            String traceId) {
        return new RunEvent(
            UUID.randomUUID(),
            runId,
            sequenceNumber,
            type,
            Instant.now(),
            jobId,
            stepId,
            payload,
            traceId
        );
    }

    public boolean isRunEvent() {
        return type.name().startsWith("RUN_");
    }

    public boolean isJobEvent() {
        return type.name().startsWith("JOB_");
    }
}
