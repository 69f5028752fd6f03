package com.pipeline.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Named output produced by a job, visible to later jobs of the same run only.
 * Retained artifacts survive the end-of-run purge.
 */
public record Artifact(
    UUID runId,
    String name,
    Blob blob,
    String producerJobId,
    boolean retained,
    Instant createdAt
) {
    public static Artifact create(UUID runId, String name, Blob blob, String producerJobId, boolean retained) {
        return new Artifact(runId, name, blob, producerJobId, retained, Instant.now());
    }
}
