package com.pipeline.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of publishing an artifact to a hosting environment.
 * A no-op record means identical content was already live.
 */
public record DeploymentRecord(
    UUID deploymentId,
    String environment,
    String artifactName,
    String contentHash,
    String url,
    boolean noop,
    UUID runId,
    Instant publishedAt
) {
    public static DeploymentRecord published(String environment, String artifactName, String contentHash,
                                             String url, UUID runId) {
        return new DeploymentRecord(UUID.randomUUID(), environment, artifactName, contentHash,
            url, false, runId, Instant.now());
    }

    /**
     * Copy of an earlier record reported as a no-op for a repeated publish.
     */
    public DeploymentRecord asNoop(UUID repeatRunId) {
        return new DeploymentRecord(deploymentId, environment, artifactName, contentHash,
            url, true, repeatRunId, Instant.now());
    }
}
