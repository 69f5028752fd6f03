package com.pipeline.core.exception;

import java.util.UUID;

/**
 * Thrown when a job downloads an artifact that no job of the same run has uploaded.
 * A configuration error detected at runtime: the consuming job is missing a {@code needs} edge.
 */
public class ArtifactNotFoundException extends ConfigurationException {
    
    public static final String ERROR_CODE = "ARTIFACT_NOT_FOUND";
    
    private final String artifactName;
    
    public ArtifactNotFoundException(UUID runId, String artifactName, String location) {
        super(ERROR_CODE, location, String.format(
            "Artifact '%s' not found in run %s (consumed at %s before any job produced it)",
            artifactName, runId, location
        ));
        this.artifactName = artifactName;
    }
    
    public String getArtifactName() {
        return artifactName;
    }
}
