package com.pipeline.core.repository;

import com.pipeline.core.model.Artifact;
import com.pipeline.core.model.Blob;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Run-scoped storage for job outputs.
 * An artifact stored under one run is never visible under another.
 */
public interface ArtifactStore {

    /**
     * Store an artifact for a run, replacing any earlier artifact of the same name.
     * 
     * @param runId The owning run
     * @param name The artifact name
     * @param blob The content
     * @param producerJobId The job that produced it
     * @param retained Whether it survives the end-of-run purge
     * @return The stored artifact
     */
    Artifact put(UUID runId, String name, Blob blob, String producerJobId, boolean retained);

    /**
     * Find an artifact of a run by name.
     */
    Optional<Artifact> get(UUID runId, String name);

    /**
     * List the artifacts of a run ordered by name.
     */
    List<Artifact> list(UUID runId);

    /**
     * Remove the non-retained artifacts of a run.
     * 
     * @return Number of artifacts removed
     */
    int purge(UUID runId);
}
