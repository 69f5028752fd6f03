package com.pipeline.core.repository;

import com.pipeline.core.model.Run;
import com.pipeline.core.model.RunState;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Repository for Run persistence.
 */
public interface RunRepository {

    /**
     * Store a new run.
     * 
     * @param run The run to store
     * @throws IllegalArgumentException if a run with the same id exists
     */
    void save(Run run);

    /**
     * Atomically apply a mutation to a stored run.
     * 
     * @param runId The run ID
     * @param mutation Function producing the new run from the current one
     * @return The updated run
     * @throws com.pipeline.core.exception.NotFoundException if the run does not exist
     */
    Run update(UUID runId, UnaryOperator<Run> mutation);

    Optional<Run> findById(UUID runId);

    /**
     * Find runs by state.
     * 
     * @param state The state to filter by
     * @param limit Maximum number of results
     * @return Runs ordered by creation time, newest first
     */
    List<Run> findByState(RunState state, int limit);

    /**
     * Find runs of a workflow, newest first.
     */
    List<Run> findByWorkflow(String workflowName, int limit);

    /**
     * Find runs not yet in a terminal state.
     */
    List<Run> findActive();
}
