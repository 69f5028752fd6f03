package com.pipeline.core.repository;

import com.pipeline.core.model.WorkflowDefinition;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowDefinition persistence.
 * Workflow definitions are immutable once stored; re-registering a name adds a version.
 */
public interface WorkflowDefinitionRepository {

    /**
     * Store a workflow definition.
     * 
     * @param definition The workflow definition to store
     */
    void save(WorkflowDefinition definition);

    /**
     * Find a workflow definition by name and version.
     */
    Optional<WorkflowDefinition> find(String name, int version);

    /**
     * Find the latest version of a workflow definition.
     */
    Optional<WorkflowDefinition> findLatest(String name);

    /**
     * List the latest version of every workflow, ordered by name.
     */
    List<WorkflowDefinition> listLatest();

    /**
     * Get the next available version number for a workflow.
     * 
     * @param name The workflow name
     * @return The next version number (1 if no versions exist)
     */
    int getNextVersion(String name);
}
