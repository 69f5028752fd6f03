package com.pipeline.engine.service;

import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.WorkflowDefinition;

import java.util.List;
import java.util.UUID;

/**
 * Core service for pipeline orchestration.
 * Registers workflows, turns repository events into runs and manages run lifecycle.
 */
public interface PipelineService {

    /**
     * Register a workflow definition.
     *
     * @param definition The workflow definition
     * @return The registered definition with version assigned
     * @throws com.pipeline.core.exception.ConfigurationException if the workflow is invalid
     */
    WorkflowDefinition registerWorkflow(WorkflowDefinition definition);

    /**
     * Latest version of every registered workflow.
     */
    List<WorkflowDefinition> listWorkflows();

    /**
     * Evaluate every workflow's trigger against an event and start a run for each accepting workflow.
     *
     * @param event The repository event
     * @return Started runs and per-workflow rejections
     */
    EventOutcome handleEvent(RepositoryEvent event);

    /**
     * Start a workflow manually.
     *
     * @param request The dispatch request
     * @return The queued run
     * @throws com.pipeline.core.exception.NotFoundException if no such workflow is registered
     * @throws TriggerRejectedException if the workflow does not accept manual dispatch
     */
    Run dispatch(DispatchRequest request);

    /**
     * Get run by ID.
     */
    Run getRun(UUID runId);

    /**
     * Runs of a workflow, newest first.
     */
    List<Run> listRuns(String workflowName, int limit);

    /**
     * Cancel an active run.
     *
     * @param runId The run
     * @param reason The cancellation reason
     */
    void cancelRun(UUID runId, String reason);

    /**
     * Re-run a workflow for the event of an earlier run, using the same definition version.
     *
     * @param runId The run to repeat
     * @return The new run
     */
    Run rerun(UUID runId);

    /**
     * Request to start a workflow manually.
     */
    record DispatchRequest(
        String workflowName,
        String repository,
        String ref,
        String commitSha,
        String actor
    ) {}

    /**
     * Result of delivering one repository event.
     */
    record EventOutcome(
        List<Run> started,
        List<Rejection> rejected
    ) {
        public EventOutcome {
            started = started != null ? List.copyOf(started) : List.of();
            rejected = rejected != null ? List.copyOf(rejected) : List.of();
        }
    }

    /**
     * A workflow that did not start for an event, and why.
     */
    record Rejection(
        String workflowName,
        String reason
    ) {}
}
