package com.pipeline.core.model;

import com.pipeline.core.exception.InvalidStateTransitionException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A single execution of a workflow definition for one repository event.
 * 
 * Primary Key: runId
 * 
 * Invariants:
 * - workflow definition is fixed for the lifetime of the run
 * - jobs holds one entry per job of the definition, in declaration order
 * - completedAt set iff state is terminal
 */
public record Run(
    // Primary key
    UUID runId,
    
    // Definition reference
    String workflowName,
    int workflowVersion,
    
    // Trigger
    RepositoryEvent event,
    
    // Execution state
    RunState state,
    Map<String, JobResult> jobs,
    String errorCode,
    String errorMessage,
    
    // Reruns point at the run they repeat
    UUID rerunOf,
    
    // Timing
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    
    // Tracing
    String traceId
) {
    public Run {
        jobs = jobs != null ? Collections.unmodifiableMap(new LinkedHashMap<>(jobs)) : Map.of();
    }

    /**
     * Create a new run in QUEUED state with every job PENDING.
     */
    public static Run create(WorkflowDefinition definition, RepositoryEvent event, UUID rerunOf) {
        Map<String, JobResult> jobs = new LinkedHashMap<>();
        for (JobDefinition job : definition.jobs()) {
            jobs.put(job.jobId(), JobResult.pending(job.jobId()));
        }
        return new Run(
            UUID.randomUUID(),
            definition.name(),
            definition.version(),
            event,
            RunState.QUEUED,
            jobs,
            null,
            null,
            rerunOf,
            Instant.now(),
            null,
            null,
            UUID.randomUUID().toString()
        );
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public JobResult job(String jobId) {
        return jobs.get(jobId);
    }

    /**
     * Create a copy with the run started.
     */
    public Run withStarted() {
        checkTransition(RunState.RUNNING);
        return new Run(runId, workflowName, workflowVersion, event, RunState.RUNNING, jobs,
            errorCode, errorMessage, rerunOf, createdAt, Instant.now(), completedAt, traceId);
    }

    /**
     * Create a copy with one job result replaced.
     */
    public Run withJob(JobResult jobResult) {
        Map<String, JobResult> updated = new LinkedHashMap<>(jobs);
        updated.put(jobResult.jobId(), jobResult);
        return new Run(runId, workflowName, workflowVersion, event, state, updated,
            errorCode, errorMessage, rerunOf, createdAt, startedAt, completedAt, traceId);
    }

    /**
     * Create a copy in a terminal state.
     */
    public Run withCompleted(RunState finalState, String code, String message) {
        checkTransition(finalState);
        return new Run(runId, workflowName, workflowVersion, event, finalState, jobs,
            code, message, rerunOf, createdAt, startedAt, Instant.now(), traceId);
    }

    private void checkTransition(RunState target) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidStateTransitionException("Run", runId, state, target);
        }
    }
}
