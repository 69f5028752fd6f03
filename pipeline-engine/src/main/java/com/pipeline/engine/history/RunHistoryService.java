package com.pipeline.engine.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.model.JobResult;
import com.pipeline.core.model.JobState;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.RunEvent;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.model.RunState;
import com.pipeline.core.model.StepOutcome;
import com.pipeline.core.model.StepResult;
import com.pipeline.core.repository.RunEventRepository;
import com.pipeline.core.repository.RunRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for run history: the recorded log, a timeline of key events, per-job
 * summaries with step logs, and statistics.
 */
public class RunHistoryService {

    private static final int SUMMARY_LIMIT = 200;

    private final RunEventRepository eventRepository;
    private final RunRepository runRepository;

    public RunHistoryService(RunEventRepository eventRepository, RunRepository runRepository) {
        this.eventRepository = eventRepository;
        this.runRepository = runRepository;
    }

    /**
     * Get full history for a run.
     */
    public RunHistory getHistory(UUID runId) {
        Run run = runRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("Run", runId.toString()));
        List<RunEvent> events = eventRepository.findByRun(runId);

        return new RunHistory(
            runId,
            run.workflowName(),
            run.workflowVersion(),
            run.state(),
            run.rerunOf(),
            events,
            buildTimeline(events),
            buildJobHistory(run),
            calculateStatistics(run, events)
        );
    }

    /**
     * Events of a run, optionally only those of the given types.
     */
    public List<RunEvent> getEvents(UUID runId, List<RunEventType> types) {
        if (types == null || types.isEmpty()) {
            return eventRepository.findByRun(runId);
        }
        return eventRepository.findByRunAndTypes(runId, types);
    }

    /**
     * Runs of a workflow, newest first.
     */
    public List<Run> listRuns(String workflowName, int limit) {
        return runRepository.findByWorkflow(workflowName, limit);
    }

    // ========== Internal Methods ==========

    private List<TimelineEntry> buildTimeline(List<RunEvent> events) {
        return events.stream()
            .filter(e -> isKeyEvent(e.type()))
            .map(e -> new TimelineEntry(
                e.timestamp(),
                e.sequenceNumber(),
                e.type().name(),
                e.jobId(),
                e.stepId(),
                summarizePayload(e.payload())
            ))
            .collect(Collectors.toList());
    }

    private Map<String, JobHistory> buildJobHistory(Run run) {
        Map<String, JobHistory> jobs = new LinkedHashMap<>();
        for (JobResult job : run.jobs().values()) {
            List<StepSummary> steps = new ArrayList<>();
            for (StepResult step : job.steps()) {
                steps.add(new StepSummary(step.stepId(), step.name(), step.outcome(), step.bestEffort(),
                    step.exitCode(), step.outputs(), step.log(), step.errorCode(), step.errorMessage()));
            }
            jobs.put(job.jobId(), new JobHistory(job.jobId(), job.state(), steps, job.artifacts(),
                job.failedStepId(), job.errorMessage(), duration(job.startedAt(), job.completedAt())));
        }
        return jobs;
    }

    private RunStatistics calculateStatistics(Run run, List<RunEvent> events) {
        Map<JobState, Long> jobsByState = run.jobs().values().stream()
            .collect(Collectors.groupingBy(JobResult::state, Collectors.counting()));
        Map<StepOutcome, Long> stepsByOutcome = run.jobs().values().stream()
            .flatMap(j -> j.steps().stream())
            .collect(Collectors.groupingBy(StepResult::outcome, Collectors.counting()));
        long cacheHits = events.stream().filter(e -> e.type() == RunEventType.CACHE_HIT).count();
        long cacheMisses = events.stream().filter(e -> e.type() == RunEventType.CACHE_MISS).count();

        Duration total = run.startedAt() == null ? Duration.ZERO
            : duration(run.startedAt(), run.completedAt() != null ? run.completedAt() : Instant.now());

        return new RunStatistics(events.size(), jobsByState, stepsByOutcome, cacheHits, cacheMisses, total);
    }

    private boolean isKeyEvent(RunEventType type) {
        return switch (type) {
            case STEP_SUCCEEDED, STEP_SKIPPED -> false;
            default -> true;
        };
    }

    private String summarizePayload(JsonNode payload) {
        if (payload == null) return null;
        String str = payload.toString();
        return str.length() > SUMMARY_LIMIT ? str.substring(0, SUMMARY_LIMIT) + "..." : str;
    }

    private static Duration duration(Instant start, Instant end) {
        if (start == null || end == null) {
            return Duration.ZERO;
        }
        return Duration.between(start, end);
    }

    // ========== DTOs ==========

    public record RunHistory(
        UUID runId,
        String workflowName,
        int workflowVersion,
        RunState state,
        UUID rerunOf,
        List<RunEvent> events,
        List<TimelineEntry> timeline,
        Map<String, JobHistory> jobs,
        RunStatistics statistics
    ) {}

    public record TimelineEntry(
        Instant timestamp,
        long sequenceNumber,
        String eventType,
        String jobId,
        String stepId,
        String summary
    ) {}

    public record JobHistory(
        String jobId,
        JobState state,
        List<StepSummary> steps,
        List<String> artifacts,
        String failedStepId,
        String reason,
        Duration duration
    ) {}

    public record StepSummary(
        String stepId,
        String name,
        StepOutcome outcome,
        boolean bestEffort,
        Integer exitCode,
        Map<String, String> outputs,
        List<String> log,
        String errorCode,
        String errorMessage
    ) {}

    public record RunStatistics(
        long totalEvents,
        Map<JobState, Long> jobsByState,
        Map<StepOutcome, Long> stepsByOutcome,
        long cacheHits,
        long cacheMisses,
        Duration totalDuration
    ) {}
}
