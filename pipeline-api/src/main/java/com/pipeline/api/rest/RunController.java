package com.pipeline.api.rest;

import com.pipeline.core.model.EventKind;
import com.pipeline.core.model.JobResult;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.RunEvent;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.model.RunState;
import com.pipeline.engine.history.RunHistoryService;
import com.pipeline.engine.history.RunHistoryService.RunHistory;
import com.pipeline.engine.service.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for runs: state, recorded log, history, cancel and re-run.
 */
@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private final PipelineService pipelineService;
    private final RunHistoryService historyService;

    public RunController(PipelineService pipelineService, RunHistoryService historyService) {
        this.pipelineService = pipelineService;
        this.historyService = historyService;
    }

    /**
     * Get run by ID.
     */
    @GetMapping("/{runId}")
    public ResponseEntity<RunResponse> getRun(@PathVariable UUID runId) {
        return ResponseEntity.ok(RunResponse.from(pipelineService.getRun(runId)));
    }

    /**
     * Recorded events of a run in sequence order, optionally only the given types.
     */
    @GetMapping("/{runId}/log")
    public ResponseEntity<List<RunEvent>> getLog(
            @PathVariable UUID runId,
            @RequestParam(required = false) List<RunEventType> types) {

        // 404 for unknown runs rather than an empty log
        pipelineService.getRun(runId);
        return ResponseEntity.ok(historyService.getEvents(runId, types));
    }

    /**
     * Timeline, per-job step summaries and statistics.
     */
    @GetMapping("/{runId}/history")
    public ResponseEntity<RunHistory> getHistory(@PathVariable UUID runId) {
        return ResponseEntity.ok(historyService.getHistory(runId));
    }

    /**
     * Cancel an active run.
     */
    @PostMapping("/{runId}/cancel")
    public ResponseEntity<RunResponse> cancelRun(
            @PathVariable UUID runId,
            @RequestBody(required = false) CancelRequest request) {

        String reason = request != null ? request.reason() : "Manual cancellation";
        pipelineService.cancelRun(runId, reason);

        return ResponseEntity.ok(RunResponse.from(pipelineService.getRun(runId)));
    }

    /**
     * Start a new run for the same event and definition version.
     */
    @PostMapping("/{runId}/rerun")
    public ResponseEntity<RunResponse> rerun(@PathVariable UUID runId) {
        Run run = pipelineService.rerun(runId);
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    // ========== DTOs ==========

    public record CancelRequest(String reason) {}

    public record RunResponse(
        UUID runId,
        String workflowName,
        int workflowVersion,
        RunState state,
        EventKind eventKind,
        String ref,
        String commitSha,
        String actor,
        Map<String, JobResult> jobs,
        String errorCode,
        String errorMessage,
        UUID rerunOf,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String traceId
    ) {
        public static RunResponse from(Run run) {
            return new RunResponse(
                run.runId(),
                run.workflowName(),
                run.workflowVersion(),
                run.state(),
                run.event().kind(),
                run.event().ref(),
                run.event().commitSha(),
                run.event().actor(),
                run.jobs(),
                run.errorCode(),
                run.errorMessage(),
                run.rerunOf(),
                run.createdAt(),
                run.startedAt(),
                run.completedAt(),
                run.traceId()
            );
        }
    }
}
