package com.pipeline.api.rest;

import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.TriggerSpec;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.engine.service.PipelineService;
import com.pipeline.engine.service.PipelineService.DispatchRequest;
import org.springframework.beans.factory.annotation.Value;
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
import java.util.Set;

/**
 * REST API for registered workflows and manual dispatch.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private final PipelineService pipelineService;
    private final String defaultBranch;

    public WorkflowController(PipelineService pipelineService,
                              @Value("${pipeline.default-branch:main}") String defaultBranch) {
        this.pipelineService = pipelineService;
        this.defaultBranch = defaultBranch;
    }

    /**
     * Latest version of every registered workflow.
     */
    @GetMapping
    public ResponseEntity<List<WorkflowResponse>> listWorkflows() {
        return ResponseEntity.ok(pipelineService.listWorkflows().stream()
            .map(WorkflowResponse::from)
            .toList());
    }

    /**
     * Start a workflow manually. The ref defaults to the default branch.
     */
    @PostMapping("/{workflowName}/dispatch")
    public ResponseEntity<RunController.RunResponse> dispatch(
            @PathVariable String workflowName,
            @RequestBody(required = false) DispatchRequestDto request) {

        DispatchRequestDto body = request != null ? request : new DispatchRequestDto(null, null, null, null);
        String ref = body.ref() != null ? body.ref() : RepositoryEvent.BRANCH_REF_PREFIX + defaultBranch;
        Run run = pipelineService.dispatch(new DispatchRequest(
            workflowName,
            body.repository(),
            ref,
            body.commitSha(),
            body.actor()
        ));

        return ResponseEntity.status(HttpStatus.CREATED).body(RunController.RunResponse.from(run));
    }

    /**
     * Runs of a workflow, newest first.
     */
    @GetMapping("/{workflowName}/runs")
    public ResponseEntity<List<RunController.RunResponse>> listRuns(
            @PathVariable String workflowName,
            @RequestParam(defaultValue = "20") int limit) {

        return ResponseEntity.ok(pipelineService.listRuns(workflowName, limit).stream()
            .map(RunController.RunResponse::from)
            .toList());
    }

    // ========== DTOs ==========

    public record DispatchRequestDto(
        String repository,
        String ref,
        String commitSha,
        String actor
    ) {}

    public record WorkflowResponse(
        String name,
        int version,
        String description,
        Set<String> events,
        List<String> branches,
        boolean manualDispatch,
        List<String> jobs,
        Instant createdAt
    ) {
        public static WorkflowResponse from(WorkflowDefinition definition) {
            TriggerSpec trigger = definition.trigger();
            return new WorkflowResponse(
                definition.name(),
                definition.version(),
                definition.description(),
                trigger.events(),
                trigger.branches(),
                trigger.manualDispatch(),
                definition.jobs().stream().map(JobDefinition::jobId).toList(),
                definition.createdAt()
            );
        }
    }
}
