package com.pipeline.api.rest;

import com.pipeline.core.model.EventKind;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.engine.service.PipelineService;
import com.pipeline.engine.service.PipelineService.EventOutcome;
import com.pipeline.engine.service.PipelineService.Rejection;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Intake for repository events from the hosting platform.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final PipelineService pipelineService;

    public EventController(PipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    /**
     * Deliver a repository event. Responds 202 when at least one run started.
     */
    @PostMapping
    public ResponseEntity<EventResponse> deliver(@RequestBody EventRequest request) {
        EventOutcome outcome = pipelineService.handleEvent(request.toEvent());

        EventResponse body = new EventResponse(
            outcome.started().stream().map(RunController.RunResponse::from).toList(),
            outcome.rejected());
        HttpStatus status = outcome.started().isEmpty() ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(body);
    }

    // ========== DTOs ==========

    public record EventRequest(
        EventKind kind,
        String repository,
        String ref,
        String baseRef,
        Integer changeRequestNumber,
        String commitSha,
        List<String> changedPaths,
        String commitMessage,
        String actor
    ) {
        RepositoryEvent toEvent() {
            return RepositoryEvent.builder()
                .kind(kind != null ? kind : EventKind.PUSH)
                .repository(repository)
                .ref(ref)
                .baseRef(baseRef)
                .changeRequestNumber(changeRequestNumber)
                .commitSha(commitSha)
                .changedPaths(changedPaths)
                .commitMessage(commitMessage)
                .actor(actor)
                .build();
        }
    }

    public record EventResponse(
        List<RunController.RunResponse> started,
        List<Rejection> rejected
    ) {}
}
