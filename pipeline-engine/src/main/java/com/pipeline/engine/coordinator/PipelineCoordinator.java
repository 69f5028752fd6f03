package com.pipeline.engine.coordinator;

import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.model.EventKind;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.core.repository.RunRepository;
import com.pipeline.core.repository.WorkflowDefinitionRepository;
import com.pipeline.core.trigger.TriggerDecision;
import com.pipeline.core.trigger.TriggerEvaluator;
import com.pipeline.engine.graph.WorkflowValidator;
import com.pipeline.engine.service.PipelineService;
import com.pipeline.engine.service.ShuttingDownException;
import com.pipeline.engine.service.TriggerRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Entry point for repository events and run management: evaluates triggers,
 * hands accepted events to the job graph engine and tracks definition versions.
 */
public class PipelineCoordinator implements PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineCoordinator.class);

    private final WorkflowDefinitionRepository definitionRepository;
    private final RunRepository runRepository;
    private final WorkflowValidator validator;
    private final TriggerEvaluator triggerEvaluator;
    private final JobGraphEngine engine;
    private final BooleanSupplier acceptingRuns;

    public PipelineCoordinator(
            WorkflowDefinitionRepository definitionRepository,
            RunRepository runRepository,
            WorkflowValidator validator,
            TriggerEvaluator triggerEvaluator,
            JobGraphEngine engine,
            BooleanSupplier acceptingRuns) {
        this.definitionRepository = definitionRepository;
        this.runRepository = runRepository;
        this.validator = validator;
        this.triggerEvaluator = triggerEvaluator;
        this.engine = engine;
        this.acceptingRuns = acceptingRuns;
    }

    @Override
    public WorkflowDefinition registerWorkflow(WorkflowDefinition definition) {
        log.info("Registering workflow: {}", definition.name());

        // Validate workflow definition
        validator.validate(definition);

        // Assign next version
        int nextVersion = definitionRepository.getNextVersion(definition.name());
        WorkflowDefinition versioned = definition.withVersion(nextVersion);
        definitionRepository.save(versioned);

        log.info("Registered workflow: {}", versioned.id());
        return versioned;
    }

    @Override
    public List<WorkflowDefinition> listWorkflows() {
        return definitionRepository.listLatest();
    }

    @Override
    public EventOutcome handleEvent(RepositoryEvent event) {
        log.info("Received {} event for {} on {} ({})", event.kind().triggerName(), event.repository(),
            event.ref(), event.commitSha());
        checkAcceptingRuns();

        List<Run> started = new ArrayList<>();
        List<Rejection> rejected = new ArrayList<>();
        for (WorkflowDefinition definition : definitionRepository.listLatest()) {
            TriggerDecision decision = triggerEvaluator.evaluate(event, definition.trigger());
            if (!decision.accepted()) {
                log.debug("Workflow {} ignores the event: {}", definition.id(), decision.reason());
                rejected.add(new Rejection(definition.name(), decision.reason()));
                continue;
            }
            try {
                started.add(engine.start(definition, event, null));
            } catch (ConfigurationException e) {
                log.error("Workflow {} cannot run: {}", definition.id(), e.getMessage());
                rejected.add(new Rejection(definition.name(), e.getMessage()));
            }
        }
        log.info("Event started {} runs, {} workflows did not trigger", started.size(), rejected.size());
        return new EventOutcome(started, rejected);
    }

    @Override
    public Run dispatch(DispatchRequest request) {
        checkAcceptingRuns();
        WorkflowDefinition definition = definitionRepository.findLatest(request.workflowName())
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition", request.workflowName()));

        RepositoryEvent event = RepositoryEvent.builder()
            .kind(EventKind.MANUAL_DISPATCH)
            .repository(request.repository())
            .ref(request.ref())
            .commitSha(request.commitSha())
            .actor(request.actor())
            .receivedAt(Instant.now())
            .build();

        TriggerDecision decision = triggerEvaluator.evaluate(event, definition.trigger());
        if (!decision.accepted()) {
            throw new TriggerRejectedException(definition.name(), decision.reason());
        }
        log.info("Dispatching workflow {} on {} for {}", definition.id(), request.ref(), request.actor());
        return engine.start(definition, event, null);
    }

    @Override
    public Run getRun(UUID runId) {
        return engine.getRun(runId);
    }

    @Override
    public List<Run> listRuns(String workflowName, int limit) {
        return runRepository.findByWorkflow(workflowName, limit);
    }

    @Override
    public void cancelRun(UUID runId, String reason) {
        engine.cancel(runId, reason != null ? reason : "cancelled by request");
    }

    @Override
    public Run rerun(UUID runId) {
        checkAcceptingRuns();
        Run previous = engine.getRun(runId);
        WorkflowDefinition definition = definitionRepository
            .find(previous.workflowName(), previous.workflowVersion())
            .orElseThrow(() -> new NotFoundException("WorkflowDefinition",
                previous.workflowName() + ":" + previous.workflowVersion()));

        log.info("Re-running {} as a new run of {}", runId, definition.id());
        return engine.start(definition, previous.event(), runId);
    }

    // ========== Internal Methods ==========

    private void checkAcceptingRuns() {
        if (!acceptingRuns.getAsBoolean()) {
            throw new ShuttingDownException();
        }
    }
}
