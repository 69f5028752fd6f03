package com.pipeline.engine.coordinator;

import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.RunState;
import com.pipeline.core.model.TriggerSpec;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.core.trigger.TriggerEvaluator;
import com.pipeline.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.pipeline.engine.service.PipelineService.DispatchRequest;
import com.pipeline.engine.service.PipelineService.EventOutcome;
import com.pipeline.engine.service.PipelineService.Rejection;
import com.pipeline.engine.service.ShuttingDownException;
import com.pipeline.engine.service.TriggerRejectedException;
import com.pipeline.engine.test.TestPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.pipeline.engine.test.TestPipeline.job;
import static com.pipeline.engine.test.TestPipeline.push;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineCoordinatorTest {

    @TempDir
    Path tempDir;

    private TestPipeline pipeline;
    private PipelineCoordinator coordinator;
    private final AtomicBoolean accepting = new AtomicBoolean(true);

    @BeforeEach
    void setUp() {
        pipeline = TestPipeline.create(tempDir);
        coordinator = new PipelineCoordinator(new InMemoryWorkflowDefinitionRepository(), pipeline.runRepository(),
            pipeline.validator(), new TriggerEvaluator(), pipeline.engine(), accepting::get);
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    void registerWorkflow_twice_shouldAssignIncreasingVersions() {
        WorkflowDefinition first = coordinator.registerWorkflow(workflow("ci", TriggerSpec.builder().build()));
        WorkflowDefinition second = coordinator.registerWorkflow(workflow("ci", TriggerSpec.builder().build()));

        assertThat(first.version()).isEqualTo(1);
        assertThat(second.version()).isEqualTo(2);
        assertThat(coordinator.listWorkflows()).extracting(WorkflowDefinition::id).containsExactly("ci:2");
    }

    @Test
    void registerWorkflow_invalid_shouldNotBeStored() {
        WorkflowDefinition invalid = WorkflowDefinition.builder()
            .name("broken")
            .jobs(List.of(JobDefinition.builder().jobId("a").needs(Set.of("a"))
                .steps(List.of(TestPipeline.shell("x"))).build()))
            .build();

        assertThatThrownBy(() -> coordinator.registerWorkflow(invalid)).isInstanceOf(ConfigurationException.class);
        assertThat(coordinator.listWorkflows()).isEmpty();
    }

    @Test
    void registerWorkflow_malformedBranchGlob_shouldLeaveOtherWorkflowsTriggerable() throws Exception {
        coordinator.registerWorkflow(workflow("deploy", TriggerSpec.builder().branches(List.of("main")).build()));

        assertThatThrownBy(() -> coordinator.registerWorkflow(
            workflow("release", TriggerSpec.builder().branches(List.of("release/[")).build())))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("on.branches");

        EventOutcome outcome = coordinator.handleEvent(push("main"));

        assertThat(outcome.started()).extracting(Run::workflowName).containsExactly("deploy");
        pipeline.engine().await(outcome.started().get(0).runId(), Duration.ofSeconds(10));
    }

    @Test
    void handleEvent_shouldStartOnlyMatchingWorkflows() throws Exception {
        coordinator.registerWorkflow(workflow("deploy", TriggerSpec.builder().branches(List.of("main")).build()));
        coordinator.registerWorkflow(workflow("docs", TriggerSpec.builder()
            .pathsIgnore(List.of("src/**")).build()));
        coordinator.registerWorkflow(workflow("pr", TriggerSpec.builder()
            .events(Set.of("pull_request")).build()));

        EventOutcome outcome = coordinator.handleEvent(RepositoryEvent.builder()
            .ref("refs/heads/main")
            .commitSha("abc")
            .changedPaths(List.of("src/App.js"))
            .build());

        assertThat(outcome.started()).extracting(Run::workflowName).containsExactly("deploy");
        assertThat(outcome.rejected()).extracting(Rejection::workflowName).containsExactlyInAnyOrder("docs", "pr");
        Run run = pipeline.engine().await(outcome.started().get(0).runId(), Duration.ofSeconds(10));
        assertThat(run.state()).isEqualTo(RunState.SUCCESS);
    }

    @Test
    void handleEvent_skipMarker_shouldStartNothing() {
        coordinator.registerWorkflow(workflow("deploy", TriggerSpec.builder().build()));

        EventOutcome outcome = coordinator.handleEvent(RepositoryEvent.builder()
            .ref("refs/heads/main")
            .commitMessage("Update README [SKIP CI]")
            .build());

        assertThat(outcome.started()).isEmpty();
        assertThat(outcome.rejected().get(0).reason()).contains("skip marker");
    }

    @Test
    void dispatch_enabledWorkflow_shouldStartRun() throws Exception {
        coordinator.registerWorkflow(workflow("deploy", TriggerSpec.builder().manualDispatch(true).build()));

        Run queued = coordinator.dispatch(new DispatchRequest("deploy", "acme/site", "refs/heads/main", "abc", "octo"));
        Run run = pipeline.engine().await(queued.runId(), Duration.ofSeconds(10));

        assertThat(run.state()).isEqualTo(RunState.SUCCESS);
        assertThat(run.event().actor()).isEqualTo("octo");
    }

    @Test
    void dispatch_notEnabled_shouldBeRejected() {
        coordinator.registerWorkflow(workflow("deploy", TriggerSpec.builder().build()));

        assertThatThrownBy(() -> coordinator.dispatch(
            new DispatchRequest("deploy", "acme/site", "refs/heads/main", "abc", "octo")))
            .isInstanceOf(TriggerRejectedException.class)
            .hasMessageContaining("not enabled");
    }

    @Test
    void dispatch_unknownWorkflow_shouldFailNotFound() {
        assertThatThrownBy(() -> coordinator.dispatch(new DispatchRequest("nope", null, null, null, null)))
            .isInstanceOf(NotFoundException.class)
            .extracting("entityId").isEqualTo("nope");
    }

    @Test
    void rerun_shouldRepeatEventWithSameDefinitionVersion() throws Exception {
        coordinator.registerWorkflow(workflow("deploy", TriggerSpec.builder().build()));
        Run original = pipeline.engine().await(
            coordinator.handleEvent(push("main")).started().get(0).runId(), Duration.ofSeconds(10));
        coordinator.registerWorkflow(workflow("deploy", TriggerSpec.builder().build()));

        Run rerun = pipeline.engine().await(coordinator.rerun(original.runId()).runId(), Duration.ofSeconds(10));

        assertThat(rerun.runId()).isNotEqualTo(original.runId());
        assertThat(rerun.rerunOf()).isEqualTo(original.runId());
        assertThat(rerun.workflowVersion()).isEqualTo(original.workflowVersion());
        assertThat(rerun.event()).isEqualTo(original.event());
        assertThat(coordinator.listRuns("deploy", 10)).hasSize(2);
    }

    @Test
    void handleEvent_whileShuttingDown_shouldRefuse() {
        accepting.set(false);

        assertThatThrownBy(() -> coordinator.handleEvent(push("main")))
            .isInstanceOf(ShuttingDownException.class);
    }

    private static WorkflowDefinition workflow(String name, TriggerSpec trigger) {
        return WorkflowDefinition.builder()
            .name(name)
            .trigger(trigger)
            .jobs(List.of(job("build", "npm ci")))
            .build();
    }
}
