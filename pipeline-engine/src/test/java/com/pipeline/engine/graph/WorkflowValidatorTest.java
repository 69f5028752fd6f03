package com.pipeline.engine.graph;

import com.pipeline.actions.ActionRegistry;
import com.pipeline.actions.DeclaredCompositeAction;
import com.pipeline.actions.artifact.DownloadArtifactAction;
import com.pipeline.actions.artifact.UploadArtifactAction;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.core.model.TriggerSpec;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.engine.persistence.InMemoryArtifactStore;
import com.pipeline.engine.step.ConditionEvaluator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowValidatorTest {

    private final InMemoryArtifactStore artifacts = new InMemoryArtifactStore();
    private final ActionRegistry registry = new ActionRegistry(List.of(
        new UploadArtifactAction(artifacts),
        new DownloadArtifactAction(artifacts)));
    private final WorkflowValidator validator = new WorkflowValidator(registry, new ConditionEvaluator());

    @Test
    void validate_validWorkflow_shouldReturnLevelledGraph() {
        JobGraph graph = validator.validate(workflow(
            job("build", Set.of(), upload("site")),
            job("e2e", Set.of("build"), download("site")),
            job("deploy", Set.of("build", "e2e"), download("site"))));

        assertThat(graph.levels()).containsExactly(List.of("build"), List.of("e2e"), List.of("deploy"));
        assertThat(graph.descendantsOf("build")).containsExactlyInAnyOrder("e2e", "deploy");
    }

    @Test
    void validate_downloadWithoutProducingAncestor_shouldFail() {
        WorkflowDefinition definition = workflow(
            job("build", Set.of(), upload("site")),
            job("deploy", Set.of(), download("site")));

        assertThatThrownBy(() -> validator.validate(definition))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("jobs.deploy.steps.fetch")
            .hasMessageContaining("'site'");
    }

    @Test
    void validate_uploadEarlierInSameJob_shouldAllowDownload() {
        JobDefinition job = JobDefinition.builder()
            .jobId("package")
            .steps(List.of(
                StepDefinition.builder().stepId("store").uses(UploadArtifactAction.NAME)
                    .with(Map.of("name", "bundle", "path", "dist")).build(),
                StepDefinition.builder().stepId("fetch").uses(DownloadArtifactAction.NAME)
                    .with(Map.of("name", "bundle")).build()))
            .build();

        assertThat(validator.validate(workflow(job)).size()).isEqualTo(1);
    }

    @Test
    void validate_unknownAction_shouldFail() {
        WorkflowDefinition definition = workflow(job("lint", Set.of(),
            StepDefinition.builder().stepId("eslint").uses("eslint").build()));

        assertThatThrownBy(() -> validator.validate(definition))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("unknown composite action 'eslint'");
    }

    @Test
    void validate_missingRequiredInput_shouldFail() {
        WorkflowDefinition definition = workflow(job("build", Set.of(),
            StepDefinition.builder().stepId("store").uses(UploadArtifactAction.NAME)
                .with(Map.of("name", "site")).build()));

        assertThatThrownBy(() -> validator.validate(definition))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("'path'");
    }

    @Test
    void validate_stepWithRunAndUses_shouldFail() {
        WorkflowDefinition definition = workflow(job("build", Set.of(),
            StepDefinition.builder().stepId("both").run("make").uses(UploadArtifactAction.NAME).build()));

        assertThatThrownBy(() -> validator.validate(definition))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("exactly one of");
    }

    @Test
    void validate_unparseableCondition_shouldFail() {
        JobDefinition job = JobDefinition.builder()
            .jobId("build")
            .condition("event.branch == ")
            .steps(List.of(StepDefinition.builder().run("make").build()))
            .build();

        assertThatThrownBy(() -> validator.validate(workflow(job)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("jobs.build.if");
    }

    @Test
    void validate_declaredActionReferencingItself_shouldStopAtDepthLimit() {
        registry.register(new DeclaredCompositeAction("loop", null, List.of(InputSpec.optional("n", "1", null)),
            List.of(StepDefinition.builder().stepId("again").uses("loop").build()), Map.of()));
        WorkflowDefinition definition = workflow(job("build", Set.of(),
            StepDefinition.builder().stepId("start").uses("loop").build()));

        assertThatThrownBy(() -> validator.validate(definition))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("nested deeper");
    }

    @Test
    void validate_emptyJobs_shouldFail() {
        assertThatThrownBy(() -> validator.validate(WorkflowDefinition.builder().name("empty").build()))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("jobs");
    }

    @Test
    void validate_malformedBranchGlob_shouldFailAtRegistration() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("release")
            .trigger(TriggerSpec.builder().branches(List.of("main", "release/[")).build())
            .jobs(List.of(job("build", Set.of(), StepDefinition.builder().run("make").build())))
            .build();

        assertThatThrownBy(() -> validator.validate(definition))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("on.branches")
            .hasMessageContaining("release/[");
    }

    @Test
    void validate_malformedPathsIgnoreGlob_shouldFail() {
        WorkflowDefinition definition = WorkflowDefinition.builder()
            .name("docs")
            .trigger(TriggerSpec.builder().pathsIgnore(List.of("docs/{guides")).build())
            .jobs(List.of(job("build", Set.of(), StepDefinition.builder().run("make").build())))
            .build();

        assertThatThrownBy(() -> validator.validate(definition))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("on.paths-ignore");
    }

    private static WorkflowDefinition workflow(JobDefinition... jobs) {
        return WorkflowDefinition.builder().name("site").jobs(List.of(jobs)).build();
    }

    private static JobDefinition job(String jobId, Set<String> needs, StepDefinition step) {
        return JobDefinition.builder().jobId(jobId).needs(needs).steps(List.of(step)).build();
    }

    private static StepDefinition upload(String name) {
        return StepDefinition.builder().stepId("store").uses(UploadArtifactAction.NAME)
            .with(Map.of("name", name, "path", "build")).build();
    }

    private static StepDefinition download(String name) {
        return StepDefinition.builder().stepId("fetch").uses(DownloadArtifactAction.NAME)
            .with(Map.of("name", name)).build();
    }
}
