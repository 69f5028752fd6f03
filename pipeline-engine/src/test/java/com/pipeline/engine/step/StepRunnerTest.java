package com.pipeline.engine.step;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.actions.ActionRegistry;
import com.pipeline.actions.DeclaredCompositeAction;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.RunContext;
import com.pipeline.core.model.RunEvent;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.core.model.StepOutcome;
import com.pipeline.core.model.StepResult;
import com.pipeline.engine.environment.CommandResult;
import com.pipeline.engine.environment.ExecutionEnvironment;
import com.pipeline.engine.environment.ScriptedEnvironmentProvisioner;
import com.pipeline.engine.history.RunEventLog;
import com.pipeline.engine.persistence.InMemoryRunEventRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.MalformedInputException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class StepRunnerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ActionRegistry registry = new ActionRegistry();
    private final RunEventLog eventLog = new RunEventLog(new InMemoryRunEventRepository(), objectMapper);
    private final StepRunner runner = new StepRunner(registry, new ConditionEvaluator(), new Interpolator(),
        objectMapper);

    private ScriptedEnvironmentProvisioner provisioner;
    private ExecutionEnvironment environment;
    private RunContext run;

    @BeforeEach
    void setUp() {
        provisioner = new ScriptedEnvironmentProvisioner(tempDir);
        run = new RunContext(UUID.randomUUID(), "site",
            RepositoryEvent.builder().ref("refs/heads/main").commitSha("abc123").repository("acme/site").build(),
            Map.of("NODE_ENV", "production", "REGISTRY", "https://npm.example.test"),
            Map.of("NPM_TOKEN", "s3cr3t-token"),
            Map.of(),
            "trace-1");
        environment = provisioner.provision("ubuntu-latest", run.runId(), "build");
    }

    @AfterEach
    void tearDown() {
        environment.close();
    }

    // ========== Outputs and Interpolation ==========

    @Test
    void parseOutputs_shouldAcceptBothCommandForms() {
        Map<String, String> outputs = StepRunner.parseOutputs(List.of(
            "building...",
            "::set-output version=1.4.2",
            "::set-output name=digest::sha256:ab=cd",
            "::set-output malformed"));

        assertThat(outputs).containsExactly(
            Map.entry("version", "1.4.2"),
            Map.entry("digest", "sha256:ab=cd"));
    }

    @Test
    void run_stepOutputs_shouldFeedLaterCommands() throws Exception {
        provisioner.on("./version.sh", (cmd, ws, env) -> CommandResult.success(List.of("::set-output tag=v1.4.2")));

        List<StepResult> results = runner.run(execution(
            StepDefinition.builder().stepId("version").run("./version.sh").build(),
            StepDefinition.builder().stepId("tag").run("git tag ${{ steps.version.outputs.tag }}").build()));

        assertThat(results.get(0).outputs()).containsEntry("tag", "v1.4.2");
        assertThat(provisioner.getExecuted()).containsExactly("build: ./version.sh", "build: git tag v1.4.2");
    }

    @Test
    void run_shouldLayerWorkflowJobAndStepEnv() throws Exception {
        List<Map<String, String>> seen = new ArrayList<>();
        provisioner.on("env", (cmd, ws, env) -> {
            seen.add(env);
            return CommandResult.success(List.of());
        });
        JobDefinition job = JobDefinition.builder()
            .jobId("build")
            .env(Map.of("NODE_ENV", "test", "CACHE_DIR", "${{ runner.os }}-cache"))
            .steps(List.of(StepDefinition.builder()
                .run("env")
                .env(Map.of("GREETING", "built ${{ event.sha }} in ${{ env.NODE_ENV }}"))
                .build()))
            .build();

        runner.run(new JobExecution(run, job, environment, eventLog, null));

        Map<String, String> env = seen.get(0);
        assertThat(env)
            .containsEntry("NODE_ENV", "test")
            .containsEntry("REGISTRY", "https://npm.example.test")
            .containsEntry("CACHE_DIR", "ubuntu-latest-cache")
            .containsEntry("GREETING", "built abc123 in test")
            .containsEntry("CI", "true")
            .containsEntry("PIPELINE_JOB", "build")
            .containsEntry("PIPELINE_SHA", "abc123")
            .containsEntry("PIPELINE_RUN_ID", run.runId().toString())
            .doesNotContainKey("NPM_TOKEN");
    }

    @Test
    void run_unknownReference_shouldInterpolateToEmpty() throws Exception {
        runner.run(execution(StepDefinition.builder().run("echo [${{ inputs.missing }}]").build()));

        assertThat(provisioner.getExecuted()).containsExactly("build: echo []");
    }

    // ========== Secrets ==========

    @Test
    void run_shouldMaskSecretsInLogsAndErrors() throws Exception {
        provisioner.on("npm publish", (cmd, ws, env) ->
            CommandResult.failure(1, List.of("401 for token s3cr3t-token")));

        List<StepResult> results = runner.run(execution(
            StepDefinition.builder().stepId("login").run("npm login --token ${{ secrets.NPM_TOKEN }}").build(),
            StepDefinition.builder().stepId("publish").run("npm publish").build()));

        assertThat(provisioner.getExecuted()).contains("build: npm login --token s3cr3t-token");
        assertThat(results.get(0).log()).containsExactly("[dry-run] npm login --token ***");
        assertThat(results.get(1).log()).containsExactly("401 for token ***");
        assertThat(String.join("\n", eventLog.events(run.runId()).stream()
            .map(RunEvent::payload).map(Object::toString).toList()))
            .doesNotContain("s3cr3t-token");
    }

    // ========== Failure Handling ==========

    @Test
    void run_fatalFailure_shouldSkipEveryLaterStepIncludingAlways() throws Exception {
        provisioner.on("npm test", (cmd, ws, env) -> CommandResult.failure(3, List.of()));

        List<StepResult> results = runner.run(execution(
            StepDefinition.builder().stepId("test").run("npm test").build(),
            StepDefinition.builder().stepId("cleanup").run("rm -rf tmp").condition("always()").build()));

        assertThat(results).extracting(StepResult::outcome)
            .containsExactly(StepOutcome.FAILURE, StepOutcome.SKIPPED);
        assertThat(results.get(0).errorCode()).isEqualTo(StepRunner.ERROR_COMMAND_FAILED);
        assertThat(results.get(0).exitCode()).isEqualTo(3);
    }

    @Test
    void run_unknownActionOnBestEffortStep_shouldStillBeFatal() throws Exception {
        List<StepResult> results = runner.run(execution(
            StepDefinition.builder().stepId("lint").uses("eslint").continueOnError(true).build(),
            StepDefinition.builder().stepId("build").run("npm run build").build()));

        assertThat(results.get(0).isFatal()).isTrue();
        assertThat(results.get(0).errorCode()).isEqualTo(ConfigurationException.ERROR_CODE);
        assertThat(results.get(1).outcome()).isEqualTo(StepOutcome.SKIPPED);
    }

    @Test
    void run_commandOutputUnreadable_shouldFailStepWithIoError() throws Exception {
        provisioner.on("npm run build", (cmd, ws, env) -> {
            throw new MalformedInputException(1);
        });

        List<StepResult> results = runner.run(execution(
            StepDefinition.builder().stepId("build").run("npm run build").build(),
            StepDefinition.builder().stepId("upload").run("./upload.sh").build()));

        assertThat(results).extracting(StepResult::outcome)
            .containsExactly(StepOutcome.FAILURE, StepOutcome.SKIPPED);
        assertThat(results.get(0).errorCode()).isEqualTo(StepRunner.ERROR_IO);
        assertThat(results.get(0).errorMessage()).contains("Input length = 1");
        assertThat(eventLog.events(run.runId())).extracting(RunEvent::type)
            .contains(RunEventType.STEP_FAILED);
    }

    // ========== Composite Actions ==========

    @Test
    void run_declaredAction_shouldRunNestedStepsAndMapOutputs() throws Exception {
        provisioner.on("node --version", (cmd, ws, env) -> CommandResult.success(List.of("::set-output version=18")));
        registry.register(setupNode());

        List<StepResult> results = runner.run(execution(StepDefinition.builder()
            .stepId("setup")
            .uses("setup-node")
            .with(Map.of("registry", "${{ env.REGISTRY }}"))
            .build()));

        assertThat(results.get(0).outcome()).isEqualTo(StepOutcome.SUCCESS);
        assertThat(results.get(0).outputs()).containsEntry("node-version", "18");
        assertThat(results.get(0).log()).contains("[dry-run] npm config set registry https://npm.example.test");
        assertThat(provisioner.getExecuted()).containsExactly(
            "build: npm config set registry https://npm.example.test",
            "build: node --version");
        assertThat(eventLog.events(run.runId())).extracting(RunEvent::stepId)
            .containsExactly("setup.configure", "setup.version", "setup");
    }

    @Test
    void run_declaredActionNestedFailure_shouldFailInvokingStep() throws Exception {
        provisioner.on("npm config", (cmd, ws, env) -> CommandResult.failure(1, List.of("bad registry")));
        registry.register(setupNode());

        List<StepResult> results = runner.run(execution(StepDefinition.builder()
            .stepId("setup")
            .uses("setup-node")
            .with(Map.of("registry", "nowhere"))
            .build()));

        assertThat(results.get(0).outcome()).isEqualTo(StepOutcome.FAILURE);
        assertThat(results.get(0).errorCode()).isEqualTo(DeclaredCompositeAction.ERROR_NESTED_STEP_FAILED);
        assertThat(results.get(0).errorMessage()).contains("configure");
        assertThat(provisioner.getExecuted()).doesNotContain("build: node --version");
    }

    @Test
    void run_missingRequiredInput_shouldFailWithConfigurationError() throws Exception {
        registry.register(setupNode());

        List<StepResult> results = runner.run(execution(StepDefinition.builder()
            .stepId("setup")
            .uses("setup-node")
            .with(Map.of("registry", "${{ env.UNSET }}"))
            .build()));

        assertThat(results.get(0).errorCode()).isEqualTo(ConfigurationException.ERROR_CODE);
        assertThat(results.get(0).errorMessage()).contains("registry");
    }

    // ========== Helpers ==========

    private JobExecution execution(StepDefinition... steps) {
        JobDefinition job = JobDefinition.builder().jobId("build").steps(List.of(steps)).build();
        return new JobExecution(run, job, environment, eventLog, null);
    }

    private static DeclaredCompositeAction setupNode() {
        return new DeclaredCompositeAction(
            "setup-node",
            "Point npm at a registry and report the node version",
            List.of(InputSpec.required("registry", "npm registry URL")),
            List.of(
                StepDefinition.builder().stepId("configure").run("npm config set registry ${{ inputs.registry }}").build(),
                StepDefinition.builder().stepId("version").run("node --version").build()),
            Map.of("node-version", "${{ steps.version.outputs.version }}"));
    }
}
