package com.pipeline.engine.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.actions.ActionRegistry;
import com.pipeline.actions.CompositeAction;
import com.pipeline.actions.artifact.DownloadArtifactAction;
import com.pipeline.actions.artifact.UploadArtifactAction;
import com.pipeline.actions.cache.CacheRestoreAction;
import com.pipeline.actions.cache.CacheSaveAction;
import com.pipeline.actions.deploy.DeployAction;
import com.pipeline.actions.deploy.DeploymentPublisher;
import com.pipeline.actions.deploy.DirectoryHostingTarget;
import com.pipeline.actions.deploy.EnvironmentPolicy;
import com.pipeline.core.model.EventKind;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.RunEvent;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.engine.coordinator.JobGraphEngine;
import com.pipeline.engine.environment.ScriptedEnvironmentProvisioner;
import com.pipeline.engine.graph.WorkflowValidator;
import com.pipeline.engine.history.RunEventLog;
import com.pipeline.engine.persistence.InMemoryArtifactStore;
import com.pipeline.engine.persistence.InMemoryCacheStore;
import com.pipeline.engine.persistence.InMemoryRunEventRepository;
import com.pipeline.engine.persistence.InMemoryRunRepository;
import com.pipeline.engine.secret.ConfiguredSecretStore;
import com.pipeline.engine.step.ConditionEvaluator;
import com.pipeline.engine.step.Interpolator;
import com.pipeline.engine.step.StepRunner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fully wired engine over in-memory stores and the dry-run provisioner.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * TestPipeline pipeline = TestPipeline.create(tempDir);
 * pipeline.provisioner().on("npm test", (cmd, ws, env) -> CommandResult.failure(1, List.of("1 failing")));
 * Run run = pipeline.engine().execute(definition, TestPipeline.push("main"));
 * }</pre>
 */
public class TestPipeline implements AutoCloseable {

    public static final String DEFAULT_BRANCH = "main";

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final InMemoryRunRepository runRepository = new InMemoryRunRepository();
    private final InMemoryRunEventRepository eventRepository = new InMemoryRunEventRepository();
    private final InMemoryArtifactStore artifactStore = new InMemoryArtifactStore();
    private final InMemoryCacheStore cacheStore;
    private final ScriptedEnvironmentProvisioner provisioner;
    private final DeploymentPublisher publisher;
    private final ActionRegistry actionRegistry;
    private final ConditionEvaluator conditionEvaluator = new ConditionEvaluator();
    private final WorkflowValidator validator;
    private final RunEventLog eventLog;
    private final JobGraphEngine engine;

    private TestPipeline(Path baseDir, Map<String, String> secrets, long cacheBudget, Duration jobTimeout) {
        this.cacheStore = new InMemoryCacheStore(cacheBudget);
        this.provisioner = new ScriptedEnvironmentProvisioner(baseDir.resolve("workspaces"));
        this.publisher = new DeploymentPublisher(
            new DirectoryHostingTarget(baseDir.resolve("hosting"), "https://pages.example.test"),
            Map.of("github-pages", new EnvironmentPolicy("github-pages", List.of(DEFAULT_BRANCH))));
        this.actionRegistry = new ActionRegistry(List.of(
            new CacheRestoreAction(cacheStore, DEFAULT_BRANCH),
            new CacheSaveAction(cacheStore),
            new UploadArtifactAction(artifactStore),
            new DownloadArtifactAction(artifactStore),
            new DeployAction(artifactStore, publisher)));
        this.validator = new WorkflowValidator(actionRegistry, conditionEvaluator);
        this.eventLog = new RunEventLog(eventRepository, objectMapper);
        StepRunner stepRunner = new StepRunner(actionRegistry, conditionEvaluator, new Interpolator(), objectMapper);
        this.engine = new JobGraphEngine(validator, stepRunner, conditionEvaluator, provisioner,
            runRepository, artifactStore, ConfiguredSecretStore.of(secrets), eventLog, 4, jobTimeout);
    }

    public static TestPipeline create(Path baseDir) {
        return new TestPipeline(baseDir, Map.of(), 64 * 1024 * 1024, Duration.ofMinutes(5));
    }

    public static TestPipeline withSecrets(Path baseDir, Map<String, String> secrets) {
        return new TestPipeline(baseDir, secrets, 64 * 1024 * 1024, Duration.ofMinutes(5));
    }

    public static TestPipeline withJobTimeout(Path baseDir, Duration jobTimeout) {
        return new TestPipeline(baseDir, Map.of(), 64 * 1024 * 1024, jobTimeout);
    }

    public TestPipeline register(CompositeAction action) {
        actionRegistry.register(action);
        return this;
    }

    // ========== Definitions ==========

    public static RepositoryEvent push(String branch) {
        return RepositoryEvent.builder()
            .kind(EventKind.PUSH)
            .repository("acme/storefront")
            .ref(RepositoryEvent.BRANCH_REF_PREFIX + branch)
            .commitSha("0a1b2c3d")
            .actor("octo")
            .build();
    }

    public static RepositoryEvent pullRequest(String headBranch, int number) {
        return RepositoryEvent.builder()
            .kind(EventKind.PULL_REQUEST_OPENED)
            .repository("acme/storefront")
            .ref(RepositoryEvent.BRANCH_REF_PREFIX + headBranch)
            .baseRef(RepositoryEvent.BRANCH_REF_PREFIX + DEFAULT_BRANCH)
            .changeRequestNumber(number)
            .commitSha("4e5f6a7b")
            .actor("octo")
            .build();
    }

    public static JobDefinition job(String jobId, String... commands) {
        return JobDefinition.builder()
            .jobId(jobId)
            .steps(Arrays.stream(commands).map(TestPipeline::shell).toList())
            .build();
    }

    public static StepDefinition shell(String command) {
        return StepDefinition.builder().run(command).build();
    }

    public static StepDefinition action(String stepId, String uses, Map<String, String> with) {
        return StepDefinition.builder().stepId(stepId).uses(uses).with(with).build();
    }

    // ========== Accessors ==========

    public JobGraphEngine engine() {
        return engine;
    }

    public ScriptedEnvironmentProvisioner provisioner() {
        return provisioner;
    }

    public InMemoryRunRepository runRepository() {
        return runRepository;
    }

    public InMemoryRunEventRepository eventRepository() {
        return eventRepository;
    }

    public InMemoryArtifactStore artifactStore() {
        return artifactStore;
    }

    public InMemoryCacheStore cacheStore() {
        return cacheStore;
    }

    public DeploymentPublisher publisher() {
        return publisher;
    }

    public ActionRegistry actionRegistry() {
        return actionRegistry;
    }

    public WorkflowValidator validator() {
        return validator;
    }

    public RunEventLog eventLog() {
        return eventLog;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public List<RunEventType> eventTypes(UUID runId) {
        return eventLog.events(runId).stream().map(RunEvent::type).toList();
    }

    @Override
    public void close() {
        engine.shutdown(Duration.ofSeconds(5));
    }
}
