package com.pipeline.examples.pages;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.actions.ActionRegistry;
import com.pipeline.actions.artifact.DownloadArtifactAction;
import com.pipeline.actions.artifact.UploadArtifactAction;
import com.pipeline.actions.cache.CacheRestoreAction;
import com.pipeline.actions.cache.CacheSaveAction;
import com.pipeline.actions.deploy.DeployAction;
import com.pipeline.actions.deploy.DeploymentPublisher;
import com.pipeline.actions.deploy.DirectoryHostingTarget;
import com.pipeline.actions.deploy.EnvironmentPolicy;
import com.pipeline.actions.quality.LoggingChangeRequestReporter;
import com.pipeline.actions.quality.QualityGateAction;
import com.pipeline.actions.quality.QualityGateReporter;
import com.pipeline.actions.quality.RuleBasedAnalysisService;
import com.pipeline.core.model.EventKind;
import com.pipeline.core.model.JobResult;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.StepResult;
import com.pipeline.core.trigger.TriggerEvaluator;
import com.pipeline.engine.coordinator.JobGraphEngine;
import com.pipeline.engine.coordinator.PipelineCoordinator;
import com.pipeline.engine.environment.ScriptedEnvironmentProvisioner;
import com.pipeline.engine.graph.WorkflowValidator;
import com.pipeline.engine.history.RunEventLog;
import com.pipeline.engine.loader.CompositeActionLoader;
import com.pipeline.engine.loader.WorkflowLoader;
import com.pipeline.engine.persistence.InMemoryArtifactStore;
import com.pipeline.engine.persistence.InMemoryCacheStore;
import com.pipeline.engine.persistence.InMemoryRunEventRepository;
import com.pipeline.engine.persistence.InMemoryRunRepository;
import com.pipeline.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.pipeline.engine.secret.ConfiguredSecretStore;
import com.pipeline.engine.service.PipelineService;
import com.pipeline.engine.service.PipelineService.EventOutcome;
import com.pipeline.engine.step.ConditionEvaluator;
import com.pipeline.engine.step.Interpolator;
import com.pipeline.engine.step.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Demonstration runner for the storefront pipelines.
 *
 * Shows:
 * 1. First push to main: dependency cache miss, build and publish to static hosting
 * 2. Repeated push: cache hit and a no-op deployment
 * 3. Push to a feature branch: deploy job skipped, cache restored from main
 * 4. Pull request adding debug output: quality gate fails and is posted to the change request
 * 5. Documentation-only push and a skip-marker commit: no runs started
 */
public class PagesPipelineDemo implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PagesPipelineDemo.class);

    public static final String DEFAULT_BRANCH = "main";
    public static final String REPOSITORY = "acme/storefront";
    public static final String ENVIRONMENT = "github-pages";

    static final String[] WORKFLOWS = {"deploy-pages.yml", "pull-request.yml"};
    static final String[] ACTIONS = {"setup-node-deps.yml"};

    private static final Duration RUN_TIMEOUT = Duration.ofMinutes(2);

    private final StorefrontRepository repository = new StorefrontRepository();
    private final InMemoryCacheStore cacheStore = new InMemoryCacheStore(256L * 1024 * 1024);
    private final LoggingChangeRequestReporter changeRequests = new LoggingChangeRequestReporter();
    private final DeploymentPublisher publisher;
    private final JobGraphEngine engine;
    private final PipelineService pipelineService;
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicInteger commits = new AtomicInteger();

    public PagesPipelineDemo(Path workDir) throws IOException {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        InMemoryRunRepository runRepository = new InMemoryRunRepository();
        InMemoryArtifactStore artifactStore = new InMemoryArtifactStore();

        ScriptedEnvironmentProvisioner provisioner = new ScriptedEnvironmentProvisioner(workDir.resolve("workspaces"));
        repository.attach(provisioner);

        this.publisher = new DeploymentPublisher(
            new DirectoryHostingTarget(workDir.resolve("hosting"), "https://acme.pages.example"),
            Map.of(ENVIRONMENT, new EnvironmentPolicy(ENVIRONMENT, List.of(DEFAULT_BRANCH))));
        QualityGateReporter qualityGate = new QualityGateReporter(new RuleBasedAnalysisService(), changeRequests);

        ActionRegistry actions = new ActionRegistry(List.of(
            new CacheRestoreAction(cacheStore, DEFAULT_BRANCH),
            new CacheSaveAction(cacheStore),
            new UploadArtifactAction(artifactStore),
            new DownloadArtifactAction(artifactStore),
            new DeployAction(artifactStore, publisher),
            new QualityGateAction(qualityGate, DEFAULT_BRANCH)));
        CompositeActionLoader actionLoader = new CompositeActionLoader();
        for (String file : ACTIONS) {
            try (InputStream in = resource("/examples/actions/" + file)) {
                actions.register(actionLoader.load(in, file));
            }
        }

        ConditionEvaluator conditions = new ConditionEvaluator();
        WorkflowValidator validator = new WorkflowValidator(actions, conditions);
        RunEventLog eventLog = new RunEventLog(new InMemoryRunEventRepository(), objectMapper);
        StepRunner stepRunner = new StepRunner(actions, conditions, new Interpolator(), objectMapper);
        this.engine = new JobGraphEngine(validator, stepRunner, conditions, provisioner, runRepository,
            artifactStore, ConfiguredSecretStore.of(Map.of()), eventLog, 4, Duration.ofMinutes(15));
        this.pipelineService = new PipelineCoordinator(new InMemoryWorkflowDefinitionRepository(), runRepository,
            validator, new TriggerEvaluator(), engine, accepting::get);

        WorkflowLoader workflowLoader = new WorkflowLoader();
        for (String file : WORKFLOWS) {
            try (InputStream in = resource("/examples/workflows/" + file)) {
                pipelineService.registerWorkflow(workflowLoader.load(in, file));
            }
        }
    }

    public static void main(String[] args) throws Exception {
        Path workDir = Files.createTempDirectory("pages-pipeline-demo");

        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║     PIPELINE ORCHESTRATOR - STOREFRONT PAGES DEMONSTRATION           ║");
        log.info("╠══════════════════════════════════════════════════════════════════════╣");
        log.info("║  Build, cache, deploy and quality-gate a React storefront            ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");

        try (PagesPipelineDemo demo = new PagesPipelineDemo(workDir)) {
            demo.runScenario1_FirstPushToMain();
            demo.runScenario2_RepeatedPush();
            demo.runScenario3_FeatureBranch();
            demo.runScenario4_PullRequestQualityGate();
            demo.runScenario5_IgnoredPushes();
        }

        log.info("");
        log.info("╔══════════════════════════════════════════════════════════════════════╗");
        log.info("║                    ALL DEMONSTRATIONS COMPLETE                       ║");
        log.info("╚══════════════════════════════════════════════════════════════════════╝");
        log.info("Workspaces and hosting output under {}", workDir);
    }

    // ========== Scenarios ==========

    /**
     * SCENARIO 1: the first build of main installs dependencies and publishes the site.
     */
    public Run runScenario1_FirstPushToMain() throws InterruptedException {
        banner("SCENARIO 1: First Push to Main");
        Run run = single(deliver(push(DEFAULT_BRANCH, "Initial storefront", "src/App.js")));
        summarize(run);
        return run;
    }

    /**
     * SCENARIO 2: the same lockfile restores node_modules, and unchanged content is not republished.
     */
    public Run runScenario2_RepeatedPush() throws InterruptedException {
        banner("SCENARIO 2: Repeated Push (Cache Hit, No-op Deploy)");
        Run run = single(deliver(push(DEFAULT_BRANCH, "Rebuild", "package.json")));
        summarize(run);
        return run;
    }

    /**
     * SCENARIO 3: feature branches build against main's cache and never deploy.
     */
    public Run runScenario3_FeatureBranch() throws InterruptedException {
        banner("SCENARIO 3: Push to a Feature Branch");
        repository.commit("src/Cart.js", "export const Cart = () => <aside>Cart</aside>;\n");
        Run run = single(deliver(push("feature/cart", "Add cart", "src/Cart.js")));
        summarize(run);
        return run;
    }

    /**
     * SCENARIO 4: a pull request introducing new debug output fails the quality gate;
     * the debug output already on main is reported as pre-existing.
     */
    public Run runScenario4_PullRequestQualityGate() throws InterruptedException {
        banner("SCENARIO 4: Pull Request Quality Gate");
        repository.commit("src/Cart.js", """
            export const Cart = ({ items }) => {
              console.log('cart items', items);
              return <aside>{items.length} items</aside>;
            };
            """);
        RepositoryEvent event = RepositoryEvent.builder()
            .kind(EventKind.PULL_REQUEST_OPENED)
            .repository(REPOSITORY)
            .ref(RepositoryEvent.BRANCH_REF_PREFIX + "feature/cart")
            .baseRef(RepositoryEvent.BRANCH_REF_PREFIX + DEFAULT_BRANCH)
            .changeRequestNumber(42)
            .commitSha(nextSha())
            .changedPaths(List.of("src/Cart.js"))
            .commitMessage("Show item count in cart")
            .actor("octo")
            .build();
        Run run = single(deliver(event));
        summarize(run);
        changeRequests.getPosted().forEach(posted ->
            log.info("Posted to {}#{}: {}", posted.repository(), posted.changeRequestNumber(),
                posted.report().summary()));
        return run;
    }

    /**
     * SCENARIO 5: a documentation-only push and a skip-marker commit start nothing.
     */
    public List<EventOutcome> runScenario5_IgnoredPushes() throws InterruptedException {
        banner("SCENARIO 5: Ignored Pushes");
        List<EventOutcome> outcomes = new ArrayList<>();
        repository.commit("docs/guide.md", "# Deploying\n");
        outcomes.add(deliver(push(DEFAULT_BRANCH, "Document deploys", "docs/guide.md", "README.md")));
        outcomes.add(deliver(push(DEFAULT_BRANCH, "Tweak copy [skip ci]", "src/App.js")));
        outcomes.forEach(outcome -> outcome.rejected().forEach(rejection ->
            log.info("  {} not started: {}", rejection.workflowName(), rejection.reason())));
        return outcomes;
    }

    // ========== Accessors ==========

    public StorefrontRepository getRepository() {
        return repository;
    }

    public InMemoryCacheStore getCacheStore() {
        return cacheStore;
    }

    public DeploymentPublisher getPublisher() {
        return publisher;
    }

    public LoggingChangeRequestReporter getChangeRequests() {
        return changeRequests;
    }

    public PipelineService getPipelineService() {
        return pipelineService;
    }

    @Override
    public void close() {
        accepting.set(false);
        engine.shutdown(Duration.ofSeconds(10));
    }

    // ========== Internal Methods ==========

    private EventOutcome deliver(RepositoryEvent event) throws InterruptedException {
        EventOutcome outcome = pipelineService.handleEvent(event);
        List<Run> finished = new ArrayList<>();
        for (Run run : outcome.started()) {
            finished.add(engine.await(run.runId(), RUN_TIMEOUT));
        }
        return new EventOutcome(finished, outcome.rejected());
    }

    private static Run single(EventOutcome outcome) {
        if (outcome.started().size() != 1) {
            throw new IllegalStateException("Expected one run, got " + outcome.started().size()
                + " (rejected: " + outcome.rejected() + ")");
        }
        return outcome.started().get(0);
    }

    private RepositoryEvent push(String branch, String message, String... changedPaths) {
        return RepositoryEvent.builder()
            .kind(EventKind.PUSH)
            .repository(REPOSITORY)
            .ref(RepositoryEvent.BRANCH_REF_PREFIX + branch)
            .commitSha(nextSha())
            .changedPaths(List.of(changedPaths))
            .commitMessage(message)
            .actor("octo")
            .build();
    }

    private String nextSha() {
        return String.format("%07x", 0xa11ce00 + commits.incrementAndGet());
    }

    private static void summarize(Run run) {
        log.info("Run {} of {} finished {}", run.runId(), run.workflowName(), run.state());
        for (JobResult job : run.jobs().values()) {
            log.info("  job {}: {}", job.jobId(), job.state());
            for (StepResult step : job.steps()) {
                log.info("    {} {} {}", step.stepId(), step.outcome(), step.outputs().isEmpty() ? "" : step.outputs());
            }
        }
    }

    private static void banner(String title) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════════════");
        log.info(title);
        log.info("═══════════════════════════════════════════════════════════════════════");
    }

    private static InputStream resource(String path) {
        InputStream in = PagesPipelineDemo.class.getResourceAsStream(path);
        if (in == null) {
            throw new UncheckedIOException(new IOException("Missing classpath resource " + path));
        }
        return in;
    }
}
