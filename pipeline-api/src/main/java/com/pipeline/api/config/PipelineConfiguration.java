package com.pipeline.api.config;

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
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.core.repository.ArtifactStore;
import com.pipeline.core.repository.CacheStore;
import com.pipeline.core.repository.RunEventRepository;
import com.pipeline.core.repository.RunRepository;
import com.pipeline.core.repository.WorkflowDefinitionRepository;
import com.pipeline.core.secret.SecretStore;
import com.pipeline.core.trigger.TriggerEvaluator;
import com.pipeline.engine.coordinator.JobGraphEngine;
import com.pipeline.engine.coordinator.PipelineCoordinator;
import com.pipeline.engine.environment.EnvironmentProvisioner;
import com.pipeline.engine.environment.LocalProcessProvisioner;
import com.pipeline.engine.environment.ScriptedEnvironmentProvisioner;
import com.pipeline.engine.graph.WorkflowValidator;
import com.pipeline.engine.history.RunEventLog;
import com.pipeline.engine.history.RunHistoryService;
import com.pipeline.engine.lifecycle.GracefulShutdownHandler;
import com.pipeline.engine.loader.CompositeActionLoader;
import com.pipeline.engine.loader.WorkflowLoader;
import com.pipeline.engine.persistence.InMemoryArtifactStore;
import com.pipeline.engine.persistence.InMemoryCacheStore;
import com.pipeline.engine.persistence.InMemoryRunEventRepository;
import com.pipeline.engine.persistence.InMemoryRunRepository;
import com.pipeline.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.pipeline.engine.secret.ConfiguredSecretStore;
import com.pipeline.engine.service.PipelineService;
import com.pipeline.engine.step.ConditionEvaluator;
import com.pipeline.engine.step.Interpolator;
import com.pipeline.engine.step.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the orchestrator from {@link PipelineProperties}.
 *
 * Stores are in-memory; a restart loses run history, cache entries and live deployments.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfiguration.class);

    // ========== Stores ==========

    @Bean
    public RunRepository runRepository() {
        return new InMemoryRunRepository();
    }

    @Bean
    public RunEventRepository runEventRepository() {
        return new InMemoryRunEventRepository();
    }

    @Bean
    public WorkflowDefinitionRepository workflowDefinitionRepository() {
        return new InMemoryWorkflowDefinitionRepository();
    }

    @Bean
    public ArtifactStore artifactStore() {
        return new InMemoryArtifactStore();
    }

    @Bean
    public CacheStore cacheStore(PipelineProperties properties) {
        return new InMemoryCacheStore(properties.getCache().getMaxSize().toBytes());
    }

    @Bean
    public SecretStore secretStore(PipelineProperties properties) {
        return new ConfiguredSecretStore(properties.getSecrets().getShared(), properties.getSecrets().getWorkflows());
    }

    @Bean
    public RunEventLog runEventLog(RunEventRepository runEventRepository, ObjectMapper objectMapper) {
        return new RunEventLog(runEventRepository, objectMapper);
    }

    // ========== Actions ==========

    @Bean
    public DeploymentPublisher deploymentPublisher(PipelineProperties properties) {
        Map<String, EnvironmentPolicy> policies = new LinkedHashMap<>();
        properties.getEnvironments().forEach((name, branches) ->
            policies.put(name, new EnvironmentPolicy(name, branches)));
        return new DeploymentPublisher(
            new DirectoryHostingTarget(properties.getHosting().getRoot(), properties.getHosting().getBaseUrl()),
            policies);
    }

    @Bean
    public QualityGateReporter qualityGateReporter() {
        return new QualityGateReporter(new RuleBasedAnalysisService(), new LoggingChangeRequestReporter());
    }

    @Bean
    public ActionRegistry actionRegistry(
            PipelineProperties properties,
            CacheStore cacheStore,
            ArtifactStore artifactStore,
            DeploymentPublisher deploymentPublisher,
            QualityGateReporter qualityGateReporter) {
        String defaultBranch = properties.getDefaultBranch();
        ActionRegistry registry = new ActionRegistry(List.of(
            new CacheRestoreAction(cacheStore, defaultBranch),
            new CacheSaveAction(cacheStore),
            new UploadArtifactAction(artifactStore),
            new DownloadArtifactAction(artifactStore),
            new DeployAction(artifactStore, deploymentPublisher),
            new QualityGateAction(qualityGateReporter, defaultBranch)));

        new CompositeActionLoader().loadDirectory(properties.getActionDir()).forEach(registry::register);
        log.info("Action registry ready: {}", registry.names());
        return registry;
    }

    // ========== Engine ==========

    @Bean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    public WorkflowValidator workflowValidator(ActionRegistry actionRegistry, ConditionEvaluator conditionEvaluator) {
        return new WorkflowValidator(actionRegistry, conditionEvaluator);
    }

    @Bean
    public StepRunner stepRunner(ActionRegistry actionRegistry, ConditionEvaluator conditionEvaluator,
                                 ObjectMapper objectMapper) {
        return new StepRunner(actionRegistry, conditionEvaluator, new Interpolator(), objectMapper);
    }

    @Bean
    public EnvironmentProvisioner environmentProvisioner(PipelineProperties properties) {
        PipelineProperties.Runner runner = properties.getRunner();
        if (runner.getMode() == PipelineProperties.RunnerMode.DRY_RUN) {
            log.warn("Runner mode is dry-run: commands are logged, not executed");
            return new ScriptedEnvironmentProvisioner(runner.getWorkspaceRoot());
        }
        return new LocalProcessProvisioner(runner.getWorkspaceRoot());
    }

    @Bean
    public JobGraphEngine jobGraphEngine(
            PipelineProperties properties,
            WorkflowValidator workflowValidator,
            StepRunner stepRunner,
            ConditionEvaluator conditionEvaluator,
            EnvironmentProvisioner environmentProvisioner,
            RunRepository runRepository,
            ArtifactStore artifactStore,
            SecretStore secretStore,
            RunEventLog runEventLog) {
        return new JobGraphEngine(workflowValidator, stepRunner, conditionEvaluator, environmentProvisioner,
            runRepository, artifactStore, secretStore, runEventLog,
            properties.getMaxParallelJobs(), properties.getDefaultJobTimeout());
    }

    @Bean
    public PipelineService pipelineService(
            WorkflowDefinitionRepository workflowDefinitionRepository,
            RunRepository runRepository,
            WorkflowValidator workflowValidator,
            JobGraphEngine jobGraphEngine,
            GracefulShutdownHandler shutdownHandler) {
        return new PipelineCoordinator(workflowDefinitionRepository, runRepository, workflowValidator,
            new TriggerEvaluator(), jobGraphEngine, shutdownHandler::canAcceptRuns);
    }

    @Bean
    public RunHistoryService runHistoryService(RunEventRepository runEventRepository, RunRepository runRepository) {
        return new RunHistoryService(runEventRepository, runRepository);
    }

    /**
     * Registers the workflow files found at startup. A file that does not parse stops startup;
     * a workflow that fails validation is logged and left unregistered.
     */
    @Bean
    public ApplicationRunner workflowRegistrar(PipelineProperties properties, PipelineService pipelineService) {
        return args -> {
            List<WorkflowDefinition> definitions = new WorkflowLoader().loadDirectory(properties.getWorkflowDir());
            for (WorkflowDefinition definition : definitions) {
                try {
                    pipelineService.registerWorkflow(definition);
                } catch (ConfigurationException e) {
                    log.error("Workflow {} not registered: {}", definition.name(), e.getMessage());
                }
            }
            log.info("Registered {} of {} workflows from {}", pipelineService.listWorkflows().size(),
                definitions.size(), properties.getWorkflowDir());
        };
    }
}
