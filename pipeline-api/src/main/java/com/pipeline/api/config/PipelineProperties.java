package com.pipeline.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code pipeline.*}.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    public enum RunnerMode {
        LOCAL,
        DRY_RUN
    }

    /** Directory of workflow YAML files registered at startup. */
    private Path workflowDir = Path.of("workflows");

    /** Directory of composite action YAML files. */
    private Path actionDir = Path.of("actions");

    private int maxParallelJobs = 4;

    private Duration defaultJobTimeout = Duration.ofMinutes(360);

    private String defaultBranch = "main";

    private final Runner runner = new Runner();

    private final Cache cache = new Cache();

    private final Hosting hosting = new Hosting();

    /** Environment name to the branches allowed to deploy there. */
    private Map<String, List<String>> environments = new LinkedHashMap<>();

    private final Secrets secrets = new Secrets();

    public Path getWorkflowDir() {
        return workflowDir;
    }

    public void setWorkflowDir(Path workflowDir) {
        this.workflowDir = workflowDir;
    }

    public Path getActionDir() {
        return actionDir;
    }

    public void setActionDir(Path actionDir) {
        this.actionDir = actionDir;
    }

    public int getMaxParallelJobs() {
        return maxParallelJobs;
    }

    public void setMaxParallelJobs(int maxParallelJobs) {
        this.maxParallelJobs = maxParallelJobs;
    }

    public Duration getDefaultJobTimeout() {
        return defaultJobTimeout;
    }

    public void setDefaultJobTimeout(Duration defaultJobTimeout) {
        this.defaultJobTimeout = defaultJobTimeout;
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    public void setDefaultBranch(String defaultBranch) {
        this.defaultBranch = defaultBranch;
    }

    public Runner getRunner() {
        return runner;
    }

    public Cache getCache() {
        return cache;
    }

    public Hosting getHosting() {
        return hosting;
    }

    public Map<String, List<String>> getEnvironments() {
        return environments;
    }

    public void setEnvironments(Map<String, List<String>> environments) {
        this.environments = environments;
    }

    public Secrets getSecrets() {
        return secrets;
    }

    public static class Runner {

        private RunnerMode mode = RunnerMode.LOCAL;

        /** Parent directory of job workspaces. */
        private Path workspaceRoot = Path.of(System.getProperty("java.io.tmpdir"), "pipeline-workspaces");

        public RunnerMode getMode() {
            return mode;
        }

        public void setMode(RunnerMode mode) {
            this.mode = mode;
        }

        public Path getWorkspaceRoot() {
            return workspaceRoot;
        }

        public void setWorkspaceRoot(Path workspaceRoot) {
            this.workspaceRoot = workspaceRoot;
        }
    }

    public static class Cache {

        private DataSize maxSize = DataSize.ofGigabytes(10);

        public DataSize getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(DataSize maxSize) {
            this.maxSize = maxSize;
        }
    }

    public static class Hosting {

        private Path root = Path.of("public");

        private String baseUrl = "http://localhost:8080/sites";

        public Path getRoot() {
            return root;
        }

        public void setRoot(Path root) {
            this.root = root;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    public static class Secrets {

        /** Secrets visible to every workflow. */
        private Map<String, String> shared = new LinkedHashMap<>();

        /** Workflow name to secrets only that workflow sees; these win over shared ones. */
        private Map<String, Map<String, String>> workflows = new LinkedHashMap<>();

        public Map<String, String> getShared() {
            return shared;
        }

        public void setShared(Map<String, String> shared) {
            this.shared = shared;
        }

        public Map<String, Map<String, String>> getWorkflows() {
            return workflows;
        }

        public void setWorkflows(Map<String, Map<String, String>> workflows) {
            this.workflows = workflows;
        }
    }
}
