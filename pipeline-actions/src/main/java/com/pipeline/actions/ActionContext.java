package com.pipeline.actions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.RunContext;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.core.model.StepResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Context provided to composite actions during execution.
 */
public class ActionContext {
    
    private final RunContext run;
    private final JobDefinition job;
    private final String stepId;
    private final Map<String, String> inputs;
    private final Path workspace;
    private final String osIdentifier;
    private final ObjectMapper objectMapper;
    private final RunRecorder recorder;
    private final StepSequenceExecutor stepExecutor;
    private final LogSink logSink;
    
    private ActionContext(Builder builder) {
        this.run = builder.run;
        this.job = builder.job;
        this.stepId = builder.stepId;
        this.inputs = builder.inputs != null ? Map.copyOf(builder.inputs) : Map.of();
        this.workspace = builder.workspace;
        this.osIdentifier = builder.osIdentifier;
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper().findAndRegisterModules();
        this.recorder = builder.recorder != null ? builder.recorder : (type, payload) -> { };
        this.stepExecutor = builder.stepExecutor;
        this.logSink = builder.logSink != null ? builder.logSink : line -> { };
    }
    
    /**
     * Get the run-wide context: event, env, secrets, permissions.
     */
    public RunContext getRun() {
        return run;
    }
    
    public UUID getRunId() {
        return run.runId();
    }
    
    public JobDefinition getJob() {
        return job;
    }
    
    public String getJobId() {
        return job.jobId();
    }
    
    public String getStepId() {
        return stepId;
    }
    
    /**
     * Get all resolved inputs (interpolated, defaults applied).
     */
    public Map<String, String> getInputs() {
        return inputs;
    }
    
    /**
     * Get an input value, or null when absent.
     */
    public String getInput(String name) {
        return inputs.get(name);
    }
    
    /**
     * Get an input that must be present and non-blank.
     * 
     * @throws ConfigurationException naming this step if the input is missing
     */
    public String requireInput(String name) {
        String value = inputs.get(name);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(location(), "missing required input '" + name + "'");
        }
        return value;
    }
    
    public boolean getBooleanInput(String name) {
        return Boolean.parseBoolean(inputs.get(name));
    }
    
    /**
     * Workspace directory of the job's execution environment.
     */
    public Path getWorkspace() {
        return workspace;
    }
    
    /**
     * Resolve a workspace-relative path, rejecting paths that escape the workspace.
     */
    public Path resolve(String relative) {
        Path resolved = workspace.resolve(relative).normalize();
        if (!resolved.startsWith(workspace.normalize())) {
            throw new ConfigurationException(location(), "path escapes the workspace: " + relative);
        }
        return resolved;
    }
    
    public String getOsIdentifier() {
        return osIdentifier;
    }
    
    /**
     * Declaration path of the executing step, used in diagnostics.
     */
    public String location() {
        return "jobs." + job.jobId() + ".steps." + stepId;
    }
    
    /**
     * Append a fact to the run log.
     */
    public void record(RunEventType type, Object payload) {
        recorder.record(type, toJsonNode(payload));
    }
    
    /**
     * Append a line to the step log. Secret values are masked.
     */
    public void log(String line) {
        logSink.append(run.mask(line));
    }
    
    /**
     * Run a nested step sequence in the same execution environment.
     * 
     * @param steps The nested steps
     * @param nestedInputs Inputs visible to the nested steps as {@code inputs.*}
     * @param outputTemplates Output name to expression over the nested steps
     * @return Nested step results and resolved outputs
     */
    public NestedRun runSteps(List<StepDefinition> steps, Map<String, String> nestedInputs,
                              Map<String, String> outputTemplates) {
        if (stepExecutor == null) {
            throw new IllegalStateException("Nested step execution is not available in this context");
        }
        return stepExecutor.run(steps, nestedInputs, outputTemplates);
    }
    
    /**
     * Convert an object to JsonNode.
     */
    public JsonNode toJsonNode(Object value) {
        return objectMapper.valueToTree(value);
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Callback for appending to the run log.
     */
    @FunctionalInterface
    public interface RunRecorder {
        void record(RunEventType type, JsonNode payload);
    }
    
    /**
     * Callback for executing nested steps of a declared composite action.
     */
    @FunctionalInterface
    public interface StepSequenceExecutor {
        NestedRun run(List<StepDefinition> steps, Map<String, String> inputs, Map<String, String> outputTemplates);
    }
    
    /**
     * Callback receiving step log lines.
     */
    @FunctionalInterface
    public interface LogSink {
        void append(String line);
    }
    
    /**
     * Results of a nested step sequence.
     */
    public record NestedRun(List<StepResult> steps, Map<String, String> outputs) {
        
        public NestedRun {
            steps = steps != null ? List.copyOf(steps) : List.of();
            outputs = outputs != null ? Map.copyOf(outputs) : Map.of();
        }
        
        /**
         * First nested step whose failure was not best-effort, if any.
         */
        public StepResult firstFatalFailure() {
            return steps.stream().filter(StepResult::isFatal).findFirst().orElse(null);
        }
    }
    
    public static class Builder {
        private RunContext run;
        private JobDefinition job;
        private String stepId;
        private Map<String, String> inputs;
        private Path workspace;
        private String osIdentifier;
        private ObjectMapper objectMapper;
        private RunRecorder recorder;
        private StepSequenceExecutor stepExecutor;
        private LogSink logSink;
        
        public Builder run(RunContext run) {
            this.run = run;
            return this;
        }
        
        public Builder job(JobDefinition job) {
            this.job = job;
            return this;
        }
        
        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }
        
        public Builder inputs(Map<String, String> inputs) {
            this.inputs = inputs;
            return this;
        }
        
        public Builder workspace(Path workspace) {
            this.workspace = workspace;
            return this;
        }
        
        public Builder osIdentifier(String osIdentifier) {
            this.osIdentifier = osIdentifier;
            return this;
        }
        
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }
        
        public Builder recorder(RunRecorder recorder) {
            this.recorder = recorder;
            return this;
        }
        
        public Builder stepExecutor(StepSequenceExecutor stepExecutor) {
            this.stepExecutor = stepExecutor;
            return this;
        }
        
        public Builder logSink(LogSink logSink) {
            this.logSink = logSink;
            return this;
        }
        
        public ActionContext build() {
            return new ActionContext(this);
        }
    }
}
