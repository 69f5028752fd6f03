package com.pipeline.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Definition of a job within a workflow: a unit of work with declared
 * dependencies, composed of steps that run on one execution environment.
 * 
 * Invariants:
 * - jobId is non-empty and unique within workflow
 * - every id in needs references a job of the same workflow
 * - the needs relation over all jobs is acyclic
 */
public record JobDefinition(
    // Identity
    String jobId,
    String displayName,
    
    // Graph structure
    Set<String> needs,
    
    // Execution
    List<StepDefinition> steps,
    String runsOn,
    Duration timeout,
    Map<String, String> env,
    
    // Conditional execution (SpEL expression over the triggering event)
    String condition,
    
    // Deployment environment this job publishes to, if any
    String environment
) {
    /**
     * Default OS image if not specified.
     */
    public static final String DEFAULT_RUNS_ON = "ubuntu-latest";

    public JobDefinition {
        needs = needs != null ? Set.copyOf(needs) : Set.of();
        steps = steps != null ? withStepIds(steps) : List.of();
        env = env != null ? Map.copyOf(env) : Map.of();
    }

    /**
     * Steps without an id get {@code step-<n>}, n being the 1-based position.
     */
    public static List<StepDefinition> withStepIds(List<StepDefinition> steps) {
        List<StepDefinition> identified = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            identified.add(step.stepId() == null || step.stepId().isBlank()
                ? step.withStepId("step-" + (i + 1))
                : step);
        }
        return List.copyOf(identified);
    }

    public boolean isConditional() {
        return condition != null && !condition.isBlank();
    }

    public boolean hasTimeout() {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    public String effectiveRunsOn() {
        return runsOn != null && !runsOn.isBlank() ? runsOn : DEFAULT_RUNS_ON;
    }

    /**
     * Effective wall-clock budget: the job's own timeout or the given default.
     */
    public Duration effectiveTimeout(Duration defaultTimeout) {
        return hasTimeout() ? timeout : defaultTimeout;
    }

    public StepDefinition getStep(String stepId) {
        return steps.stream()
            .filter(s -> stepId.equals(s.stepId()))
            .findFirst()
            .orElse(null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String jobId;
        private String displayName;
        private Set<String> needs = Set.of();
        private List<StepDefinition> steps = List.of();
        private String runsOn = DEFAULT_RUNS_ON;
        private Duration timeout;
        private Map<String, String> env = Map.of();
        private String condition;
        private String environment;

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder needs(Set<String> needs) {
            this.needs = needs;
            return this;
        }

        public Builder steps(List<StepDefinition> steps) {
            this.steps = steps;
            return this;
        }

        public Builder runsOn(String runsOn) {
            this.runsOn = runsOn;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(jobId, displayName, needs, steps, runsOn, timeout, env, condition, environment);
        }
    }
}
