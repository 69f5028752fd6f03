package com.pipeline.core.model;

import java.util.Map;

/**
 * One executable action within a job: either a shell command ({@code run})
 * or a reference to a composite action ({@code uses}) with named inputs.
 *
 * Invariants:
 * - exactly one of run / uses is set
 * - stepId is unique within its job
 */
public record StepDefinition(
    String stepId,
    String name,
    
    // Shell command
    String run,
    
    // Composite action reference
    String uses,
    Map<String, String> with,
    
    // Conditional execution (SpEL expression over prior step outcomes)
    String condition,
    
    // Best-effort: failure is recorded but does not fail the job
    boolean continueOnError,
    
    Map<String, String> env
) {
    public StepDefinition {
        with = with != null ? Map.copyOf(with) : Map.of();
        env = env != null ? Map.copyOf(env) : Map.of();
    }

    public boolean isShell() {
        return run != null && !run.isBlank();
    }

    public boolean isActionReference() {
        return uses != null && !uses.isBlank();
    }

    public boolean isConditional() {
        return condition != null && !condition.isBlank();
    }

    /**
     * Name shown in logs: the display name if present, otherwise the command or action.
     */
    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return isActionReference() ? uses : run;
    }

    /**
     * Copy with the given step id.
     */
    public StepDefinition withStepId(String newStepId) {
        return new StepDefinition(newStepId, name, run, uses, with, condition, continueOnError, env);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String stepId;
        private String name;
        private String run;
        private String uses;
        private Map<String, String> with = Map.of();
        private String condition;
        private boolean continueOnError;
        private Map<String, String> env = Map.of();

        public Builder stepId(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder run(String run) {
            this.run = run;
            return this;
        }

        public Builder uses(String uses) {
            this.uses = uses;
            return this;
        }

        public Builder with(Map<String, String> with) {
            this.with = with;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public StepDefinition build() {
            return new StepDefinition(stepId, name, run, uses, with, condition, continueOnError, env);
        }
    }
}
