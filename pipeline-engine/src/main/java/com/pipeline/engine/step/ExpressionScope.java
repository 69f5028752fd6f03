package com.pipeline.engine.step;

import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.StepOutcome;
import com.pipeline.core.model.StepResult;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Values visible to expressions while a step is prepared: inputs, env, secrets,
 * results of earlier steps of the same job (or composite action) and the triggering event.
 */
public record ExpressionScope(
    UUID runId,
    String jobId,
    String osIdentifier,
    RepositoryEvent event,
    Map<String, String> inputs,
    Map<String, String> env,
    Map<String, String> secrets,
    Map<String, StepResult> steps,
    List<String> declaredStepIds
) {
    public ExpressionScope {
        inputs = inputs != null ? Map.copyOf(inputs) : Map.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        secrets = secrets != null ? Map.copyOf(secrets) : Map.of();
        steps = steps != null ? Collections.unmodifiableMap(new LinkedHashMap<>(steps)) : Map.of();
        declaredStepIds = declaredStepIds != null ? List.copyOf(declaredStepIds) : List.of();
    }

    /**
     * Scope for a job-level condition: no steps have run yet.
     */
    public static ExpressionScope forJob(UUID runId, String jobId, String osIdentifier, RepositoryEvent event,
                                         Map<String, String> env, Map<String, String> secrets) {
        return new ExpressionScope(runId, jobId, osIdentifier, event, Map.of(), env, secrets, Map.of(), List.of());
    }

    public Collection<StepResult> priorResults() {
        return steps.values();
    }

    /**
     * True if an earlier step failed without being marked best-effort.
     */
    public boolean hasFatalFailure() {
        return steps.values().stream().anyMatch(StepResult::isFatal);
    }

    /**
     * True if any earlier step failed, best-effort or not.
     */
    public boolean hasFailure() {
        return steps.values().stream().anyMatch(r -> r.outcome() == StepOutcome.FAILURE);
    }

    /**
     * Copy with an extra env layer on top of the current one.
     */
    public ExpressionScope withEnv(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(env);
        merged.putAll(overrides);
        return new ExpressionScope(runId, jobId, osIdentifier, event, inputs, merged, secrets, steps, declaredStepIds);
    }
}
