package com.pipeline.engine.graph;

import com.pipeline.actions.ActionRegistry;
import com.pipeline.actions.CompositeAction;
import com.pipeline.actions.DeclaredCompositeAction;
import com.pipeline.actions.artifact.DownloadArtifactAction;
import com.pipeline.actions.artifact.UploadArtifactAction;
import com.pipeline.actions.deploy.DeployAction;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.core.model.TriggerSpec;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.core.util.Globs;
import com.pipeline.engine.step.ConditionEvaluator;
import com.pipeline.engine.step.Interpolator;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Static checks run before a workflow is registered and before any of its jobs run.
 * 
 * Rejects with {@link ConfigurationException}:
 * - empty name or job list, jobs without steps
 * - malformed {@code branches} or {@code paths-ignore} globs
 * - duplicate, undefined or cyclic {@code needs}
 * - steps that set neither or both of {@code run} and {@code uses}, duplicate step ids
 * - unknown actions and undeclared required action inputs
 * - unparseable conditions
 * - artifacts downloaded by a job that no {@code needs} ancestor (or earlier step) uploads
 */
public class WorkflowValidator {
    
    private static final int MAX_ACTION_DEPTH = 8;
    
    private final ActionRegistry actionRegistry;
    private final ConditionEvaluator conditionEvaluator;
    
    public WorkflowValidator(ActionRegistry actionRegistry, ConditionEvaluator conditionEvaluator) {
        this.actionRegistry = actionRegistry;
        this.conditionEvaluator = conditionEvaluator;
    }
    
    /**
     * Validate a workflow definition.
     * 
     * @return The job graph of the valid definition
     * @throws ConfigurationException pointing at the first offending declaration
     */
    public JobGraph validate(WorkflowDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new ConfigurationException("name", "cannot be empty");
        }
        if (definition.jobs().isEmpty()) {
            throw new ConfigurationException("jobs", "cannot be empty");
        }
        
        if (definition.trigger() != null) {
            validateTrigger(definition.trigger());
        }
        JobGraph graph = JobGraph.of(definition);
        
        for (JobDefinition job : definition.jobs()) {
            String jobLocation = "jobs." + job.jobId();
            if (job.steps().isEmpty()) {
                throw new ConfigurationException(jobLocation + ".steps", "cannot be empty");
            }
            if (job.isConditional()) {
                conditionEvaluator.validate(job.condition(), jobLocation);
            }
            validateSteps(job.steps(), jobLocation, 0);
        }
        
        validateArtifactFlow(definition, graph);
        return graph;
    }
    
    // ========== Internal Methods ==========
    
    private static void validateTrigger(TriggerSpec trigger) {
        checkGlobs(trigger.branches(), "on.branches");
        checkGlobs(trigger.pathsIgnore(), "on.paths-ignore");
    }
    
    /**
     * Fails with the glob's location, e.g. {@code on.push.branches}.
     */
    public static void checkGlobs(List<String> globs, String location) {
        for (String glob : globs) {
            try {
                Globs.checkSyntax(glob);
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException(location,
                    String.format("invalid glob '%s': %s", glob, e.getDescription()));
            }
        }
    }
    
    private void validateSteps(List<StepDefinition> steps, String location, int depth) {
        Set<String> stepIds = new HashSet<>();
        for (StepDefinition step : steps) {
            String stepLocation = location + ".steps." + step.stepId();
            if (!stepIds.add(step.stepId())) {
                throw new ConfigurationException(stepLocation, "duplicate step id");
            }
            if (step.isShell() == step.isActionReference()) {
                throw new ConfigurationException(stepLocation, "exactly one of 'run' or 'uses' must be set");
            }
            if (step.isConditional()) {
                conditionEvaluator.validate(step.condition(), stepLocation);
            }
            if (step.isActionReference()) {
                CompositeAction action = actionRegistry.get(step.uses(), stepLocation);
                ActionRegistry.checkDeclaredInputs(action, step.with(), stepLocation);
                if (action instanceof DeclaredCompositeAction declared) {
                    if (depth >= MAX_ACTION_DEPTH) {
                        throw new ConfigurationException(stepLocation,
                            "composite actions nested deeper than " + MAX_ACTION_DEPTH + " levels");
                    }
                    validateSteps(declared.steps(), "actions." + declared.name(), depth + 1);
                }
            }
        }
    }
    
    /**
     * Every statically named artifact a job consumes must be produced by a job it
     * (transitively) needs, or by an earlier step of the same job.
     */
    private void validateArtifactFlow(WorkflowDefinition definition, JobGraph graph) {
        Map<String, Set<String>> producedBy = new HashMap<>();
        for (JobDefinition job : definition.jobs()) {
            for (StepDefinition step : job.steps()) {
                if (UploadArtifactAction.NAME.equals(step.uses())) {
                    String name = step.with().get("name");
                    if (name != null && !Interpolator.containsPlaceholder(name)) {
                        producedBy.computeIfAbsent(job.jobId(), k -> new HashSet<>()).add(name);
                    }
                }
            }
        }
        
        for (JobDefinition job : definition.jobs()) {
            Set<String> visible = new HashSet<>();
            for (String ancestor : graph.ancestorsOf(job.jobId())) {
                visible.addAll(producedBy.getOrDefault(ancestor, Set.of()));
            }
            for (StepDefinition step : job.steps()) {
                String consumed = consumedArtifact(step);
                if (consumed != null && !Interpolator.containsPlaceholder(consumed) && !visible.contains(consumed)) {
                    throw new ConfigurationException("jobs." + job.jobId() + ".steps." + step.stepId(), String.format(
                        "artifact '%s' is consumed before any job it needs produces it", consumed));
                }
                if (UploadArtifactAction.NAME.equals(step.uses()) && step.with().get("name") != null) {
                    visible.add(step.with().get("name"));
                }
            }
        }
    }
    
    private static String consumedArtifact(StepDefinition step) {
        if (DownloadArtifactAction.NAME.equals(step.uses())) {
            return step.with().get("name");
        }
        if (DeployAction.NAME.equals(step.uses())) {
            return step.with().get("artifact");
        }
        return null;
    }
}
