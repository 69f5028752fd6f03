package com.pipeline.engine.step;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.actions.ActionContext;
import com.pipeline.actions.ActionException;
import com.pipeline.actions.ActionOutcome;
import com.pipeline.actions.ActionRegistry;
import com.pipeline.actions.CompositeAction;
import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.exception.PipelineException;
import com.pipeline.core.model.JobResult;
import com.pipeline.core.model.RunContext;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.core.model.StepResult;
import com.pipeline.engine.environment.CommandResult;
import com.pipeline.engine.environment.ExecutionEnvironment;
import com.pipeline.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a job's steps in order inside its execution environment.
 *
 * Each step is either a shell command or a composite action. Before a step runs its
 * condition is evaluated against the outcomes of the earlier steps; then its command,
 * env and inputs are interpolated. A failing step that is not best-effort aborts the
 * sequence and every later step is recorded as skipped. Declared composite actions run
 * their nested steps through this same runner, in the same environment.
 */
public class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    public static final String OUTPUT_COMMAND = "::set-output ";
    public static final String ERROR_COMMAND_FAILED = "COMMAND_FAILED";
    public static final String ERROR_INTERRUPTED = "INTERRUPTED";
    public static final String ERROR_IO = "IO_ERROR";

    private static final int MAX_NESTING = 8;

    private final ActionRegistry actionRegistry;
    private final ConditionEvaluator conditionEvaluator;
    private final Interpolator interpolator;
    private final ObjectMapper objectMapper;

    public StepRunner(ActionRegistry actionRegistry, ConditionEvaluator conditionEvaluator,
                      Interpolator interpolator, ObjectMapper objectMapper) {
        this.actionRegistry = actionRegistry;
        this.conditionEvaluator = conditionEvaluator;
        this.interpolator = interpolator;
        this.objectMapper = objectMapper;
    }

    /**
     * Run every step of the job.
     *
     * @return One result per declared step, in declaration order
     * @throws InterruptedException if the job is cancelled or times out while a step runs
     */
    public List<StepResult> run(JobExecution execution) throws InterruptedException {
        return runSequence(execution, execution.job().steps(), Map.of(), "", 0, null);
    }

    // ========== Internal Methods ==========

    private List<StepResult> runSequence(JobExecution execution, List<StepDefinition> steps,
                                         Map<String, String> inputs, String prefix, int depth,
                                         ActionContext.LogSink parentLog) throws InterruptedException {
        RunContext run = execution.run();
        List<String> declared = steps.stream().map(StepDefinition::stepId).toList();
        Map<String, StepResult> results = new LinkedHashMap<>();
        Map<String, String> baseEnv = new LinkedHashMap<>(run.env());
        baseEnv.putAll(execution.job().env());
        boolean aborted = false;

        for (StepDefinition step : steps) {
            String path = prefix.isEmpty() ? step.stepId() : prefix + "." + step.stepId();
            ExpressionScope scope = new ExpressionScope(run.runId(), execution.job().jobId(),
                execution.environment().osIdentifier(), run.event(), inputs,
                interpolateEnv(baseEnv, Map.of(), run, execution, inputs, results, declared),
                run.secrets(), results, declared);

            StepResult result;
            try (var ctx = LoggingContext.forStep(path)) {
                if (aborted) {
                    result = StepResult.skipped(step.stepId(), step.displayName());
                } else {
                    result = runStep(execution, step, path, scope, baseEnv, depth);
                }
            }
            results.put(step.stepId(), result);
            recordResult(execution, path, result);
            if (parentLog != null) {
                result.log().forEach(parentLog::append);
            }

            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted after step " + path);
            }
            if (result.isFatal()) {
                aborted = true;
            }
        }
        return new ArrayList<>(results.values());
    }

    private StepResult runStep(JobExecution execution, StepDefinition step, String path,
                               ExpressionScope scope, Map<String, String> baseEnv, int depth)
            throws InterruptedException {
        Instant startedAt = Instant.now();
        String location = "jobs." + execution.job().jobId() + ".steps." + path;
        RunContext run = execution.run();

        try {
            if (!conditionEvaluator.evaluate(step.condition(), scope, location)) {
                log.info("Skipping step {}: condition is false", path);
                return StepResult.skipped(step.stepId(), step.displayName());
            }
            Map<String, String> env = interpolateEnv(baseEnv, step.env(), run, execution,
                scope.inputs(), scope.steps(), scope.declaredStepIds());
            ExpressionScope stepScope = scope.withEnv(env);

            if (step.isShell()) {
                return runShell(execution, step, stepScope, env, startedAt);
            }
            return runAction(execution, step, path, location, stepScope, depth, startedAt);
        } catch (PipelineException e) {
            // Configuration and authorization errors fail the job even on a best-effort step
            return fail(run, step, false, null, List.of(), e.getErrorCode(), e.getMessage(), startedAt);
        }
    }

    private StepResult runShell(JobExecution execution, StepDefinition step, ExpressionScope scope,
                                Map<String, String> env, Instant startedAt) throws InterruptedException {
        RunContext run = execution.run();
        String command = interpolator.interpolate(step.run(), scope);
        ExecutionEnvironment environment = execution.environment();
        log.info("Running step {}: {}", step.stepId(), run.mask(command));

        Map<String, String> processEnv = new LinkedHashMap<>(standardEnv(execution));
        processEnv.putAll(env);
        CommandResult result;
        try {
            result = environment.exec(command, processEnv, execution.remaining());
        } catch (UncheckedIOException e) {
            return fail(run, step, step.continueOnError(), null, List.of(), Map.of(),
                ERROR_IO, e.getCause().getMessage(), startedAt);
        }

        List<String> lines = result.output().stream().map(run::mask).toList();
        Map<String, String> outputs = parseOutputs(result.output());

        if (result.timedOut()) {
            return fail(run, step, false, result.exitCode(), lines, outputs,
                JobResult.ERROR_JOB_TIMEOUT, "Step exceeded the job's time budget", startedAt);
        }
        if (!result.isSuccess()) {
            return fail(run, step, step.continueOnError(), result.exitCode(), lines, outputs,
                ERROR_COMMAND_FAILED, "Command exited with code " + result.exitCode(), startedAt);
        }
        return StepResult.success(step.stepId(), step.displayName(), result.exitCode(), outputs, lines, startedAt);
    }

    private StepResult runAction(JobExecution execution, StepDefinition step, String path, String location,
                                 ExpressionScope scope, int depth, Instant startedAt) {
        RunContext run = execution.run();
        CompositeAction action = actionRegistry.get(step.uses(), location);
        Map<String, String> supplied = interpolator.interpolateAll(step.with(), scope);
        Map<String, String> inputs = ActionRegistry.resolveInputs(action, supplied, location);
        log.info("Running step {}: action {}", path, action.name());

        List<String> lines = new ArrayList<>();
        ActionContext.LogSink sink = lines::add;
        ActionContext context = ActionContext.builder()
            .run(run)
            .job(execution.job())
            .stepId(path)
            .inputs(inputs)
            .workspace(execution.environment().workspace())
            .osIdentifier(execution.environment().osIdentifier())
            .objectMapper(objectMapper)
            .recorder(execution.recorderFor(path))
            .logSink(sink)
            .stepExecutor((nested, nestedInputs, outputTemplates) ->
                runNested(execution, nested, nestedInputs, outputTemplates, path, depth + 1, sink))
            .build();

        try {
            ActionOutcome outcome = action.execute(context);
            execution.addArtifacts(outcome.artifacts());
            execution.addCacheKeys(outcome.cacheKeys());
            return StepResult.success(step.stepId(), step.displayName(), null, outcome.outputs(), lines, startedAt);
        } catch (ActionException e) {
            return fail(run, step, step.continueOnError(), null, lines, Map.of(),
                e.getErrorCode(), e.getMessage(), startedAt);
        } catch (NestedInterruptedException e) {
            return fail(run, step, false, null, lines, Map.of(), ERROR_INTERRUPTED, e.getMessage(), startedAt);
        } catch (UncheckedIOException e) {
            return fail(run, step, step.continueOnError(), null, lines, Map.of(),
                ERROR_IO, e.getCause().getMessage(), startedAt);
        }
    }

    private ActionContext.NestedRun runNested(JobExecution execution, List<StepDefinition> steps,
                                              Map<String, String> inputs, Map<String, String> outputTemplates,
                                              String prefix, int depth, ActionContext.LogSink parentLog) {
        if (depth > MAX_NESTING) {
            throw new ConfigurationException("jobs." + execution.job().jobId()
                + ".steps." + prefix, "composite actions nested deeper than " + MAX_NESTING);
        }
        try {
            List<StepResult> results = runSequence(execution, steps, inputs, prefix, depth, parentLog);
            Map<String, StepResult> byId = new LinkedHashMap<>();
            results.forEach(r -> byId.put(r.stepId(), r));
            RunContext run = execution.run();
            ExpressionScope scope = new ExpressionScope(run.runId(), execution.job().jobId(),
                execution.environment().osIdentifier(), run.event(), inputs, run.env(), run.secrets(),
                byId, List.copyOf(byId.keySet()));
            return new ActionContext.NestedRun(results, interpolator.interpolateAll(outputTemplates, scope));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NestedInterruptedException("Interrupted inside composite step " + prefix);
        }
    }

    private Map<String, String> interpolateEnv(Map<String, String> base, Map<String, String> layer,
                                               RunContext run, JobExecution execution,
                                               Map<String, String> inputs, Map<String, StepResult> steps,
                                               List<String> declared) {
        Map<String, String> env = new LinkedHashMap<>();
        Map<String, String> all = new LinkedHashMap<>(base);
        all.putAll(layer);
        all.forEach((name, value) -> {
            ExpressionScope scope = new ExpressionScope(run.runId(), execution.job().jobId(),
                execution.environment().osIdentifier(), run.event(), inputs, env, run.secrets(), steps, declared);
            env.put(name, interpolator.interpolate(value, scope));
        });
        return env;
    }

    private static Map<String, String> standardEnv(JobExecution execution) {
        RunContext run = execution.run();
        Map<String, String> env = new LinkedHashMap<>();
        env.put("CI", "true");
        env.put("PIPELINE_RUN_ID", run.runId().toString());
        env.put("PIPELINE_WORKFLOW", run.workflowName());
        env.put("PIPELINE_JOB", execution.job().jobId());
        env.put("PIPELINE_WORKSPACE", execution.environment().workspace().toString());
        if (run.event() != null) {
            env.put("PIPELINE_REF", nullToEmpty(run.event().ref()));
            env.put("PIPELINE_SHA", nullToEmpty(run.event().commitSha()));
            env.put("PIPELINE_EVENT", run.event().kind().triggerName());
        }
        return env;
    }

    /**
     * Collect {@code ::set-output name=value} lines. The GitHub-style
     * {@code ::set-output name=key::value} form is accepted too.
     */
    static Map<String, String> parseOutputs(List<String> lines) {
        Map<String, String> outputs = new LinkedHashMap<>();
        for (String line : lines) {
            if (!line.startsWith(OUTPUT_COMMAND)) {
                continue;
            }
            String body = line.substring(OUTPUT_COMMAND.length()).trim();
            int separator = body.indexOf("::");
            if (body.startsWith("name=") && separator > 0) {
                outputs.put(body.substring("name=".length(), separator), body.substring(separator + 2));
                continue;
            }
            int eq = body.indexOf('=');
            if (eq > 0) {
                outputs.put(body.substring(0, eq).trim(), body.substring(eq + 1));
            }
        }
        return outputs;
    }

    private void recordResult(JobExecution execution, String path, StepResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", result.name());
        payload.put("outcome", result.outcome().label());
        if (result.exitCode() != null) {
            payload.put("exitCode", result.exitCode());
        }
        if (!result.outputs().isEmpty()) {
            payload.put("outputs", result.outputs());
        }
        if (result.isFailure()) {
            payload.put("bestEffort", result.bestEffort());
            payload.put("errorCode", result.errorCode());
            payload.put("errorMessage", result.errorMessage());
        }
        RunEventType type = switch (result.outcome()) {
            case SUCCESS -> RunEventType.STEP_SUCCEEDED;
            case FAILURE -> RunEventType.STEP_FAILED;
            case SKIPPED -> RunEventType.STEP_SKIPPED;
        };
        execution.record(type, path, payload);
    }

    private static StepResult fail(RunContext run, StepDefinition step, boolean bestEffort, Integer exitCode,
                                   List<String> lines, String code, String message, Instant startedAt) {
        return fail(run, step, bestEffort, exitCode, lines, Map.of(), code, message, startedAt);
    }

    private static StepResult fail(RunContext run, StepDefinition step, boolean bestEffort, Integer exitCode,
                                   List<String> lines, Map<String, String> outputs, String code, String message,
                                   Instant startedAt) {
        String masked = run.mask(message);
        if (bestEffort) {
            log.warn("Step {} failed (best-effort, continuing): [{}] {}", step.stepId(), code, masked);
        } else {
            log.error("Step {} failed: [{}] {}", step.stepId(), code, masked);
        }
        return StepResult.failure(step.stepId(), step.displayName(), bestEffort, exitCode, outputs,
            lines, code, masked, startedAt);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * Carries an interruption out of the nested-step callback, which cannot throw checked exceptions.
     */
    private static class NestedInterruptedException extends RuntimeException {
        NestedInterruptedException(String message) {
            super(message);
        }
    }
}
