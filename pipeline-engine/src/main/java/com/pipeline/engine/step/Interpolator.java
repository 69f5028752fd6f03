package com.pipeline.engine.step;

import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code ${{ ... }}} placeholders in commands, env values and action inputs.
 * 
 * Supported references:
 * inputs.NAME, env.NAME, secrets.NAME, steps.ID.outputs.NAME, steps.ID.outcome,
 * event.ref, event.branch, event.base_ref, event.sha, event.actor, event.repository,
 * event.number, runner.os, job.id, run.id.
 * Unknown references resolve to the empty string.
 */
public class Interpolator {
    
    private static final Logger log = LoggerFactory.getLogger(Interpolator.class);
    
    static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{\\{\\s*(.+?)\\s*}}");
    
    public String interpolate(String template, ExpressionScope scope) {
        if (template == null || !template.contains("${{")) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolve(matcher.group(1), scope)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
    
    public Map<String, String> interpolateAll(Map<String, String> values, ExpressionScope scope) {
        Map<String, String> result = new LinkedHashMap<>();
        values.forEach((k, v) -> result.put(k, interpolate(v, scope)));
        return result;
    }
    
    public static boolean containsPlaceholder(String value) {
        return value != null && PLACEHOLDER.matcher(value).find();
    }
    
    // ========== Internal Methods ==========
    
    String resolve(String reference, ExpressionScope scope) {
        String[] parts = reference.split("\\.", 2);
        String root = parts[0];
        String rest = parts.length > 1 ? parts[1] : "";
        String value = switch (root) {
            case "inputs" -> scope.inputs().get(rest);
            case "env" -> scope.env().get(rest);
            case "secrets" -> scope.secrets().get(rest);
            case "steps" -> resolveStep(rest, scope);
            case "event" -> resolveEvent(rest, scope.event());
            case "runner" -> "os".equals(rest) ? scope.osIdentifier() : null;
            case "job" -> "id".equals(rest) ? scope.jobId() : null;
            case "run" -> "id".equals(rest) && scope.runId() != null ? scope.runId().toString() : null;
            default -> null;
        };
        if (value == null) {
            log.debug("Expression '{}' resolved to empty", reference);
            return "";
        }
        return value;
    }
    
    private static String resolveStep(String rest, ExpressionScope scope) {
        // id.outputs.name | id.outcome
        int dot = rest.indexOf('.');
        if (dot < 0) {
            return null;
        }
        StepResult result = scope.steps().get(rest.substring(0, dot));
        if (result == null) {
            return null;
        }
        String field = rest.substring(dot + 1);
        if (field.equals("outcome")) {
            return result.outcome().label();
        }
        if (field.startsWith("outputs.")) {
            return result.outputs().get(field.substring("outputs.".length()));
        }
        return null;
    }
    
    private static String resolveEvent(String field, RepositoryEvent event) {
        if (event == null) {
            return null;
        }
        return switch (field) {
            case "ref" -> event.ref();
            case "branch" -> event.branch();
            case "base_ref" -> event.baseBranch();
            case "sha" -> event.commitSha();
            case "actor" -> event.actor();
            case "repository" -> event.repository();
            case "kind" -> event.kind().triggerName();
            case "number" -> event.changeRequestNumber() != null ? event.changeRequestNumber().toString() : null;
            default -> null;
        };
    }
}
