package com.pipeline.core.model;

import java.util.Map;
import java.util.UUID;

/**
 * Per-run values resolved once when a run starts: the triggering event,
 * workflow-level env and permissions, and the secrets available to steps.
 */
public record RunContext(
    UUID runId,
    String workflowName,
    RepositoryEvent event,
    Map<String, String> env,
    Map<String, String> secrets,
    Map<String, String> permissions,
    String traceId
) {
    public static final String MASK = "***";

    public RunContext {
        env = env != null ? Map.copyOf(env) : Map.of();
        secrets = secrets != null ? Map.copyOf(secrets) : Map.of();
        permissions = permissions != null ? Map.copyOf(permissions) : Map.of();
    }

    public static RunContext of(Run run, WorkflowDefinition definition, Map<String, String> secrets) {
        return new RunContext(run.runId(), definition.name(), run.event(), definition.env(),
            secrets, definition.permissions(), run.traceId());
    }

    public String branch() {
        return event.branch();
    }

    public boolean grantsWrite(String scope) {
        return WorkflowDefinition.PERMISSION_WRITE.equalsIgnoreCase(permissions.get(scope));
    }

    /**
     * Replace every non-empty secret value in the text with {@code ***}.
     */
    public String mask(String text) {
        if (text == null || secrets.isEmpty()) {
            return text;
        }
        String masked = text;
        for (String value : secrets.values()) {
            if (value != null && !value.isEmpty()) {
                masked = masked.replace(value, MASK);
            }
        }
        return masked;
    }
}
