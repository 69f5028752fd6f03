package com.pipeline.engine.secret;

import com.pipeline.core.secret.SecretStore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Secrets taken from application configuration: a shared set visible to every workflow,
 * plus per-workflow sets that override shared names.
 */
public class ConfiguredSecretStore implements SecretStore {

    private final Map<String, String> shared;
    private final Map<String, Map<String, String>> perWorkflow;

    public ConfiguredSecretStore(Map<String, String> shared, Map<String, Map<String, String>> perWorkflow) {
        this.shared = shared != null ? Map.copyOf(shared) : Map.of();
        this.perWorkflow = perWorkflow != null ? Map.copyOf(perWorkflow) : Map.of();
    }

    public static ConfiguredSecretStore of(Map<String, String> shared) {
        return new ConfiguredSecretStore(shared, Map.of());
    }

    @Override
    public Map<String, String> resolve(String workflowName) {
        Map<String, String> resolved = new LinkedHashMap<>(shared);
        resolved.putAll(perWorkflow.getOrDefault(workflowName, Map.of()));
        return resolved;
    }
}
