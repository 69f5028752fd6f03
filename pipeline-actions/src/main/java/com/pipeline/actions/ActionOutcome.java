package com.pipeline.actions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a successful action: named outputs plus the artifacts
 * and cache entries it produced.
 */
public record ActionOutcome(
    Map<String, String> outputs,
    List<String> artifacts,
    List<String> cacheKeys
) {
    public ActionOutcome {
        outputs = outputs != null ? Map.copyOf(outputs) : Map.of();
        artifacts = artifacts != null ? List.copyOf(artifacts) : List.of();
        cacheKeys = cacheKeys != null ? List.copyOf(cacheKeys) : List.of();
    }

    public static ActionOutcome empty() {
        return new ActionOutcome(Map.of(), List.of(), List.of());
    }

    public static ActionOutcome of(Map<String, String> outputs) {
        return new ActionOutcome(outputs, List.of(), List.of());
    }

    public ActionOutcome withArtifact(String name) {
        List<String> updated = new ArrayList<>(artifacts);
        updated.add(name);
        return new ActionOutcome(outputs, updated, cacheKeys);
    }

    public ActionOutcome withCacheKey(String key) {
        List<String> updated = new ArrayList<>(cacheKeys);
        updated.add(key);
        return new ActionOutcome(outputs, artifacts, updated);
    }

    public ActionOutcome withOutput(String name, String value) {
        Map<String, String> updated = new LinkedHashMap<>(outputs);
        updated.put(name, value);
        return new ActionOutcome(updated, artifacts, cacheKeys);
    }
}
