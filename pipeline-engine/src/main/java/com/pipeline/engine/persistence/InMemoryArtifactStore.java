package com.pipeline.engine.persistence;

import com.pipeline.core.model.Artifact;
import com.pipeline.core.model.Blob;
import com.pipeline.core.repository.ArtifactStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory artifact store partitioned by run.
 */
public class InMemoryArtifactStore implements ArtifactStore {
    
    private final Map<UUID, Map<String, Artifact>> byRun = new ConcurrentHashMap<>();
    
    @Override
    public Artifact put(UUID runId, String name, Blob blob, String producerJobId, boolean retained) {
        Artifact artifact = Artifact.create(runId, name, blob, producerJobId, retained);
        byRun.computeIfAbsent(runId, k -> new ConcurrentHashMap<>()).put(name, artifact);
        return artifact;
    }
    
    @Override
    public Optional<Artifact> get(UUID runId, String name) {
        Map<String, Artifact> artifacts = byRun.get(runId);
        return artifacts == null ? Optional.empty() : Optional.ofNullable(artifacts.get(name));
    }
    
    @Override
    public List<Artifact> list(UUID runId) {
        Map<String, Artifact> artifacts = byRun.get(runId);
        if (artifacts == null) {
            return List.of();
        }
        return artifacts.values().stream()
            .sorted(Comparator.comparing(Artifact::name))
            .toList();
    }
    
    @Override
    public int purge(UUID runId) {
        Map<String, Artifact> artifacts = byRun.get(runId);
        if (artifacts == null) {
            return 0;
        }
        int before = artifacts.size();
        artifacts.values().removeIf(a -> !a.retained());
        int removed = before - artifacts.size();
        if (artifacts.isEmpty()) {
            byRun.remove(runId);
        }
        return removed;
    }
}
