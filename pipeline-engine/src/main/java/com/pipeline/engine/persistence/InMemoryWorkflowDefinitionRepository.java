package com.pipeline.engine.persistence;

import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.core.repository.WorkflowDefinitionRepository;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowDefinitionRepository.
 */
public class InMemoryWorkflowDefinitionRepository implements WorkflowDefinitionRepository {
    
    // Key: name:version
    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    
    @Override
    public void save(WorkflowDefinition definition) {
        definitions.put(definition.id(), definition);
    }
    
    @Override
    public Optional<WorkflowDefinition> find(String name, int version) {
        return Optional.ofNullable(definitions.get(name + ":" + version));
    }
    
    @Override
    public Optional<WorkflowDefinition> findLatest(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .max(Comparator.comparing(WorkflowDefinition::version));
    }
    
    @Override
    public List<WorkflowDefinition> listLatest() {
        Map<String, WorkflowDefinition> latestByName = new HashMap<>();
        definitions.values().forEach(d -> {
            WorkflowDefinition existing = latestByName.get(d.name());
            if (existing == null || d.version() > existing.version()) {
                latestByName.put(d.name(), d);
            }
        });
        return latestByName.values().stream()
            .sorted(Comparator.comparing(WorkflowDefinition::name))
            .toList();
    }
    
    @Override
    public synchronized int getNextVersion(String name) {
        return definitions.values().stream()
            .filter(d -> d.name().equals(name))
            .mapToInt(WorkflowDefinition::version)
            .max()
            .orElse(0) + 1;
    }
}
