package com.pipeline.engine.persistence;

import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.RunState;
import com.pipeline.core.repository.RunRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of RunRepository.
 */
public class InMemoryRunRepository implements RunRepository {
    
    private final Map<UUID, Run> runs = new ConcurrentHashMap<>();
    
    @Override
    public void save(Run run) {
        if (runs.putIfAbsent(run.runId(), run) != null) {
            throw new IllegalArgumentException("Run already exists: " + run.runId());
        }
    }
    
    @Override
    public Run update(UUID runId, UnaryOperator<Run> mutation) {
        Run updated = runs.computeIfPresent(runId, (id, current) -> mutation.apply(current));
        if (updated == null) {
            throw new NotFoundException("Run", runId.toString());
        }
        return updated;
    }
    
    @Override
    public Optional<Run> findById(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }
    
    @Override
    public List<Run> findByState(RunState state, int limit) {
        return runs.values().stream()
            .filter(r -> r.state() == state)
            .sorted(Comparator.comparing(Run::createdAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<Run> findByWorkflow(String workflowName, int limit) {
        return runs.values().stream()
            .filter(r -> r.workflowName().equals(workflowName))
            .sorted(Comparator.comparing(Run::createdAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<Run> findActive() {
        return runs.values().stream()
            .filter(r -> !r.isTerminal())
            .sorted(Comparator.comparing(Run::createdAt))
            .collect(Collectors.toList());
    }
}
