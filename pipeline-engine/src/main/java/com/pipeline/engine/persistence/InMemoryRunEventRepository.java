package com.pipeline.engine.persistence;

import com.pipeline.core.model.RunEvent;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.repository.RunEventRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of RunEventRepository.
 */
public class InMemoryRunEventRepository implements RunEventRepository {
    
    private final Map<UUID, List<RunEvent>> byRun = new ConcurrentHashMap<>();
    private final Map<UUID, AtomicLong> sequenceCounters = new ConcurrentHashMap<>();
    
    @Override
    public void append(RunEvent event) {
        byRun.computeIfAbsent(event.runId(), k -> new CopyOnWriteArrayList<>()).add(event);
    }
    
    @Override
    public List<RunEvent> findByRun(UUID runId) {
        List<RunEvent> events = new ArrayList<>(byRun.getOrDefault(runId, List.of()));
        events.sort(Comparator.comparing(RunEvent::sequenceNumber));
        return events;
    }
    
    @Override
    public List<RunEvent> findByRunAndTypes(UUID runId, List<RunEventType> types) {
        Set<RunEventType> typeSet = new HashSet<>(types);
        return findByRun(runId).stream()
            .filter(e -> typeSet.contains(e.type()))
            .collect(Collectors.toList());
    }
    
    @Override
    public long getNextSequenceNumber(UUID runId) {
        return sequenceCounters
            .computeIfAbsent(runId, k -> new AtomicLong(0))
            .incrementAndGet();
    }
    
    @Override
    public Map<RunEventType, Long> countByType(UUID runId) {
        return byRun.getOrDefault(runId, List.of()).stream()
            .collect(Collectors.groupingBy(RunEvent::type, Collectors.counting()));
    }
}
