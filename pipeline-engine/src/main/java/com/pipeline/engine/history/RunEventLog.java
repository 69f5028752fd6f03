package com.pipeline.engine.history;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.core.model.RunEvent;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.repository.RunEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only writer for run logs. Assigns sequence numbers, converts payloads
 * to JSON and notifies listeners after each append.
 */
public class RunEventLog {

    private static final Logger log = LoggerFactory.getLogger(RunEventLog.class);

    private final RunEventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final List<RunEventListener> listeners = new CopyOnWriteArrayList<>();

    public RunEventLog(RunEventRepository eventRepository, ObjectMapper objectMapper) {
        this.eventRepository = eventRepository;
        this.objectMapper = objectMapper;
    }

    public void addListener(RunEventListener listener) {
        listeners.add(listener);
    }

    public RunEvent record(UUID runId, String traceId, RunEventType type, String jobId, String stepId,
                           Object payload) {
        JsonNode node = payload instanceof JsonNode json ? json
            : objectMapper.valueToTree(payload != null ? payload : Map.of());
        return append(runId, traceId, type, jobId, stepId, node);
    }

    public RunEvent append(UUID runId, String traceId, RunEventType type, String jobId, String stepId,
                           JsonNode payload) {
        long sequence = eventRepository.getNextSequenceNumber(runId);
        RunEvent event = RunEvent.create(runId, sequence, type, jobId, stepId, payload, traceId);
        eventRepository.append(event);
        log.debug("Recorded {} #{} for run {}", type, sequence, runId);

        for (RunEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Run event listener {} failed on {}: {}",
                    listener.getClass().getSimpleName(), type, e.getMessage());
            }
        }
        return event;
    }

    public List<RunEvent> events(UUID runId) {
        return eventRepository.findByRun(runId);
    }

    /**
     * Receives every run event after it is appended.
     */
    @FunctionalInterface
    public interface RunEventListener {
        void onEvent(RunEvent event);
    }
}
