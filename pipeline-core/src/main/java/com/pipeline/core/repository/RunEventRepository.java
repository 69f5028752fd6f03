package com.pipeline.core.repository;

import com.pipeline.core.model.RunEvent;
import com.pipeline.core.model.RunEventType;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Repository for the append-only run log.
 */
public interface RunEventRepository {

    /**
     * Append a new event to the log.
     * 
     * @param event The event to append
     */
    void append(RunEvent event);

    /**
     * Get all events for a run in order.
     * 
     * @param runId The run ID
     * @return All events ordered by sequence number
     */
    List<RunEvent> findByRun(UUID runId);

    /**
     * Get events of a run of specific types, in order.
     */
    List<RunEvent> findByRunAndTypes(UUID runId, List<RunEventType> types);

    /**
     * Get the next sequence number for a run.
     * 
     * @param runId The run ID
     * @return Next sequence number, starting at 1
     */
    long getNextSequenceNumber(UUID runId);

    /**
     * Count events by type for a run.
     */
    Map<RunEventType, Long> countByType(UUID runId);
}
