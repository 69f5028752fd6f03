package com.pipeline.engine.lifecycle;

import com.pipeline.engine.coordinator.JobGraphEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages graceful shutdown for the orchestrator.
 *
 * On shutdown:
 * 1. Stops accepting new runs
 * 2. Waits for active runs to finish (with timeout)
 * 3. Cancels runs still active at the deadline, which disposes their environments
 * 4. Logs shutdown status
 */
@Component
public class GracefulShutdownHandler {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final JobGraphEngine engine;
    private final Duration shutdownTimeout;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public GracefulShutdownHandler(JobGraphEngine engine,
                                   @Value("${pipeline.shutdown-timeout:30s}") Duration shutdownTimeout) {
        this.engine = engine;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Check if shutdown is in progress.
     */
    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Check if new runs can be started.
     */
    public boolean canAcceptRuns() {
        return !shuttingDown.get();
    }

    /**
     * Handle application shutdown event.
     * This runs before Spring context is fully closed.
     */
    @EventListener(ContextClosedEvent.class)
    @Order(0) // Run early in shutdown sequence
    public void onShutdown(ContextClosedEvent event) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        int active = engine.activeRunIds().size();
        if (active == 0) {
            log.info("No active runs to wait for");
        } else {
            log.info("Waiting for {} active runs to finish (timeout: {})", active, shutdownTimeout);
        }

        int cancelled = engine.shutdown(shutdownTimeout);

        if (cancelled > 0) {
            log.warn("Shutdown timeout reached: cancelled {} runs", cancelled);
        }
        log.info("Graceful shutdown complete");
    }
}
