package com.pipeline.core.model;

public enum Severity {
    INFO,
    MINOR,
    MAJOR,
    CRITICAL;

    /**
     * Findings at or above MAJOR fail the gate.
     */
    public boolean isBlocking() {
        return this == MAJOR || this == CRITICAL;
    }
}
