package com.pipeline.core.model;

/**
 * Kinds of repository events that can start a run.
 */
public enum EventKind {
    PUSH("push"),
    PULL_REQUEST_OPENED("pull_request"),
    PULL_REQUEST_SYNCHRONIZED("pull_request"),
    MANUAL_DISPATCH("workflow_dispatch");

    private final String triggerName;

    EventKind(String triggerName) {
        this.triggerName = triggerName;
    }

    /**
     * Name under which a workflow subscribes to this kind in its {@code on} block.
     */
    public String triggerName() {
        return triggerName;
    }

    public boolean isPullRequest() {
        return this == PULL_REQUEST_OPENED || this == PULL_REQUEST_SYNCHRONIZED;
    }
}
