package com.pipeline.core.model;

import java.util.List;
import java.util.Set;

/**
 * Declarative filter deciding which repository events start a workflow run.
 *
 * Invariants:
 * - events holds trigger names ({@code push}, {@code pull_request}, {@code workflow_dispatch})
 * - an empty branches list accepts every branch
 * - skipMarker is matched case-insensitively against the commit message
 */
public record TriggerSpec(
    Set<String> events,
    List<String> branches,
    List<String> pathsIgnore,
    boolean manualDispatch,
    String skipMarker
) {
    public static final String DEFAULT_SKIP_MARKER = "[skip ci]";

    public TriggerSpec {
        events = events != null ? Set.copyOf(events) : Set.of();
        branches = branches != null ? List.copyOf(branches) : List.of();
        pathsIgnore = pathsIgnore != null ? List.copyOf(pathsIgnore) : List.of();
    }

    public boolean subscribes(EventKind kind) {
        return events.contains(kind.triggerName());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<String> events = Set.of(EventKind.PUSH.triggerName());
        private List<String> branches = List.of();
        private List<String> pathsIgnore = List.of();
        private boolean manualDispatch = false;
        private String skipMarker = DEFAULT_SKIP_MARKER;

        public Builder events(Set<String> events) {
            this.events = events;
            return this;
        }

        public Builder branches(List<String> branches) {
            this.branches = branches;
            return this;
        }

        public Builder pathsIgnore(List<String> pathsIgnore) {
            this.pathsIgnore = pathsIgnore;
            return this;
        }

        public Builder manualDispatch(boolean manualDispatch) {
            this.manualDispatch = manualDispatch;
            return this;
        }

        public Builder skipMarker(String skipMarker) {
            this.skipMarker = skipMarker;
            return this;
        }

        public TriggerSpec build() {
            return new TriggerSpec(events, branches, pathsIgnore, manualDispatch, skipMarker);
        }
    }
}
