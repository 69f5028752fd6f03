package com.pipeline.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Inbound signal from the hosting platform's event bus.
 * The orchestrator only consumes kind, ref, changed paths and commit message;
 * the remaining fields are carried for reporting back to the change request.
 */
public record RepositoryEvent(
    EventKind kind,
    String repository,
    String ref,
    
    // Pull requests only
    String baseRef,
    Integer changeRequestNumber,
    
    String commitSha,
    List<String> changedPaths,
    String commitMessage,
    String actor,
    Instant receivedAt
) {
    public static final String BRANCH_REF_PREFIX = "refs/heads/";

    public RepositoryEvent {
        changedPaths = changedPaths != null ? List.copyOf(changedPaths) : List.of();
        commitMessage = commitMessage != null ? commitMessage : "";
        receivedAt = receivedAt != null ? receivedAt : Instant.now();
    }

    /**
     * Branch name with any {@code refs/heads/} prefix stripped.
     */
    public String branch() {
        return stripRef(ref);
    }

    /**
     * Base branch of a pull request, or null for other events.
     */
    public String baseBranch() {
        return stripRef(baseRef);
    }

    public static String stripRef(String ref) {
        if (ref == null) {
            return null;
        }
        return ref.startsWith(BRANCH_REF_PREFIX) ? ref.substring(BRANCH_REF_PREFIX.length()) : ref;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EventKind kind = EventKind.PUSH;
        private String repository;
        private String ref;
        private String baseRef;
        private Integer changeRequestNumber;
        private String commitSha;
        private List<String> changedPaths = List.of();
        private String commitMessage = "";
        private String actor;
        private Instant receivedAt;

        public Builder kind(EventKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder repository(String repository) {
            this.repository = repository;
            return this;
        }

        public Builder ref(String ref) {
            this.ref = ref;
            return this;
        }

        public Builder baseRef(String baseRef) {
            this.baseRef = baseRef;
            return this;
        }

        public Builder changeRequestNumber(Integer changeRequestNumber) {
            this.changeRequestNumber = changeRequestNumber;
            return this;
        }

        public Builder commitSha(String commitSha) {
            this.commitSha = commitSha;
            return this;
        }

        public Builder changedPaths(List<String> changedPaths) {
            this.changedPaths = changedPaths;
            return this;
        }

        public Builder commitMessage(String commitMessage) {
            this.commitMessage = commitMessage;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public RepositoryEvent build() {
            return new RepositoryEvent(
                kind, repository, ref, baseRef, changeRequestNumber,
                commitSha, changedPaths, commitMessage, actor, receivedAt
            );
        }
    }
}
