package com.pipeline.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable definition of a workflow: ordered jobs, trigger filter and
 * global configuration. Versioned so re-registration never affects runs in flight.
 * 
 * Primary Key: {name}:{version}
 * 
 * Invariants (checked by the workflow validator before any run):
 * - jobs is non-empty and job ids are unique
 * - every needs target exists
 * - the needs graph is acyclic (DAG)
 */
public record WorkflowDefinition(
    // Identity
    String name,
    int version,
    
    // Graph
    List<JobDefinition> jobs,
    
    // Triggering
    TriggerSpec trigger,
    
    // Global configuration
    Map<String, String> env,
    Map<String, String> permissions,
    
    // Metadata
    Instant createdAt,
    String description
) {
    public static final String PERMISSION_WRITE = "write";

    public WorkflowDefinition {
        jobs = jobs != null ? List.copyOf(jobs) : List.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        permissions = permissions != null ? Map.copyOf(permissions) : Map.of();
    }

    /**
     * Construct the unique identifier for this workflow definition.
     */
    public String id() {
        return name + ":" + version;
    }

    /**
     * Get a job definition by ID.
     */
    public JobDefinition getJob(String jobId) {
        return jobs.stream()
            .filter(j -> j.jobId().equals(jobId))
            .findFirst()
            .orElse(null);
    }

    /**
     * Check whether a permission scope is granted with write access.
     */
    public boolean grantsWrite(String scope) {
        return PERMISSION_WRITE.equalsIgnoreCase(permissions.get(scope));
    }

    /**
     * Copy of this definition with the given version assigned.
     */
    public WorkflowDefinition withVersion(int newVersion) {
        return new WorkflowDefinition(name, newVersion, jobs, trigger, env, permissions, Instant.now(), description);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private int version = 1;
        private List<JobDefinition> jobs = List.of();
        private TriggerSpec trigger = TriggerSpec.builder().build();
        private Map<String, String> env = Map.of();
        private Map<String, String> permissions = Map.of();
        private Instant createdAt = Instant.now();
        private String description;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        public Builder jobs(List<JobDefinition> jobs) {
            this.jobs = jobs;
            return this;
        }

        public Builder trigger(TriggerSpec trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        public Builder permissions(Map<String, String> permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(name, version, jobs, trigger, env, permissions, createdAt, description);
        }
    }
}
