package com.pipeline.actions.deploy;

import com.pipeline.core.util.Globs;

import java.util.List;

/**
 * Protection rules of a deployment environment: which branches may publish to it.
 * An empty list allows every branch.
 */
public record EnvironmentPolicy(String environment, List<String> allowedBranches) {
    
    public EnvironmentPolicy {
        allowedBranches = allowedBranches != null ? List.copyOf(allowedBranches) : List.of();
    }
    
    public boolean allows(String branch) {
        return allowedBranches.isEmpty() || Globs.matchesAny(allowedBranches, branch);
    }
}
