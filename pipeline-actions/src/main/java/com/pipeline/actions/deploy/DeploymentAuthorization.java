package com.pipeline.actions.deploy;

import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.RunContext;

import java.util.UUID;

/**
 * Capabilities a run presents when publishing: workflow write permission,
 * the environment its job declared, and the branch it runs on.
 */
public record DeploymentAuthorization(
    UUID runId,
    String branch,
    boolean writeGranted,
    String declaredEnvironment
) {
    public static final String SCOPE_DEPLOYMENTS = "deployments";
    public static final String SCOPE_PAGES = "pages";
    
    public static DeploymentAuthorization of(RunContext run, JobDefinition job) {
        boolean write = run.grantsWrite(SCOPE_DEPLOYMENTS) || run.grantsWrite(SCOPE_PAGES);
        return new DeploymentAuthorization(run.runId(), run.branch(), write, job.environment());
    }
}
