package com.pipeline.engine.environment;

import java.util.UUID;

/**
 * Supplies a fresh execution environment matching an OS identifier.
 */
public interface EnvironmentProvisioner {

    /**
     * Provision an environment for one job of a run.
     * 
     * @param osIdentifier Requested OS image (the job's {@code runs-on})
     * @param runId The run
     * @param jobId The job
     * @return A new environment; the caller closes it
     */
    ExecutionEnvironment provision(String osIdentifier, UUID runId, String jobId);
}
