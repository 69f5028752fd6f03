package com.pipeline.core.secret;

import java.util.Map;

/**
 * Source of named secret values. Resolved once per run; values never leave the run.
 */
public interface SecretStore {

    /**
     * All secrets visible to runs of the given workflow.
     */
    Map<String, String> resolve(String workflowName);
}
