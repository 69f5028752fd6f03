package com.pipeline.actions.deploy;

import com.pipeline.core.exception.AuthorizationException;
import com.pipeline.core.model.Artifact;
import com.pipeline.core.model.DeploymentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes artifacts to hosting environments.
 * 
 * Invariants:
 * - publishing requires write permission, a job bound to the environment and an allowed branch
 * - publishing content identical to what the environment serves is a no-op that still succeeds
 * - publishes to one environment are serialized
 */
public class DeploymentPublisher {
    
    private static final Logger log = LoggerFactory.getLogger(DeploymentPublisher.class);
    
    private final HostingTarget hostingTarget;
    private final Map<String, EnvironmentPolicy> policies;
    
    // Live deployment per environment
    private final Map<String, DeploymentRecord> live = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final List<DeploymentRecord> history = Collections.synchronizedList(new ArrayList<>());
    
    public DeploymentPublisher(HostingTarget hostingTarget, Map<String, EnvironmentPolicy> policies) {
        this.hostingTarget = hostingTarget;
        this.policies = policies != null ? Map.copyOf(policies) : Map.of();
    }
    
    /**
     * Publish an artifact to an environment.
     * 
     * @param environment The target environment
     * @param artifact The artifact to publish
     * @param authorization Capabilities of the invoking run
     * @return A success record; {@code noop} is set if identical content was already live
     * @throws AuthorizationException if the run may not publish to the environment
     */
    public DeploymentRecord publish(String environment, Artifact artifact, DeploymentAuthorization authorization) {
        authorize(environment, authorization);
        
        String contentHash = artifact.blob().contentHash();
        synchronized (locks.computeIfAbsent(environment, k -> new Object())) {
            DeploymentRecord current = live.get(environment);
            if (current != null && current.contentHash().equals(contentHash)) {
                log.info("Content {} already live on {}, skipping publish", contentHash, environment);
                DeploymentRecord noop = current.asNoop(authorization.runId());
                history.add(noop);
                return noop;
            }
            
            String url = hostingTarget.publish(environment, artifact.blob());
            DeploymentRecord record = DeploymentRecord.published(environment, artifact.name(), contentHash,
                url, authorization.runId());
            live.put(environment, record);
            history.add(record);
            log.info("Published artifact {} to {} at {}", artifact.name(), environment, url);
            return record;
        }
    }
    
    public Optional<DeploymentRecord> getLive(String environment) {
        return Optional.ofNullable(live.get(environment));
    }
    
    /** Every publish result, including no-ops, in order. */
    public List<DeploymentRecord> getHistory() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }
    
    // ========== Internal Methods ==========
    
    private void authorize(String environment, DeploymentAuthorization authorization) {
        if (!authorization.writeGranted()) {
            throw new AuthorizationException(environment,
                "workflow does not grant 'deployments: write' or 'pages: write'");
        }
        if (!environment.equals(authorization.declaredEnvironment())) {
            throw new AuthorizationException(environment, String.format(
                "job declares environment '%s'", authorization.declaredEnvironment()));
        }
        EnvironmentPolicy policy = policies.get(environment);
        if (policy != null && !policy.allows(authorization.branch())) {
            throw new AuthorizationException(environment, String.format(
                "branch '%s' is not allowed (allowed: %s)", authorization.branch(), policy.allowedBranches()));
        }
    }
}
