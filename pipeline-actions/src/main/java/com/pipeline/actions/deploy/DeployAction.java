package com.pipeline.actions.deploy;

import com.pipeline.actions.ActionContext;
import com.pipeline.actions.ActionOutcome;
import com.pipeline.actions.CompositeAction;
import com.pipeline.core.exception.ArtifactNotFoundException;
import com.pipeline.core.exception.AuthorizationException;
import com.pipeline.core.model.Artifact;
import com.pipeline.core.model.DeploymentRecord;
import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.repository.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * {@code deploy}: publishes a run artifact to the job's deployment environment.
 * Outputs {@code url}, {@code deployment-id} and {@code noop}.
 */
public class DeployAction implements CompositeAction {
    
    public static final String NAME = "deploy";
    
    private static final Logger log = LoggerFactory.getLogger(DeployAction.class);
    
    private static final List<InputSpec> INPUTS = List.of(
        InputSpec.required("artifact", "Name of the artifact to publish"),
        InputSpec.optional("environment", null, "Target environment; defaults to the job's environment")
    );
    
    private final ArtifactStore artifactStore;
    private final DeploymentPublisher publisher;
    
    public DeployAction(ArtifactStore artifactStore, DeploymentPublisher publisher) {
        this.artifactStore = artifactStore;
        this.publisher = publisher;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public List<InputSpec> inputs() {
        return INPUTS;
    }
    
    @Override
    public ActionOutcome execute(ActionContext context) {
        String artifactName = context.requireInput("artifact");
        String environment = context.getInput("environment");
        if (environment == null || environment.isBlank()) {
            environment = context.getJob().environment();
        }
        if (environment == null || environment.isBlank()) {
            throw new AuthorizationException("(none)", "job " + context.getJobId() + " declares no environment");
        }
        
        Artifact artifact = artifactStore.get(context.getRunId(), artifactName)
            .orElseThrow(() -> new ArtifactNotFoundException(context.getRunId(), artifactName, context.location()));
        
        DeploymentRecord record;
        try {
            record = publisher.publish(environment, artifact,
                DeploymentAuthorization.of(context.getRun(), context.getJob()));
        } catch (AuthorizationException e) {
            log.error("Deployment of {} to {} denied: {}", artifactName, environment, e.getMessage());
            context.record(RunEventType.DEPLOYMENT_DENIED, Map.of(
                "environment", environment,
                "artifact", artifactName,
                "reason", e.getMessage()
            ));
            throw e;
        }
        
        context.log(record.noop()
            ? "Content already live at " + record.url()
            : "Deployed to " + record.url());
        context.record(RunEventType.DEPLOYMENT_PUBLISHED, record);
        return ActionOutcome.of(Map.of(
            "url", record.url(),
            "deployment-id", record.deploymentId().toString(),
            "noop", String.valueOf(record.noop())
        ));
    }
}
