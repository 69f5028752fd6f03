package com.pipeline.actions.artifact;

import com.pipeline.actions.ActionContext;
import com.pipeline.actions.ActionOutcome;
import com.pipeline.actions.CompositeAction;
import com.pipeline.core.exception.ArtifactNotFoundException;
import com.pipeline.core.model.Artifact;
import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.repository.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * {@code download-artifact}: restores an artifact of the current run into the workspace.
 * A missing artifact fails the job with {@code ARTIFACT_NOT_FOUND}.
 */
public class DownloadArtifactAction implements CompositeAction {
    
    public static final String NAME = "download-artifact";
    
    private static final Logger log = LoggerFactory.getLogger(DownloadArtifactAction.class);
    
    private static final List<InputSpec> INPUTS = List.of(
        InputSpec.required("name", "Artifact name"),
        InputSpec.optional("path", ".", "Workspace directory to restore into")
    );
    
    private final ArtifactStore artifactStore;
    
    public DownloadArtifactAction(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
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
        String name = context.requireInput("name");
        Artifact artifact = artifactStore.get(context.getRunId(), name)
            .orElseThrow(() -> new ArtifactNotFoundException(context.getRunId(), name, context.location()));
        
        artifact.blob().restoreTo(context.resolve(context.getInput("path")));
        
        log.info("Downloaded artifact {} produced by job {}", name, artifact.producerJobId());
        context.log("Downloaded artifact " + name + " into " + context.getInput("path"));
        context.record(RunEventType.ARTIFACT_DOWNLOADED, Map.of(
            "name", name,
            "producerJobId", artifact.producerJobId()
        ));
        return ActionOutcome.of(Map.of("content-hash", artifact.blob().contentHash()));
    }
}
