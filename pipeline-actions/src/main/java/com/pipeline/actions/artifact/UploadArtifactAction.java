package com.pipeline.actions.artifact;

import com.pipeline.actions.ActionContext;
import com.pipeline.actions.ActionException;
import com.pipeline.actions.ActionOutcome;
import com.pipeline.actions.CompositeAction;
import com.pipeline.core.model.Artifact;
import com.pipeline.core.model.Blob;
import com.pipeline.core.model.InputSpec;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.repository.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * {@code upload-artifact}: snapshots a workspace path into the run's artifact store.
 */
public class UploadArtifactAction implements CompositeAction {
    
    public static final String NAME = "upload-artifact";
    public static final String ERROR_EMPTY = "ARTIFACT_EMPTY";
    
    private static final Logger log = LoggerFactory.getLogger(UploadArtifactAction.class);
    
    private static final List<InputSpec> INPUTS = List.of(
        InputSpec.required("name", "Artifact name, unique within the run"),
        InputSpec.required("path", "Workspace file or directory to upload"),
        InputSpec.optional("retain", "false", "Keep the artifact after the run completes")
    );
    
    private final ArtifactStore artifactStore;
    
    public UploadArtifactAction(ArtifactStore artifactStore) {
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
    public ActionOutcome execute(ActionContext context) throws ActionException {
        String name = context.requireInput("name");
        String path = context.requireInput("path");
        
        Blob blob = Blob.snapshot(context.resolve(path));
        if (blob.isEmpty()) {
            throw new ActionException(ERROR_EMPTY, "No files found at " + path + " for artifact " + name);
        }
        
        Artifact artifact = artifactStore.put(context.getRunId(), name, blob, context.getJobId(),
            context.getBooleanInput("retain"));
        
        log.info("Uploaded artifact {} from {} ({} files)", name, path, blob.fileCount());
        context.log(String.format("Uploaded artifact %s: %d files, %d bytes", name, blob.fileCount(), blob.sizeBytes()));
        context.record(RunEventType.ARTIFACT_UPLOADED, Map.of(
            "name", name,
            "contentHash", blob.contentHash(),
            "retained", artifact.retained()
        ));
        return ActionOutcome.of(Map.of("content-hash", blob.contentHash())).withArtifact(name);
    }
}
