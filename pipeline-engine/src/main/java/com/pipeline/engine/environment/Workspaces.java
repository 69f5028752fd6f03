package com.pipeline.engine.environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Workspace directory creation and disposal shared by provisioners.
 */
final class Workspaces {
    
    private static final Logger log = LoggerFactory.getLogger(Workspaces.class);
    
    private Workspaces() {
    }
    
    static Path create(Path baseDir, UUID runId, String jobId) {
        try {
            Files.createDirectories(baseDir);
            return Files.createTempDirectory(baseDir, runId.toString().substring(0, 8) + "-" + jobId + "-");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create workspace under " + baseDir, e);
        }
    }
    
    static void delete(Path workspace) {
        if (!Files.exists(workspace)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(workspace)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to delete workspace {}: {}", workspace, e.getMessage());
        }
    }
}
