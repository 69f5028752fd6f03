package com.pipeline.actions.deploy;

import com.pipeline.core.model.Blob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Hosting target that serves each environment from {@code <root>/<environment>}.
 * Publishing clears the environment directory before writing the new snapshot.
 */
public class DirectoryHostingTarget implements HostingTarget {
    
    private static final Logger log = LoggerFactory.getLogger(DirectoryHostingTarget.class);
    
    private final Path root;
    private final String baseUrl;
    
    public DirectoryHostingTarget(Path root, String baseUrl) {
        this.root = root;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
    
    @Override
    public String publish(String environment, Blob content) {
        Path target = root.resolve(environment).normalize();
        if (!target.startsWith(root.normalize())) {
            throw new IllegalArgumentException("Invalid environment name: " + environment);
        }
        try {
            deleteRecursively(target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear " + target, e);
        }
        content.restoreTo(target);
        log.info("Published {} files to {}", content.fileCount(), target);
        return baseUrl + "/" + environment + "/";
    }
    
    public Path getRoot() {
        return root;
    }
    
    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        }
    }
}
