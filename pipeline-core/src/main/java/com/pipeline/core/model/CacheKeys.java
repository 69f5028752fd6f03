package com.pipeline.core.model;

import com.pipeline.core.util.Globs;
import com.pipeline.core.util.Hashing;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.List;
import java.util.stream.Stream;

/**
 * Cache key derivation: {@code scope:os:hash}, where the hash covers the
 * contents of the files that pin the cached dependencies (lockfiles).
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String derive(String scope, String os, String hash) {
        return scope + ":" + os + ":" + hash;
    }

    /**
     * SHA-256 over the sorted relative paths and contents of every file below root
     * matching one of the globs. Yields the hash of nothing if no file matches.
     *
     * @throws UncheckedIOException if the tree cannot be read
     */
    public static String hashFiles(Path root, List<String> globs) {
        MessageDigest digest = Hashing.sha256();
        if (!Files.isDirectory(root)) {
            return Hashing.hex(digest);
        }
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> matching = paths
                .filter(Files::isRegularFile)
                .filter(p -> Globs.matchesAny(globs, root.relativize(p).toString()))
                .sorted()
                .toList();
            for (Path file : matching) {
                digest.update(root.relativize(file).toString().replace('\\', '/').getBytes(StandardCharsets.UTF_8));
                digest.update((byte) 0);
                digest.update(Files.readAllBytes(file));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash files below " + root, e);
        }
        return Hashing.hex(digest);
    }
}
