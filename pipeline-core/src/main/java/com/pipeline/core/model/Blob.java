package com.pipeline.core.model;

import com.pipeline.core.util.Hashing;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Immutable snapshot of a directory tree: relative path to file content.
 * The content hash covers sorted paths and bytes, so two snapshots of
 * identical trees always hash identically.
 */
public final class Blob {

    private final SortedMap<String, byte[]> files;
    private final String contentHash;
    private final long sizeBytes;

    private Blob(SortedMap<String, byte[]> files) {
        this.files = Collections.unmodifiableSortedMap(files);
        MessageDigest digest = Hashing.sha256();
        long size = 0;
        for (Map.Entry<String, byte[]> entry : files.entrySet()) {
            digest.update(entry.getKey().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(entry.getValue());
            digest.update((byte) 0);
            size += entry.getValue().length;
        }
        this.contentHash = Hashing.hex(digest);
        this.sizeBytes = size;
    }

    /**
     * Create a blob from in-memory content. Byte arrays are copied.
     */
    public static Blob of(Map<String, byte[]> content) {
        SortedMap<String, byte[]> copy = new TreeMap<>();
        content.forEach((path, bytes) -> copy.put(normalize(path), bytes.clone()));
        return new Blob(copy);
    }

    public static Blob empty() {
        return new Blob(new TreeMap<>());
    }

    /**
     * Snapshot a directory recursively, or a single file under its own name.
     *
     * @throws UncheckedIOException if the tree cannot be read
     */
    public static Blob snapshot(Path source) {
        SortedMap<String, byte[]> content = new TreeMap<>();
        try {
            if (Files.isRegularFile(source)) {
                content.put(source.getFileName().toString(), Files.readAllBytes(source));
            } else if (Files.isDirectory(source)) {
                try (Stream<Path> paths = Files.walk(source)) {
                    for (Path file : (Iterable<Path>) paths.filter(Files::isRegularFile)::iterator) {
                        content.put(normalize(source.relativize(file).toString()), Files.readAllBytes(file));
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to snapshot " + source, e);
        }
        return new Blob(content);
    }

    /**
     * Write every file of this blob below the target directory, creating parents.
     *
     * @throws UncheckedIOException if a file cannot be written
     */
    public void restoreTo(Path target) {
        try {
            Files.createDirectories(target);
            for (Map.Entry<String, byte[]> entry : files.entrySet()) {
                Path file = target.resolve(entry.getKey()).normalize();
                if (!file.startsWith(target.normalize())) {
                    throw new IllegalStateException("Blob entry escapes target directory: " + entry.getKey());
                }
                if (file.getParent() != null) {
                    Files.createDirectories(file.getParent());
                }
                Files.write(file, entry.getValue());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to restore blob to " + target, e);
        }
    }

    public Map<String, byte[]> files() {
        return files;
    }

    public byte[] file(String path) {
        byte[] bytes = files.get(normalize(path));
        return bytes != null ? bytes.clone() : null;
    }

    public String contentHash() {
        return contentHash;
    }

    public long sizeBytes() {
        return sizeBytes;
    }

    public int fileCount() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    private static String normalize(String path) {
        return path.replace('\\', '/');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Blob other)) {
            return false;
        }
        return contentHash.equals(other.contentHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentHash);
    }

    @Override
    public String toString() {
        return "Blob{files=" + files.size() + ", bytes=" + sizeBytes + ", hash=" + contentHash + "}";
    }
}
