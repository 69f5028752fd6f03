package com.pipeline.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BlobTest {

    @TempDir
    Path tempDir;

    @Test
    void snapshot_thenRestore_shouldReproduceTree() throws Exception {
        Path source = tempDir.resolve("build");
        Files.createDirectories(source.resolve("static/js"));
        Files.writeString(source.resolve("index.html"), "<html></html>");
        Files.writeString(source.resolve("static/js/main.js"), "console.log(1)");

        Blob blob = Blob.snapshot(source);
        Path target = tempDir.resolve("restored");
        blob.restoreTo(target);

        assertThat(blob.fileCount()).isEqualTo(2);
        assertThat(target.resolve("index.html")).hasContent("<html></html>");
        assertThat(target.resolve("static/js/main.js")).hasContent("console.log(1)");
        assertThat(Blob.snapshot(target).contentHash()).isEqualTo(blob.contentHash());
    }

    @Test
    void contentHash_shouldDependOnPathsAndBytes() {
        Blob a = Blob.of(Map.of("a.txt", "x".getBytes(StandardCharsets.UTF_8)));
        Blob b = Blob.of(Map.of("b.txt", "x".getBytes(StandardCharsets.UTF_8)));
        Blob c = Blob.of(Map.of("a.txt", "x".getBytes(StandardCharsets.UTF_8)));

        assertThat(a.contentHash()).isNotEqualTo(b.contentHash());
        assertThat(a).isEqualTo(c);
        assertThat(a.sizeBytes()).isEqualTo(1);
    }

    @Test
    void snapshot_ofMissingPath_shouldBeEmpty() {
        assertThat(Blob.snapshot(tempDir.resolve("nope")).isEmpty()).isTrue();
    }

    @Test
    void hashFiles_shouldChangeWhenLockfileChanges() throws Exception {
        Files.writeString(tempDir.resolve("package-lock.json"), "{\"lockfileVersion\":3}");
        Files.writeString(tempDir.resolve("README.md"), "readme");
        String before = CacheKeys.hashFiles(tempDir, List.of("**/package-lock.json"));

        Files.writeString(tempDir.resolve("README.md"), "changed readme");
        assertThat(CacheKeys.hashFiles(tempDir, List.of("**/package-lock.json"))).isEqualTo(before);

        Files.writeString(tempDir.resolve("package-lock.json"), "{\"lockfileVersion\":2}");
        assertThat(CacheKeys.hashFiles(tempDir, List.of("**/package-lock.json"))).isNotEqualTo(before);
    }

    @Test
    void derive_shouldJoinScopeOsAndHash() {
        assertThat(CacheKeys.derive("npm", "ubuntu-latest", "abc")).isEqualTo("npm:ubuntu-latest:abc");
    }
}
