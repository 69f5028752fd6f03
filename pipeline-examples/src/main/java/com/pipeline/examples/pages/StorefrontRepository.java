package com.pipeline.examples.pages;

import com.pipeline.engine.environment.CommandResult;
import com.pipeline.engine.environment.ScriptedEnvironmentProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * A React storefront held in memory, with simulated {@code git} and {@code npm} commands
 * for the dry-run provisioner.
 *
 * Commands:
 * - {@code git checkout}: writes the current files into the workspace
 * - {@code npm ci}: installs {@code node_modules} at the versions pinned by the lockfile
 * - {@code npm run build}: renders {@code build/index.html}; fails without {@code node_modules}
 * - {@code npm test}: fails while any source contains {@code FAILING_TEST}
 */
public class StorefrontRepository {

    private static final Logger log = LoggerFactory.getLogger(StorefrontRepository.class);

    public static final String LOCKFILE = "package-lock.json";
    public static final String APP = "src/App.js";

    private final Map<String, String> files = new TreeMap<>();
    private final AtomicInteger installs = new AtomicInteger();
    private final AtomicInteger builds = new AtomicInteger();

    public StorefrontRepository() {
        files.put(LOCKFILE, "{\"react\": \"18.2.0\", \"react-dom\": \"18.2.0\"}");
        files.put("analysis-project.properties", "projectKey=acme-storefront\norganization=acme\nsources=src\n");
        files.put(APP, """
            export default function App() {
              console.log('rendering storefront');
              return <h1>Storefront</h1>;
            }
            """);
        files.put("README.md", "# Storefront\n");
    }

    /**
     * Change or add a file. Later checkouts see the new content.
     */
    public synchronized StorefrontRepository commit(String path, String content) {
        files.put(path, content);
        return this;
    }

    public synchronized String read(String path) {
        return files.get(path);
    }

    public int getInstallCount() {
        return installs.get();
    }

    public int getBuildCount() {
        return builds.get();
    }

    /**
     * Register the simulated commands.
     */
    public void attach(ScriptedEnvironmentProvisioner provisioner) {
        provisioner
            .on("git checkout", (cmd, ws, env) -> checkout(ws))
            .on("npm ci", (cmd, ws, env) -> install(ws))
            .on("npm run build", (cmd, ws, env) -> build(ws, env))
            .on("npm test", (cmd, ws, env) -> test(ws));
    }

    // ========== Commands ==========

    private CommandResult checkout(Path workspace) throws IOException {
        Map<String, String> snapshot;
        synchronized (this) {
            snapshot = Map.copyOf(files);
        }
        for (Map.Entry<String, String> file : snapshot.entrySet()) {
            Path target = workspace.resolve(file.getKey());
            Files.createDirectories(target.getParent());
            Files.writeString(target, file.getValue(), StandardCharsets.UTF_8);
        }
        return CommandResult.success(List.of("Checked out " + snapshot.size() + " files"));
    }

    private CommandResult install(Path workspace) throws IOException {
        Path lockfile = workspace.resolve(LOCKFILE);
        if (!Files.exists(lockfile)) {
            return CommandResult.failure(1, List.of("npm ERR! The `npm ci` command can only install with an existing "
                + LOCKFILE));
        }
        installs.incrementAndGet();
        String pinned = Files.readString(lockfile, StandardCharsets.UTF_8);
        Path react = workspace.resolve("node_modules/react");
        Files.createDirectories(react);
        Files.writeString(react.resolve("package.json"), pinned, StandardCharsets.UTF_8);
        Files.writeString(react.resolve("index.js"), "module.exports = require('./cjs/react.production.min.js');");
        log.debug("Installed dependencies into {}", workspace);
        return CommandResult.success(List.of("added 2 packages in 3s"));
    }

    private CommandResult build(Path workspace, Map<String, String> env) throws IOException {
        if (!Files.exists(workspace.resolve("node_modules/react/index.js"))) {
            return CommandResult.failure(1, List.of("Module not found: Error: Can't resolve 'react'"));
        }
        builds.incrementAndGet();
        String app = Files.readString(workspace.resolve(APP), StandardCharsets.UTF_8);
        Path build = workspace.resolve("build");
        Files.createDirectories(build);
        Files.writeString(build.resolve("index.html"),
            "<!doctype html><div id=\"root\"></div><script>" + app.strip() + "</script>", StandardCharsets.UTF_8);
        return CommandResult.success(List.of(
            "Creating an optimized " + env.getOrDefault("NODE_ENV", "development") + " build...",
            "Compiled successfully."));
    }

    private CommandResult test(Path workspace) throws IOException {
        try (Stream<Path> sources = Files.walk(workspace.resolve("src"))) {
            for (Path source : sources.filter(Files::isRegularFile).toList()) {
                if (Files.readString(source, StandardCharsets.UTF_8).contains("FAILING_TEST")) {
                    return CommandResult.failure(1, List.of("FAIL " + workspace.relativize(source), "Tests: 1 failed"));
                }
            }
        }
        return CommandResult.success(List.of("Tests: 12 passed, 12 total"));
    }
}
