package com.pipeline.engine.environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dry-run provisioner: workspaces are real directories, but commands are answered
 * by registered handlers instead of a shell. Commands without a handler succeed
 * and only echo themselves.
 */
public class ScriptedEnvironmentProvisioner implements EnvironmentProvisioner {
    
    private static final Logger log = LoggerFactory.getLogger(ScriptedEnvironmentProvisioner.class);
    
    private final Path baseDir;
    private final List<Rule> rules = new CopyOnWriteArrayList<>();
    private final List<String> executed = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger provisioned = new AtomicInteger();
    private final AtomicInteger disposed = new AtomicInteger();
    
    public ScriptedEnvironmentProvisioner(Path baseDir) {
        this.baseDir = baseDir;
    }
    
    /**
     * Answer commands starting with the given prefix. The first matching rule wins.
     */
    public ScriptedEnvironmentProvisioner on(String commandPrefix, CommandHandler handler) {
        rules.add(new Rule(commandPrefix, handler));
        return this;
    }
    
    @Override
    public ExecutionEnvironment provision(String osIdentifier, UUID runId, String jobId) {
        provisioned.incrementAndGet();
        return new ScriptedEnvironment(osIdentifier, Workspaces.create(baseDir, runId, jobId), jobId);
    }
    
    /** Commands executed so far, as {@code jobId: command}. */
    public List<String> getExecuted() {
        synchronized (executed) {
            return List.copyOf(executed);
        }
    }
    
    public int getProvisionedCount() {
        return provisioned.get();
    }
    
    public int getDisposedCount() {
        return disposed.get();
    }
    
    /**
     * Simulated command.
     */
    @FunctionalInterface
    public interface CommandHandler {
        CommandResult handle(String command, Path workspace, Map<String, String> env)
            throws IOException, InterruptedException;
    }
    
    private record Rule(String prefix, CommandHandler handler) {
    }
    
    private final class ScriptedEnvironment implements ExecutionEnvironment {
        
        private final String osIdentifier;
        private final Path workspace;
        private final String jobId;
        
        ScriptedEnvironment(String osIdentifier, Path workspace, String jobId) {
            this.osIdentifier = osIdentifier;
            this.workspace = workspace;
            this.jobId = jobId;
        }
        
        @Override
        public String osIdentifier() {
            return osIdentifier;
        }
        
        @Override
        public Path workspace() {
            return workspace;
        }
        
        @Override
        public CommandResult exec(String command, Map<String, String> env, Duration timeout)
                throws InterruptedException {
            String trimmed = command.trim();
            executed.add(jobId + ": " + trimmed);
            for (Rule rule : rules) {
                if (trimmed.startsWith(rule.prefix())) {
                    try {
                        return rule.handler().handle(trimmed, workspace, env);
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                }
            }
            log.debug("[dry-run] {}: {}", jobId, trimmed);
            return CommandResult.success(List.of("[dry-run] " + trimmed));
        }
        
        @Override
        public void close() {
            Workspaces.delete(workspace);
            disposed.incrementAndGet();
        }
    }
}
