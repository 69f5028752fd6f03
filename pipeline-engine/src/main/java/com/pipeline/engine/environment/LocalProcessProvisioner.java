package com.pipeline.engine.environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands with {@code sh -c} on the local host, in a temporary workspace per job.
 * The OS identifier is recorded but not enforced.
 */
public class LocalProcessProvisioner implements EnvironmentProvisioner {
    
    private static final Logger log = LoggerFactory.getLogger(LocalProcessProvisioner.class);
    
    private final Path baseDir;
    
    public LocalProcessProvisioner(Path baseDir) {
        this.baseDir = baseDir;
    }
    
    @Override
    public ExecutionEnvironment provision(String osIdentifier, UUID runId, String jobId) {
        Path workspace = Workspaces.create(baseDir, runId, jobId);
        log.debug("Provisioned local environment {} for {} ({})", workspace, jobId, osIdentifier);
        return new LocalEnvironment(osIdentifier, workspace);
    }
    
    static final class LocalEnvironment implements ExecutionEnvironment {
        
        private final String osIdentifier;
        private final Path workspace;
        
        LocalEnvironment(String osIdentifier, Path workspace) {
            this.osIdentifier = osIdentifier;
            this.workspace = workspace;
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
            Path outputFile = null;
            Process process = null;
            try {
                outputFile = Files.createTempFile("step-", ".log");
                ProcessBuilder builder = new ProcessBuilder("sh", "-c", command)
                    .directory(workspace.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
                builder.environment().putAll(env);
                process = builder.start();
                
                boolean finished = true;
                if (timeout == null) {
                    process.waitFor();
                } else {
                    finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                }
                if (!finished) {
                    process.destroyForcibly();
                    return CommandResult.timeout(readOutput(outputFile));
                }
                int exitCode = process.exitValue();
                List<String> output = readOutput(outputFile);
                return exitCode == 0 ? CommandResult.success(output) : CommandResult.failure(exitCode, output);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to run command in " + workspace, e);
            } finally {
                if (outputFile != null) {
                    try {
                        Files.deleteIfExists(outputFile);
                    } catch (IOException e) {
                        log.debug("Failed to delete {}", outputFile);
                    }
                }
            }
        }
        
        @Override
        public void close() {
            Workspaces.delete(workspace);
        }
        
        /**
         * Bytes that are not valid UTF-8 decode to the replacement character.
         */
        static List<String> readOutput(Path file) throws IOException {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8).lines().toList();
        }
    }
}
