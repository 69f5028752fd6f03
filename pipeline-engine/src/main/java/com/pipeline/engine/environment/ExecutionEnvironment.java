package com.pipeline.engine.environment;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Disposable compute for one job: a workspace directory and a shell.
 * Closing the environment discards the workspace.
 */
public interface ExecutionEnvironment extends AutoCloseable {

    String osIdentifier();

    Path workspace();

    /**
     * Run a shell command in the workspace.
     * 
     * @param command The command line
     * @param env Environment variables added for this command
     * @param timeout Maximum wall-clock time, or null for none
     * @return Exit code and output
     * @throws InterruptedException if the calling thread is interrupted; the command is killed
     */
    CommandResult exec(String command, Map<String, String> env, Duration timeout) throws InterruptedException;

    @Override
    void close();
}
