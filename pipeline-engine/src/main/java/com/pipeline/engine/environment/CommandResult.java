package com.pipeline.engine.environment;

import java.util.List;

/**
 * Exit code and combined stdout/stderr of a shell command.
 */
public record CommandResult(int exitCode, List<String> output, boolean timedOut) {
    
    public static final int TIMEOUT_EXIT_CODE = 124;
    
    public CommandResult {
        output = output != null ? List.copyOf(output) : List.of();
    }
    
    public static CommandResult success(List<String> output) {
        return new CommandResult(0, output, false);
    }
    
    public static CommandResult failure(int exitCode, List<String> output) {
        return new CommandResult(exitCode, output, false);
    }
    
    public static CommandResult timeout(List<String> output) {
        return new CommandResult(TIMEOUT_EXIT_CODE, output, true);
    }
    
    public boolean isSuccess() {
        return exitCode == 0 && !timedOut;
    }
}
