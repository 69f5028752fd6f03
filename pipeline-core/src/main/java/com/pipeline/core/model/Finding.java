package com.pipeline.core.model;

/**
 * One issue found by code analysis. Line is 0 for file-level findings.
 */
public record Finding(
    String rule,
    Severity severity,
    String file,
    int line,
    String message,
    boolean preExisting
) {
    /**
     * Identity used to compare against a baseline; ignores line shifts.
     */
    public String fingerprint() {
        return rule + "|" + file + "|" + message;
    }

    public Finding withPreExisting(boolean value) {
        return new Finding(rule, severity, file, line, message, value);
    }
}
