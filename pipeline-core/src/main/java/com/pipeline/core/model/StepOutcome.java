package com.pipeline.core.model;

import java.util.Locale;

/**
 * Outcome of a single step. The lower-case name is what conditions compare against.
 */
public enum StepOutcome {
    SUCCESS,
    FAILURE,
    SKIPPED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
