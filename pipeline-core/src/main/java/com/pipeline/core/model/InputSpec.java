package com.pipeline.core.model;

/**
 * One declared input of a composite action.
 * An input with a default value is never reported missing.
 */
public record InputSpec(
    String name,
    boolean required,
    String defaultValue,
    String description
) {
    public static InputSpec required(String name, String description) {
        return new InputSpec(name, true, null, description);
    }

    public static InputSpec optional(String name, String defaultValue, String description) {
        return new InputSpec(name, false, defaultValue, description);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
