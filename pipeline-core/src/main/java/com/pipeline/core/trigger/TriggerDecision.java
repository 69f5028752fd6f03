package com.pipeline.core.trigger;

/**
 * Accept or reject verdict for one event against one trigger filter.
 * A rejection is an ordinary outcome and carries a human-readable reason.
 */
public record TriggerDecision(boolean accepted, String reason) {

    public static TriggerDecision accept(String reason) {
        return new TriggerDecision(true, reason);
    }

    public static TriggerDecision reject(String reason) {
        return new TriggerDecision(false, reason);
    }
}
