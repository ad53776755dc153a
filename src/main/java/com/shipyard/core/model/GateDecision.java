package com.shipyard.core.model;

import java.io.Serializable;

/**
 * Result of evaluating a stage's gate against its direct upstream results.
 */
public record GateDecision(
    Outcome outcome,
    String reason
) implements Serializable {

    public enum Outcome { PROCEED, SKIP, FAIL_PIPELINE }

    public static GateDecision proceed() {
        return new GateDecision(Outcome.PROCEED, null);
    }

    public static GateDecision skip(String reason) {
        return new GateDecision(Outcome.SKIP, reason);
    }

    public static GateDecision failPipeline(String reason) {
        return new GateDecision(Outcome.FAIL_PIPELINE, reason);
    }

    public boolean proceeds() {
        return outcome == Outcome.PROCEED;
    }
}
