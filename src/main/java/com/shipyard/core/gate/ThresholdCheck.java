package com.shipyard.core.gate;

/**
 * Inclusive numeric threshold comparison used by blocking threshold stages.
 */
public final class ThresholdCheck {

    private ThresholdCheck() {}

    /** A measured value equal to the threshold passes. */
    public static boolean passes(double measured, double threshold) {
        return measured >= threshold;
    }
}
