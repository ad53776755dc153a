package com.shipyard.core.model;

/**
 * Whether a stage's failure halts the pipeline.
 */
public enum GatePolicy {
    /** Failure fails the run and skips every downstream stage. */
    BLOCKING,
    /** Failure is recorded and reported but never halts the run. */
    ADVISORY
}
