package com.shipyard.core.model;

/**
 * Outcome of a single stage within a run.
 */
public enum StageStatus {
    SUCCESS,
    FAILURE,
    SKIPPED
}
