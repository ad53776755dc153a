package com.shipyard.core.model;

/**
 * Lifecycle status of a pipeline run.
 */
public enum RunStatus {
    PENDING,
    SUCCESS,
    FAILED
}
