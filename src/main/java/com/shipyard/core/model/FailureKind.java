package com.shipyard.core.model;

/**
 * Distinguishes why a stage failed so reports can phrase it accordingly.
 */
public enum FailureKind {
    /** A collaborator could not be reached or started (auth, network, missing artifact, timeout). */
    INFRASTRUCTURE,
    /** The collaborator ran but its result failed a policy check. */
    ASSERTION
}
