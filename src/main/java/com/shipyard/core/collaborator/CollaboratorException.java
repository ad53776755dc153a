package com.shipyard.core.collaborator;

/**
 * Thrown when an external collaborator cannot be reached or started
 * (authentication, network, missing binary, timeout).
 * <p>
 * Stage handlers never let this escape; it is recorded as an infrastructure failure.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
