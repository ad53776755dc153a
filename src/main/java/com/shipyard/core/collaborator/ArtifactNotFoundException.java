package com.shipyard.core.collaborator;

/**
 * The requested tag does not exist in the registry.
 */
public class ArtifactNotFoundException extends CollaboratorException {

    public ArtifactNotFoundException(String reference) {
        super("Artifact not found: " + reference);
    }

    public ArtifactNotFoundException(String reference, Throwable cause) {
        super("Artifact not found: " + reference, cause);
    }
}
