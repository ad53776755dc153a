package com.shipyard.core.collaborator;

import com.shipyard.core.model.ArtifactTag;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds, publishes and pulls container images.
 */
public interface ArtifactRegistry {

    /**
     * Builds the artifact once and publishes it under every given tag.
     * All tags must point at the identical content.
     *
     * @throws CollaboratorException if the build or any push fails
     */
    PublishResult publish(Path buildContext, List<ArtifactTag> tags);

    /**
     * Pulls an artifact so it can be executed locally.
     *
     * @throws ArtifactNotFoundException if the tag does not exist
     * @throws CollaboratorException     on any other transport or auth failure
     */
    void pull(ArtifactTag tag);
}
