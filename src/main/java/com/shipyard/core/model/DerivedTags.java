package com.shipyard.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * The two tags produced for one build: one that follows the ref, one bound to the commit.
 */
public record DerivedTags(
    ArtifactTag mutableTag,
    ArtifactTag immutableTag
) implements Serializable {

    public List<ArtifactTag> asList() {
        return List.of(mutableTag, immutableTag);
    }
}
