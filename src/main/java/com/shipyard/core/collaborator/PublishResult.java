package com.shipyard.core.collaborator;

import com.shipyard.core.model.ArtifactTag;

import java.util.List;

/**
 * Outcome of publishing one built artifact under several tags.
 *
 * @param digest content identifier shared by every tag
 * @param tags   tags now pointing at {@code digest}
 */
public record PublishResult(String digest, List<ArtifactTag> tags) {}
