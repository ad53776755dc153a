package com.shipyard.core.model;

import java.io.Serializable;

/**
 * Immutable pointer to a published container image.
 *
 * @param registry   registry host, e.g. {@code ghcr.io}
 * @param namespace  owner or organisation
 * @param repository image repository name
 * @param tag        sanitized ref-derived tag or raw commit identifier
 */
public record ArtifactTag(
    String registry,
    String namespace,
    String repository,
    String tag
) implements Serializable {

    /** Repository path without the tag, e.g. {@code ghcr.io/acme/app}. */
    public String repositoryPath() {
        return registry + "/" + namespace + "/" + repository;
    }

    /** Full reference, e.g. {@code ghcr.io/acme/app:2-merge}. */
    public String reference() {
        return repositoryPath() + ":" + tag;
    }

    @Override
    public String toString() {
        return reference();
    }
}
