package com.shipyard.core.collaborator;

import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.Finding;

import java.util.List;

/**
 * Scans a published artifact and returns severity-classified findings.
 */
public interface VulnerabilityScanner {

    /**
     * @throws CollaboratorException if the scanner cannot run or its report cannot be read
     */
    List<Finding> scan(ArtifactTag tag);
}
