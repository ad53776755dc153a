package com.shipyard.core.collaborator;

import com.shipyard.core.model.ArtifactTag;

import java.time.Duration;
import java.util.List;

/**
 * Runs a pulled artifact with input arguments in isolation.
 */
public interface ExecutionSandbox {

    /**
     * Runs the artifact and captures its standard output and exit status.
     *
     * @throws CollaboratorException if the artifact cannot be started or does not finish in time
     */
    CommandResult run(ArtifactTag tag, List<String> args, Duration timeout);
}
