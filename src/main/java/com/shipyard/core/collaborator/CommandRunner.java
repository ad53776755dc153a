package com.shipyard.core.collaborator;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs opaque tool commands (linters, test runners, coverage reporters, scanners).
 */
public interface CommandRunner {

    /**
     * Runs a command to completion.
     *
     * @param command argv, first element is the executable
     * @param workDir working directory
     * @param env     extra environment variables
     * @param timeout maximum wall-clock time
     * @return exit status and combined output
     * @throws CollaboratorException if the command cannot start or exceeds the timeout
     */
    CommandResult run(List<String> command, Path workDir, Map<String, String> env, Duration timeout);
}
