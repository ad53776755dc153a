package com.shipyard.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Outcome of pulling and running a published artifact with fixed inputs.
 *
 * @param tag         the tag that was actually pulled, {@code null} if no pull succeeded
 * @param stdout      captured standard output ({@code ""} if the artifact never ran)
 * @param exitCode    container exit status, {@code -1} if the artifact never ran
 * @param passed      whether the output and exit status matched expectations
 * @param failureKind why the check failed; {@code null} when passed
 * @param message     short human-readable detail
 * @param checkedAt   when the check completed
 */
public record DeploymentCheck(
    ArtifactTag tag,
    String stdout,
    int exitCode,
    boolean passed,
    FailureKind failureKind,
    String message,
    Instant checkedAt
) implements Serializable {

    public static DeploymentCheck passed(ArtifactTag tag, String stdout) {
        return new DeploymentCheck(tag, stdout, 0, true, null, "output matched", Instant.now());
    }

    public static DeploymentCheck assertionFailure(ArtifactTag tag, String stdout, int exitCode, String message) {
        return new DeploymentCheck(tag, stdout, exitCode, false, FailureKind.ASSERTION, message, Instant.now());
    }

    public static DeploymentCheck infrastructureFailure(ArtifactTag tag, String message) {
        return new DeploymentCheck(tag, "", -1, false, FailureKind.INFRASTRUCTURE, message, Instant.now());
    }
}
