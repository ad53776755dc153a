package com.shipyard.core.model;

import java.io.Serializable;

/**
 * The event that started a pipeline run.
 *
 * @param refName        branch or pull-request merge ref (e.g. "main", "2/merge")
 * @param commitId       commit identifier being processed
 * @param changeRequest  change request number to report against, {@code null} if unknown
 * @param upstreamRunId  run that triggered this one, {@code null} for commit events
 */
public record TriggerContext(
    String refName,
    String commitId,
    Integer changeRequest,
    String upstreamRunId
) implements Serializable {

    public TriggerContext {
        if (commitId == null || commitId.isBlank()) {
            throw new IllegalArgumentException("Commit identifier is required");
        }
        refName = refName != null ? refName : "";
    }

    public static TriggerContext commit(String refName, String commitId) {
        return new TriggerContext(refName, commitId, null, null);
    }

    public TriggerContext withChangeRequest(Integer number) {
        return new TriggerContext(refName, commitId, number, upstreamRunId);
    }

    public TriggerContext downstreamOf(String runId) {
        return new TriggerContext(refName, commitId, changeRequest, runId);
    }
}
