package com.shipyard.core.stage;

import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.StageResult;
import com.shipyard.core.model.TriggerContext;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a run handed to a stage while it executes.
 *
 * @param runId           the owning run
 * @param pipeline        the owning pipeline name
 * @param trigger         ref and commit being processed
 * @param upstreamResults results of the stage's direct upstreams
 * @param tags            artifact tags published by earlier stages of this run
 */
public record StageContext(
    String runId,
    String pipeline,
    TriggerContext trigger,
    Map<String, StageResult> upstreamResults,
    List<ArtifactTag> tags
) {

    public StageContext {
        upstreamResults = upstreamResults != null ? Map.copyOf(upstreamResults) : Map.of();
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    /** The published tag bound to this run's commit, if an earlier stage produced one. */
    public Optional<ArtifactTag> immutableTag() {
        return tags.stream()
                .filter(t -> t.tag().equals(trigger.commitId()))
                .findFirst();
    }
}
