package com.shipyard.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One execution of a pipeline graph.
 * <p>
 * Results and tags may be appended only while the run is {@link RunStatus#PENDING};
 * {@link #complete} freezes the run and any later mutation throws.
 * Results are reported in the graph's topological order regardless of finish order.
 */
public final class PipelineRun {

    private final String runId;
    private final String pipeline;
    private final TriggerContext trigger;
    private final List<String> stageOrder;
    private final Instant startedAt;

    private final Map<String, StageResult> results = new LinkedHashMap<>();
    private final List<ArtifactTag> tags = new ArrayList<>();
    private RunStatus status = RunStatus.PENDING;
    private Instant finishedAt;

    public PipelineRun(String runId, String pipeline, TriggerContext trigger, List<String> stageOrder) {
        this.runId = runId;
        this.pipeline = pipeline;
        this.trigger = trigger;
        this.stageOrder = List.copyOf(stageOrder);
        this.startedAt = Instant.now();
    }

    public String runId() { return runId; }
    public String pipeline() { return pipeline; }
    public TriggerContext trigger() { return trigger; }
    public String refName() { return trigger.refName(); }
    public String commitId() { return trigger.commitId(); }
    public Instant startedAt() { return startedAt; }

    public synchronized RunStatus status() { return status; }
    public synchronized Instant finishedAt() { return finishedAt; }

    public synchronized boolean isComplete() {
        return status != RunStatus.PENDING;
    }

    public synchronized void record(StageResult result) {
        ensurePending();
        if (!stageOrder.contains(result.stageName())) {
            throw new IllegalArgumentException("Unknown stage " + result.stageName() + " for run " + runId);
        }
        if (results.putIfAbsent(result.stageName(), result) != null) {
            throw new IllegalStateException("Stage " + result.stageName() + " already recorded for run " + runId);
        }
    }

    public synchronized void addTags(List<ArtifactTag> produced) {
        ensurePending();
        for (ArtifactTag tag : produced) {
            if (!tags.contains(tag)) {
                tags.add(tag);
            }
        }
    }

    public synchronized void complete(RunStatus finalStatus) {
        ensurePending();
        if (finalStatus == RunStatus.PENDING) {
            throw new IllegalArgumentException("Cannot complete a run as PENDING");
        }
        this.status = finalStatus;
        this.finishedAt = Instant.now();
    }

    /** Results in topological stage order; stages without a result yet are omitted. */
    public synchronized List<StageResult> results() {
        var ordered = new ArrayList<StageResult>();
        for (String name : stageOrder) {
            StageResult r = results.get(name);
            if (r != null) ordered.add(r);
        }
        return List.copyOf(ordered);
    }

    public synchronized Optional<StageResult> result(String stageName) {
        return Optional.ofNullable(results.get(stageName));
    }

    public synchronized List<ArtifactTag> tags() {
        return List.copyOf(tags);
    }

    public List<String> stageOrder() {
        return stageOrder;
    }

    private void ensurePending() {
        if (status != RunStatus.PENDING) {
            throw new IllegalStateException("Run " + runId + " is already " + status);
        }
    }
}
