package com.shipyard.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a pipeline runs.
 *
 * @param eventType  event type (e.g. "pipeline.started", "stage.completed", "pipeline.completed")
 * @param runId      the run this event belongs to
 * @param stageName  the stage this event relates to (nullable for run-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String stageName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String PIPELINE_STARTED = "pipeline.started";
    public static final String PIPELINE_COMPLETED = "pipeline.completed";
    public static final String STAGE_STARTED = "stage.started";
    public static final String STAGE_COMPLETED = "stage.completed";
    public static final String STAGE_SKIPPED = "stage.skipped";

    /** Payload key carrying the completed {@link com.shipyard.core.model.PipelineRun}. */
    public static final String KEY_RUN = "run";
}
