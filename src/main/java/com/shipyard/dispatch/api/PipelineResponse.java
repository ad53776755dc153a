package com.shipyard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.StageResult;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for pipeline run endpoints.
 */
public record PipelineResponse(
    @JsonProperty("run_id") String runId,
    String pipeline,
    String status,
    String ref,
    String commit,
    @JsonProperty("change_request") Integer changeRequest,
    @JsonProperty("upstream_run_id") String upstreamRunId,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    List<StageResponse> stages,
    List<String> tags
) {

    public record StageResponse(
        String name,
        String policy,
        String status,
        @JsonProperty("failure_kind") String failureKind,
        String message,
        @JsonProperty("duration_ms") long durationMs
    ) {
        static StageResponse from(StageResult r) {
            return new StageResponse(r.stageName(), r.policy().name(), r.status().name(),
                    r.failureKind() != null ? r.failureKind().name() : null,
                    r.message(), r.durationMs());
        }
    }

    public static PipelineResponse from(PipelineRun run) {
        return new PipelineResponse(
                run.runId(),
                run.pipeline(),
                run.status().name(),
                run.refName(),
                run.commitId(),
                run.trigger().changeRequest(),
                run.trigger().upstreamRunId(),
                run.startedAt(),
                run.finishedAt(),
                run.results().stream().map(StageResponse::from).toList(),
                run.tags().stream().map(t -> t.reference()).toList());
    }
}
