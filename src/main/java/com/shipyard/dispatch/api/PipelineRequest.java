package com.shipyard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/pipelines: a commit event.
 *
 * @param ref           branch or merge ref; nullable
 * @param commit        commit identifier; required
 * @param changeRequest change request to report against; nullable, looked up by head commit when absent
 */
public record PipelineRequest(
    String ref,
    String commit,
    @JsonProperty("change_request") Integer changeRequest
) {}
