package com.shipyard.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A named unit of work in a pipeline graph.
 *
 * @param name      unique name within the pipeline (e.g. "test-3.11")
 * @param upstream  names of stages that must complete first
 * @param kind      side effect performed when the stage runs
 * @param policy    whether a failure halts the pipeline
 * @param params    kind-specific parameters (e.g. "runtime", "command")
 */
public record Stage(
    String name,
    List<String> upstream,
    StageKind kind,
    GatePolicy policy,
    Map<String, String> params
) implements Serializable {

    public Stage {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stage name is required");
        }
        upstream = upstream != null ? List.copyOf(upstream) : List.of();
        policy = policy != null ? policy : GatePolicy.BLOCKING;
        params = params != null ? Map.copyOf(params) : Map.of();
    }

    public Stage(String name, List<String> upstream, StageKind kind, GatePolicy policy) {
        this(name, upstream, kind, policy, Map.of());
    }

    public String param(String key) {
        return params.get(key);
    }

    public boolean isBlocking() {
        return policy == GatePolicy.BLOCKING;
    }
}
