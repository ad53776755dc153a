package com.shipyard.core.graph;

/**
 * A pipeline definition is malformed (duplicate stage, dangling dependency, cycle).
 * Raised while building the graph, before any stage runs.
 */
public class PipelineGraphException extends RuntimeException {

    public PipelineGraphException(String message) {
        super(message);
    }
}
