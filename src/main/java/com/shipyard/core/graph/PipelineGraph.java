package com.shipyard.core.graph;

import com.shipyard.core.model.Stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated directed acyclic graph of stages for one pipeline.
 * <p>
 * Edges are the explicit upstream-name lists on each {@link Stage}. The topological
 * order breaks ties by declaration order, so two graphs built from the same
 * declaration always order identically.
 */
public final class PipelineGraph {

    private final String name;
    private final Map<String, Stage> stages;
    private final List<Stage> topologicalOrder;
    private final Map<String, List<String>> downstream;

    private PipelineGraph(String name, Map<String, Stage> stages, List<Stage> topologicalOrder,
                          Map<String, List<String>> downstream) {
        this.name = name;
        this.stages = stages;
        this.topologicalOrder = topologicalOrder;
        this.downstream = downstream;
    }

    /**
     * Builds and validates a graph.
     *
     * @param name   pipeline name (e.g. "ci")
     * @param stages stages in declaration order
     * @throws PipelineGraphException on duplicate names, unknown upstream references or cycles
     */
    public static PipelineGraph of(String name, List<Stage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new PipelineGraphException("Pipeline " + name + " declares no stages");
        }

        var byName = new LinkedHashMap<String, Stage>();
        for (Stage stage : stages) {
            if (byName.putIfAbsent(stage.name(), stage) != null) {
                throw new PipelineGraphException("Pipeline " + name + " declares stage "
                        + stage.name() + " more than once");
            }
        }

        var downstream = new HashMap<String, List<String>>();
        for (Stage stage : stages) {
            downstream.putIfAbsent(stage.name(), new ArrayList<>());
        }
        for (Stage stage : stages) {
            var seen = new HashSet<String>();
            for (String up : stage.upstream()) {
                if (!byName.containsKey(up)) {
                    throw new PipelineGraphException("Stage " + stage.name() + " depends on unknown stage " + up);
                }
                if (up.equals(stage.name())) {
                    throw new PipelineGraphException("Stage " + stage.name() + " depends on itself");
                }
                if (seen.add(up)) {
                    downstream.get(up).add(stage.name());
                }
            }
        }

        List<Stage> order = topologicalSort(name, stages, byName);

        var frozenDownstream = new HashMap<String, List<String>>();
        downstream.forEach((k, v) -> frozenDownstream.put(k, List.copyOf(v)));
        return new PipelineGraph(name, Collections.unmodifiableMap(byName), List.copyOf(order),
                Map.copyOf(frozenDownstream));
    }

    /**
     * Kahn's algorithm, always picking the earliest-declared stage whose upstreams are placed.
     */
    private static List<Stage> topologicalSort(String name, List<Stage> declared, Map<String, Stage> byName) {
        var placed = new HashSet<String>();
        var order = new ArrayList<Stage>(declared.size());

        while (order.size() < declared.size()) {
            Stage next = null;
            for (Stage candidate : declared) {
                if (placed.contains(candidate.name())) continue;
                if (placed.containsAll(candidate.upstream())) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                var remaining = declared.stream()
                        .map(Stage::name)
                        .filter(n -> !placed.contains(n))
                        .toList();
                throw new PipelineGraphException("Pipeline " + name + " has a dependency cycle among " + remaining);
            }
            placed.add(next.name());
            order.add(next);
        }
        return order;
    }

    public String name() {
        return name;
    }

    public List<Stage> topologicalOrder() {
        return topologicalOrder;
    }

    public List<String> stageNames() {
        return topologicalOrder.stream().map(Stage::name).toList();
    }

    public Stage stage(String stageName) {
        Stage stage = stages.get(stageName);
        if (stage == null) {
            throw new IllegalArgumentException("No stage " + stageName + " in pipeline " + name);
        }
        return stage;
    }

    /** Names of stages that list {@code stageName} as a direct upstream. */
    public List<String> downstreamOf(String stageName) {
        return downstream.getOrDefault(stageName, List.of());
    }

    public int size() {
        return topologicalOrder.size();
    }
}
