package com.shipyard.core.scheduler;

import com.shipyard.core.graph.PipelineGraph;
import com.shipyard.core.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Computes which stages are ready to be gated: not yet completed, not in flight,
 * and every direct upstream has a recorded result.
 * <p>
 * The returned list follows the graph's topological order, so dispatch order is
 * deterministic and never depends on which sibling happened to finish first.
 */
@Service
public class StageScheduler {

    private static final Logger log = LoggerFactory.getLogger(StageScheduler.class);

    /**
     * Compute the stages eligible for gating.
     *
     * @param graph          the validated pipeline graph
     * @param completedNames stages that already have a result (any status)
     * @param inFlightNames  stages currently executing
     * @param limit          maximum number of stages to return
     * @return ready stages in topological order; empty when nothing is ready
     */
    public List<Stage> computeReady(PipelineGraph graph, Set<String> completedNames,
                                    Set<String> inFlightNames, int limit) {
        var ready = new ArrayList<Stage>();
        if (limit <= 0) {
            return ready;
        }

        for (Stage stage : graph.topologicalOrder()) {
            if (ready.size() >= limit) break;
            if (completedNames.contains(stage.name()) || inFlightNames.contains(stage.name())) {
                continue;
            }
            if (!completedNames.containsAll(stage.upstream())) {
                log.debug("  {} [{}] deps unsatisfied: {}", stage.name(), stage.kind(), stage.upstream());
                continue;
            }
            log.debug("  {} [{}] ready (deps: {})", stage.name(), stage.kind(), stage.upstream());
            ready.add(stage);
        }

        log.debug("computeReady: {} stages, {} completed, {} in flight, {} ready",
                graph.size(), completedNames.size(), inFlightNames.size(), ready.size());
        return ready;
    }

    /** Unbounded variant. */
    public List<Stage> computeReady(PipelineGraph graph, Set<String> completedNames, Set<String> inFlightNames) {
        return computeReady(graph, completedNames, inFlightNames, Integer.MAX_VALUE);
    }
}
