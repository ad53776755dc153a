package com.shipyard.core.engine;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.graph.PipelineGraph;
import com.shipyard.core.model.GatePolicy;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.stage.TestStageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The two pipelines this service runs.
 * <p>
 * {@code ci}: lint and one test stage per runtime as siblings, then coverage, then
 * build-and-publish, then an advisory and a blocking scan side by side.
 * {@code cd}: a single deploy-verify stage.
 * Graphs are validated once, at startup.
 */
@Component
public class PipelineDefinitions {

    private static final Logger log = LoggerFactory.getLogger(PipelineDefinitions.class);

    public static final String LINT = "lint";
    public static final String TEST_PREFIX = "test-";
    public static final String COVERAGE = "coverage";
    public static final String BUILD_AND_PUBLISH = "build-and-publish";
    public static final String SCAN_ADVISORY = "scan-advisory";
    public static final String SCAN_BLOCKING = "scan-blocking";
    public static final String DEPLOY_VERIFY = "deploy-verify";

    private final Map<String, PipelineGraph> graphs;

    public PipelineDefinitions(ShipyardProperties properties) {
        var pipeline = properties.getPipeline();
        PipelineGraph ci = ciGraph(pipeline.getUpstream(), properties.getCi().getRuntimes());
        PipelineGraph cd = cdGraph(pipeline.getDownstream());
        this.graphs = Map.of(ci.name(), ci, cd.name(), cd);
        log.info("Pipelines defined: {} ({} stages), {} ({} stages)",
                ci.name(), ci.size(), cd.name(), cd.size());
    }

    public static PipelineGraph ciGraph(String name, List<String> runtimes) {
        if (runtimes == null || runtimes.isEmpty()) {
            throw new IllegalArgumentException("At least one test runtime must be configured");
        }
        var stages = new ArrayList<Stage>();
        var verification = new ArrayList<String>();

        stages.add(new Stage(LINT, List.of(), StageKind.TEST, GatePolicy.BLOCKING,
                Map.of(TestStageHandler.PARAM_TOOL, TestStageHandler.TOOL_LINT)));
        verification.add(LINT);

        for (String runtime : runtimes) {
            String stageName = TEST_PREFIX + runtime;
            stages.add(new Stage(stageName, List.of(), StageKind.TEST, GatePolicy.BLOCKING,
                    Map.of(TestStageHandler.PARAM_TOOL, TestStageHandler.TOOL_TEST,
                           TestStageHandler.PARAM_RUNTIME, runtime)));
            verification.add(stageName);
        }

        stages.add(new Stage(COVERAGE, verification, StageKind.COVERAGE_CHECK, GatePolicy.BLOCKING));
        stages.add(new Stage(BUILD_AND_PUBLISH, List.of(COVERAGE), StageKind.BUILD_AND_PUBLISH, GatePolicy.BLOCKING));
        stages.add(new Stage(SCAN_ADVISORY, List.of(BUILD_AND_PUBLISH), StageKind.SECURITY_SCAN, GatePolicy.ADVISORY));
        stages.add(new Stage(SCAN_BLOCKING, List.of(BUILD_AND_PUBLISH), StageKind.SECURITY_SCAN, GatePolicy.BLOCKING));
        return PipelineGraph.of(name, stages);
    }

    public static PipelineGraph cdGraph(String name) {
        return PipelineGraph.of(name, List.of(
                new Stage(DEPLOY_VERIFY, List.of(), StageKind.DEPLOY_VERIFY, GatePolicy.BLOCKING)));
    }

    /**
     * @throws IllegalArgumentException if no pipeline has that name
     */
    public PipelineGraph graph(String pipelineName) {
        PipelineGraph graph = graphs.get(pipelineName);
        if (graph == null) {
            throw new IllegalArgumentException("Unknown pipeline '" + pipelineName + "', expected one of " + names());
        }
        return graph;
    }

    public List<String> names() {
        return graphs.keySet().stream().sorted().toList();
    }
}
