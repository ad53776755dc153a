package com.shipyard.core.engine;

import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.events.EventBus;
import com.shipyard.core.events.PipelineEvent;
import com.shipyard.core.gate.GateEvaluator;
import com.shipyard.core.graph.PipelineGraph;
import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.GatePolicy;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.RunStatus;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;
import com.shipyard.core.model.StageStatus;
import com.shipyard.core.model.TriggerContext;
import com.shipyard.core.scheduler.StageScheduler;
import com.shipyard.core.stage.BuildAndPublishStageHandler;
import com.shipyard.core.stage.StageContext;
import com.shipyard.core.stage.StageHandler;
import com.shipyard.core.stage.StageRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class PipelineExecutorTest {

    /**
     * Test handler that delegates each stage to a scripted behaviour and records the call order.
     */
    private static final class ScriptedHandler implements StageHandler {
        private final StageKind kind;
        private final Map<String, BiFunction<Stage, StageContext, StageResult>> scripts = new ConcurrentHashMap<>();
        private final List<String> invoked = new CopyOnWriteArrayList<>();

        ScriptedHandler(StageKind kind) {
            this.kind = kind;
        }

        ScriptedHandler on(String stage, BiFunction<Stage, StageContext, StageResult> script) {
            scripts.put(stage, script);
            return this;
        }

        @Override
        public StageKind kind() {
            return kind;
        }

        @Override
        public StageResult handle(Stage stage, StageContext context) {
            invoked.add(stage.name());
            var script = scripts.get(stage.name());
            return script != null ? script.apply(stage, context)
                    : StageResult.success(stage, "ok", Map.of(), Instant.now());
        }
    }

    private static StageResult fail(Stage stage) {
        return StageResult.failure(stage, FailureKind.ASSERTION, "assertion failed", Map.of(), Instant.now());
    }

    private static Stage stage(String name, GatePolicy policy, String... upstream) {
        return new Stage(name, List.of(upstream), StageKind.TEST, policy);
    }

    private final EventBus eventBus = new EventBus();

    private PipelineRun execute(PipelineGraph graph, ScriptedHandler handler, int maxParallel) {
        var executor = new PipelineExecutor(new GateEvaluator(), new StageRunner(List.of(handler)),
                new StageScheduler(), eventBus, null, maxParallel);
        var run = new PipelineRun("RUN-1", graph.name(), TriggerContext.commit("main", "abc123"),
                graph.stageNames());
        return executor.execute(graph, run);
    }

    @Nested
    @DisplayName("gating")
    class Gating {

        @Test
        @DisplayName("blocking failure skips its downstream and fails the run")
        void blockingFailureSkipsDownstream() {
            var graph = PipelineGraph.of("ci", List.of(
                    stage("a", GatePolicy.BLOCKING), stage("b", GatePolicy.BLOCKING, "a")));
            var handler = new ScriptedHandler(StageKind.TEST).on("a", (s, c) -> fail(s));

            PipelineRun run = execute(graph, handler, 2);

            assertEquals(RunStatus.FAILED, run.status());
            assertEquals(StageStatus.FAILURE, run.result("a").orElseThrow().status());
            assertEquals(StageStatus.SKIPPED, run.result("b").orElseThrow().status());
            assertEquals(List.of("a"), handler.invoked);
        }

        @Test
        @DisplayName("advisory failure is reported but the run succeeds")
        void advisoryFailureStillSucceeds() {
            var graph = PipelineGraph.of("ci", List.of(
                    stage("build", GatePolicy.BLOCKING),
                    stage("scan-advisory", GatePolicy.ADVISORY, "build"),
                    stage("scan-blocking", GatePolicy.BLOCKING, "build")));
            var handler = new ScriptedHandler(StageKind.TEST).on("scan-advisory", (s, c) -> fail(s));

            PipelineRun run = execute(graph, handler, 2);

            assertEquals(RunStatus.SUCCESS, run.status());
            assertEquals(StageStatus.FAILURE, run.result("scan-advisory").orElseThrow().status());
            assertEquals(StageStatus.SUCCESS, run.result("scan-blocking").orElseThrow().status());
        }

        @Test
        @DisplayName("a stage downstream of a failed advisory stage still runs")
        void downstreamOfAdvisoryFailureRuns() {
            var graph = PipelineGraph.of("ci", List.of(
                    stage("advice", GatePolicy.ADVISORY), stage("next", GatePolicy.BLOCKING, "advice")));
            var handler = new ScriptedHandler(StageKind.TEST).on("advice", (s, c) -> fail(s));

            PipelineRun run = execute(graph, handler, 1);

            assertEquals(StageStatus.SUCCESS, run.result("next").orElseThrow().status());
            assertEquals(RunStatus.SUCCESS, run.status());
        }

        @Test
        @DisplayName("skips propagate transitively")
        void transitiveSkip() {
            var graph = PipelineGraph.of("ci", List.of(
                    stage("a", GatePolicy.BLOCKING), stage("b", GatePolicy.BLOCKING, "a"),
                    stage("c", GatePolicy.ADVISORY, "b"), stage("d", GatePolicy.ADVISORY, "c")));
            var handler = new ScriptedHandler(StageKind.TEST).on("a", (s, c) -> fail(s));

            PipelineRun run = execute(graph, handler, 2);

            for (String name : List.of("b", "c", "d")) {
                assertEquals(StageStatus.SKIPPED, run.result(name).orElseThrow().status(), name);
            }
            assertEquals(4, run.results().size());
        }

        @Test
        @DisplayName("infrastructure errors in a handler are recorded, not thrown")
        void handlerExceptionRecorded() {
            var graph = PipelineGraph.of("ci", List.of(stage("a", GatePolicy.BLOCKING)));
            var handler = new ScriptedHandler(StageKind.TEST).on("a", (s, c) -> {
                throw new CollaboratorException("docker daemon unreachable");
            });

            PipelineRun run = execute(graph, handler, 1);

            StageResult a = run.result("a").orElseThrow();
            assertEquals(FailureKind.INFRASTRUCTURE, a.failureKind());
            assertEquals(RunStatus.FAILED, run.status());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("independent stages run concurrently")
        void independentStagesOverlap() {
            var bothStarted = new CountDownLatch(2);
            BiFunction<Stage, StageContext, StageResult> rendezvous = (s, c) -> {
                bothStarted.countDown();
                try {
                    // Only completes if the sibling is running at the same time.
                    if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                        return fail(s);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return fail(s);
                }
                return StageResult.success(s, "ok", Map.of(), Instant.now());
            };
            var graph = PipelineGraph.of("ci", List.of(stage("a", GatePolicy.BLOCKING), stage("b", GatePolicy.BLOCKING)));
            var handler = new ScriptedHandler(StageKind.TEST).on("a", rendezvous).on("b", rendezvous);

            PipelineRun run = execute(graph, handler, 2);

            assertEquals(RunStatus.SUCCESS, run.status());
        }

        @Test
        @DisplayName("run succeeds only if both independent stages succeed")
        void bothMustSucceed() {
            var graph = PipelineGraph.of("ci", List.of(stage("a", GatePolicy.BLOCKING), stage("b", GatePolicy.BLOCKING)));
            var handler = new ScriptedHandler(StageKind.TEST).on("b", (s, c) -> fail(s));

            assertEquals(RunStatus.FAILED, execute(graph, handler, 2).status());
        }

        @Test
        @DisplayName("after a blocking failure in-flight siblings finish but unstarted stages are skipped")
        void haltLetsInFlightFinish() {
            var siblingStarted = new CountDownLatch(1);
            var graph = PipelineGraph.of("ci", List.of(
                    stage("fast-fail", GatePolicy.BLOCKING),
                    stage("slow", GatePolicy.BLOCKING),
                    stage("later", GatePolicy.BLOCKING),
                    stage("after-slow", GatePolicy.BLOCKING, "slow")));
            var handler = new ScriptedHandler(StageKind.TEST)
                    .on("fast-fail", (s, c) -> {
                        try {
                            siblingStarted.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return fail(s);
                    })
                    .on("slow", (s, c) -> {
                        siblingStarted.countDown();
                        try {
                            Thread.sleep(200);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return StageResult.success(s, "ok", Map.of(), Instant.now());
                    });

            // Two workers: "later" waits in the queue behind the first two.
            PipelineRun run = execute(graph, handler, 2);

            assertEquals(RunStatus.FAILED, run.status());
            assertEquals(StageStatus.SUCCESS, run.result("slow").orElseThrow().status());
            assertEquals(StageStatus.SKIPPED, run.result("later").orElseThrow().status());
            assertEquals(StageStatus.SKIPPED, run.result("after-slow").orElseThrow().status());
            assertFalse(handler.invoked.contains("later"));
            assertTrue(run.result("later").orElseThrow().message().contains("halted"));
        }

        @Test
        @DisplayName("never runs more than maxParallel stages at once")
        void respectsMaxParallel() {
            var running = new AtomicInteger();
            var peak = new AtomicInteger();
            BiFunction<Stage, StageContext, StageResult> track = (s, c) -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(30);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                running.decrementAndGet();
                return StageResult.success(s, "ok", Map.of(), Instant.now());
            };
            var stages = new ArrayList<Stage>();
            var handler = new ScriptedHandler(StageKind.TEST);
            for (int i = 0; i < 6; i++) {
                stages.add(stage("s" + i, GatePolicy.BLOCKING));
                handler.on("s" + i, track);
            }

            PipelineRun run = execute(PipelineGraph.of("ci", stages), handler, 2);

            assertEquals(RunStatus.SUCCESS, run.status());
            assertTrue(peak.get() <= 2, "peak " + peak.get());
        }
    }

    @Nested
    @DisplayName("run bookkeeping")
    class Bookkeeping {

        @Test
        @DisplayName("tags published by a stage are visible to its downstream")
        void tagsFlowDownstream() {
            var tag = new ArtifactTag("ghcr.io", "acme", "app", "abc123");
            var seen = new HashMap<String, List<ArtifactTag>>();
            var graph = PipelineGraph.of("ci", List.of(
                    stage("publish", GatePolicy.BLOCKING), stage("scan", GatePolicy.BLOCKING, "publish")));
            var handler = new ScriptedHandler(StageKind.TEST)
                    .on("publish", (s, c) -> StageResult.success(s, "published",
                            Map.of(BuildAndPublishStageHandler.PAYLOAD_TAGS, List.of(tag)), Instant.now()))
                    .on("scan", (s, c) -> {
                        seen.put("scan", c.tags());
                        return StageResult.success(s, "ok", Map.of(), Instant.now());
                    });

            PipelineRun run = execute(graph, handler, 2);

            assertEquals(List.of(tag), seen.get("scan"));
            assertEquals(List.of(tag), run.tags());
        }

        @Test
        @DisplayName("results come back in topological order and stage events are published")
        void orderAndEvents() {
            var events = new CopyOnWriteArrayList<PipelineEvent>();
            eventBus.on(PipelineEvent.STAGE_STARTED, events::add);
            eventBus.on(PipelineEvent.STAGE_SKIPPED, events::add);
            var graph = PipelineGraph.of("ci", List.of(
                    stage("a", GatePolicy.BLOCKING), stage("b", GatePolicy.BLOCKING, "a")));

            PipelineRun run = execute(graph, new ScriptedHandler(StageKind.TEST).on("a", (s, c) -> fail(s)), 1);

            assertEquals(List.of("a", "b"), run.results().stream().map(StageResult::stageName).toList());
            assertTrue(run.isComplete());
            assertTrue(events.stream().anyMatch(e -> PipelineEvent.STAGE_STARTED.equals(e.eventType())));
            assertTrue(events.stream().anyMatch(e -> PipelineEvent.STAGE_SKIPPED.equals(e.eventType())
                    && "b".equals(e.stageName())));
        }

        @Test
        @DisplayName("maxParallel must be positive")
        void rejectsZeroParallelism() {
            assertThrows(IllegalArgumentException.class, () -> new PipelineExecutor(new GateEvaluator(),
                    new StageRunner(List.of()), new StageScheduler(), eventBus, null, 0));
        }
    }
}
