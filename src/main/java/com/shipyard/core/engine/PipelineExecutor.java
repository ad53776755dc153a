package com.shipyard.core.engine;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.events.EventBus;
import com.shipyard.core.events.PipelineEvent;
import com.shipyard.core.gate.GateEvaluator;
import com.shipyard.core.graph.PipelineGraph;
import com.shipyard.core.logging.MdcContext;
import com.shipyard.core.metrics.PipelineMetrics;
import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.GateDecision;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.RunStatus;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageResult;
import com.shipyard.core.model.StageStatus;
import com.shipyard.core.scheduler.StageScheduler;
import com.shipyard.core.stage.BuildAndPublishStageHandler;
import com.shipyard.core.stage.StageContext;
import com.shipyard.core.stage.StageRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link PipelineGraph} to completion.
 * <p>
 * A single coordinator thread owns the run's result map: it gates ready stages,
 * hands proceeding ones to a bounded worker pool, and records each result only
 * once its future has completed, so gating never sees a partial result.
 * Independent stages run concurrently. After a blocking stage fails, stages
 * already in flight are allowed to finish but nothing new starts; every
 * remaining stage is recorded as skipped.
 * <p>
 * Stage failures never propagate out of {@link #execute}: the returned run is
 * always complete.
 */
@Service
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final GateEvaluator gateEvaluator;
    private final StageRunner stageRunner;
    private final StageScheduler scheduler;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final int maxParallel;

    @Autowired
    public PipelineExecutor(GateEvaluator gateEvaluator, StageRunner stageRunner, StageScheduler scheduler,
                            EventBus eventBus, ShipyardProperties properties,
                            @Autowired(required = false) PipelineMetrics metrics) {
        this(gateEvaluator, stageRunner, scheduler, eventBus, metrics, properties.getPipeline().getMaxParallel());
    }

    public PipelineExecutor(GateEvaluator gateEvaluator, StageRunner stageRunner, StageScheduler scheduler,
                            EventBus eventBus, PipelineMetrics metrics, int maxParallel) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1: " + maxParallel);
        }
        this.gateEvaluator = gateEvaluator;
        this.stageRunner = stageRunner;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxParallel = maxParallel;
    }

    /**
     * Executes every stage of the graph against the given (pending) run and completes it.
     *
     * @param graph validated pipeline graph
     * @param run   pending run whose stage order matches the graph
     * @return the same run, now SUCCESS or FAILED
     */
    public PipelineRun execute(PipelineGraph graph, PipelineRun run) {
        new Coordination(graph, run).runToCompletion();
        return run;
    }

    /**
     * State of one execution. Only ever touched by the coordinator thread.
     */
    private final class Coordination {

        private final PipelineGraph graph;
        private final PipelineRun run;
        private final Map<String, StageResult> results = new LinkedHashMap<>();
        private final Set<String> inFlight = new HashSet<>();
        private final Map<Future<StageResult>, Stage> futures = new HashMap<>();
        private final List<Stage> runnable = new ArrayList<>();
        private final Set<String> gated = new HashSet<>();
        private String haltedBy;

        Coordination(PipelineGraph graph, PipelineRun run) {
            this.graph = graph;
            this.run = run;
        }

        void runToCompletion() {
            ExecutorService pool = Executors.newFixedThreadPool(
                    Math.min(maxParallel, graph.size()), workerThreadFactory(run.runId()));
            var completion = new ExecutorCompletionService<StageResult>(pool);
            try {
                while (results.size() < graph.size()) {
                    dispatchReady(completion);
                    if (results.size() == graph.size()) break;
                    if (inFlight.isEmpty()) {
                        // Acyclic graphs always leave something ready or in flight.
                        throw new IllegalStateException("Run " + run.runId() + " stalled with "
                                + (graph.size() - results.size()) + " stages unresolved");
                    }
                    Future<StageResult> done = completion.take();
                    collect(done);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Run {} interrupted; skipping unfinished stages", run.runId());
                haltedBy = haltedBy != null ? haltedBy : "interrupt";
                skipRemaining("run interrupted");
            } finally {
                pool.shutdown();
                awaitPool(pool);
            }

            RunStatus status = overallStatus();
            run.complete(status);
            log.info("Run {} [{}] finished {}", run.runId(), graph.name(), status);
        }

        /**
         * Gate every newly ready stage, then start as many runnable stages as capacity allows.
         * Skips cascade within this loop until nothing new becomes ready.
         */
        private void dispatchReady(ExecutorCompletionService<StageResult> completion) {
            boolean progressed = true;
            while (progressed) {
                progressed = false;
                for (Stage stage : scheduler.computeReady(graph, results.keySet(), inFlight)) {
                    if (gated.contains(stage.name())) continue;
                    gated.add(stage.name());

                    if (haltedBy != null) {
                        recordSkipped(stage, "pipeline halted after " + haltedBy + " failed");
                        progressed = true;
                        continue;
                    }
                    GateDecision decision = gateEvaluator.evaluate(stage, upstreamResults(stage));
                    if (metrics != null) {
                        metrics.recordGateDecision(decision.outcome().name());
                    }
                    if (decision.proceeds()) {
                        runnable.add(stage);
                    } else {
                        if (decision.outcome() == GateDecision.Outcome.FAIL_PIPELINE && haltedBy == null) {
                            haltedBy = stage.name() + "'s upstream";
                        }
                        recordSkipped(stage, decision.reason());
                        progressed = true;
                    }
                }
            }

            while (!runnable.isEmpty() && inFlight.size() < maxParallel) {
                Stage stage = runnable.remove(0);
                if (haltedBy != null) {
                    recordSkipped(stage, "pipeline halted after " + haltedBy + " failed");
                    continue;
                }
                submit(stage, completion);
            }
            if (haltedBy != null && !runnable.isEmpty()) {
                for (Stage stage : List.copyOf(runnable)) {
                    recordSkipped(stage, "pipeline halted after " + haltedBy + " failed");
                }
                runnable.clear();
            }
        }

        private void submit(Stage stage, ExecutorCompletionService<StageResult> completion) {
            var context = new StageContext(run.runId(), graph.name(), run.trigger(),
                    upstreamResults(stage), run.tags());
            inFlight.add(stage.name());
            publish(PipelineEvent.STAGE_STARTED, stage.name(),
                    Map.of("kind", stage.kind().name(), "policy", stage.policy().name()));
            Future<StageResult> future = completion.submit(() -> {
                try {
                    return stageRunner.run(stage, context);
                } finally {
                    MdcContext.clear();
                }
            });
            futures.put(future, stage);
        }

        private void collect(Future<StageResult> done) throws InterruptedException {
            Stage stage = futures.remove(done);
            inFlight.remove(stage.name());
            StageResult result;
            try {
                result = done.get();
            } catch (ExecutionException e) {
                // StageRunner catches handler failures; this only covers errors outside it.
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Stage {} crashed outside its runner", stage.name(), cause);
                result = StageResult.failure(stage, FailureKind.INFRASTRUCTURE,
                        "stage crashed: " + cause, Map.of(), Instant.now());
            }
            record(result);

            List<?> produced = result.payload().get(BuildAndPublishStageHandler.PAYLOAD_TAGS) instanceof List<?> l
                    ? l : List.of();
            var tags = produced.stream()
                    .filter(ArtifactTag.class::isInstance)
                    .map(ArtifactTag.class::cast)
                    .toList();
            if (!tags.isEmpty() && result.status() == StageStatus.SUCCESS) {
                run.addTags(tags);
            }

            if (stage.isBlocking() && result.status() == StageStatus.FAILURE && haltedBy == null) {
                haltedBy = stage.name();
                log.info("Blocking stage {} failed; halting run {} ({} in flight will finish)",
                        stage.name(), run.runId(), inFlight.size());
            }
        }

        private void record(StageResult result) {
            results.put(result.stageName(), result);
            run.record(result);
            String type = result.status() == StageStatus.SKIPPED
                    ? PipelineEvent.STAGE_SKIPPED : PipelineEvent.STAGE_COMPLETED;
            var payload = new HashMap<String, Object>();
            payload.put("status", result.status().name());
            if (result.failureKind() != null) payload.put("failureKind", result.failureKind().name());
            if (result.message() != null) payload.put("message", result.message());
            publish(type, result.stageName(), payload);
        }

        private void recordSkipped(Stage stage, String reason) {
            log.info("Skipping stage {}: {}", stage.name(), reason);
            record(StageResult.skipped(stage, reason));
        }

        private void skipRemaining(String reason) {
            for (Stage stage : graph.topologicalOrder()) {
                if (!results.containsKey(stage.name()) && !inFlight.contains(stage.name())) {
                    recordSkipped(stage, reason);
                }
            }
            // In-flight stages are abandoned; record them so the run is still complete.
            for (Stage stage : futures.values()) {
                if (!results.containsKey(stage.name())) {
                    recordSkipped(stage, reason);
                }
            }
        }

        private Map<String, StageResult> upstreamResults(Stage stage) {
            var upstream = new HashMap<String, StageResult>();
            for (String name : stage.upstream()) {
                StageResult r = results.get(name);
                if (r != null) upstream.put(name, r);
            }
            return upstream;
        }

        private RunStatus overallStatus() {
            for (Stage stage : graph.topologicalOrder()) {
                if (!stage.isBlocking()) continue;
                StageResult r = results.get(stage.name());
                if (r == null || r.status() != StageStatus.SUCCESS) {
                    return RunStatus.FAILED;
                }
            }
            return RunStatus.SUCCESS;
        }

        private void publish(String type, String stageName, Map<String, Object> payload) {
            eventBus.publish(new PipelineEvent(type, run.runId(), stageName, payload, Instant.now()));
        }

        private void awaitPool(ExecutorService pool) {
            try {
                if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Workers for run {} still busy after shutdown", run.runId());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static ThreadFactory workerThreadFactory(String runId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "stage-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
