package com.shipyard.core.engine;

import com.shipyard.core.events.EventBus;
import com.shipyard.core.events.PipelineEvent;
import com.shipyard.core.graph.PipelineGraph;
import com.shipyard.core.logging.MdcContext;
import com.shipyard.core.metrics.PipelineMetrics;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.TriggerContext;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for starting pipeline runs.
 * <p>
 * Creates the run, stores it, publishes {@code pipeline.started}, hands it to the
 * {@link PipelineExecutor} and publishes {@code pipeline.completed} with the
 * finished run attached. Downstream pipelines and reporting hang off that event.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);
    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final PipelineDefinitions definitions;
    private final PipelineExecutor executor;
    private final PipelineRunStore store;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final Executor launchExecutor;
    /** Set only when this engine created its launch pool and so must stop it. */
    private final ExecutorService ownedLaunchPool;

    @Autowired
    public PipelineEngine(PipelineDefinitions definitions, PipelineExecutor executor, PipelineRunStore store,
                          EventBus eventBus, @Autowired(required = false) PipelineMetrics metrics) {
        this(definitions, executor, store, eventBus, metrics, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pipeline-launch");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public PipelineEngine(PipelineDefinitions definitions, PipelineExecutor executor, PipelineRunStore store,
                          EventBus eventBus, PipelineMetrics metrics, Executor launchExecutor) {
        this(definitions, executor, store, eventBus, metrics, launchExecutor, false);
    }

    PipelineEngine(PipelineDefinitions definitions, PipelineExecutor executor, PipelineRunStore store,
                   EventBus eventBus, PipelineMetrics metrics, Executor launchExecutor, boolean ownsLaunchPool) {
        this.definitions = definitions;
        this.executor = executor;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.launchExecutor = launchExecutor;
        this.ownedLaunchPool = ownsLaunchPool && launchExecutor instanceof ExecutorService pool ? pool : null;
    }

    /**
     * Stops accepting launches and gives in-flight runs a short grace period.
     */
    @PreDestroy
    void shutdown() {
        if (ownedLaunchPool == null) {
            return;
        }
        ownedLaunchPool.shutdown();
        try {
            if (!ownedLaunchPool.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Launched runs still busy after {}s; interrupting", SHUTDOWN_GRACE_SECONDS);
                ownedLaunchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedLaunchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs a pipeline on the calling thread and returns the completed run.
     *
     * @throws IllegalArgumentException if the pipeline is unknown
     */
    public PipelineRun run(String pipelineName, TriggerContext trigger) {
        PipelineGraph graph = definitions.graph(pipelineName);
        PipelineRun run = create(graph, trigger);
        return execute(graph, run);
    }

    /**
     * Starts a pipeline asynchronously. The returned run is already stored and
     * visible through {@link PipelineRunStore}, still pending.
     */
    public PipelineRun launch(String pipelineName, TriggerContext trigger) {
        PipelineGraph graph = definitions.graph(pipelineName);
        PipelineRun run = create(graph, trigger);
        CompletableFuture.runAsync(() -> execute(graph, run), launchExecutor)
                .exceptionally(ex -> {
                    log.error("Run {} failed unexpectedly: {}", run.runId(), ex.getMessage(), ex);
                    return null;
                });
        return run;
    }

    /**
     * Generates a run ID in the format {@code CI-YYYY-NNNN}.
     */
    public String generateRunId(String pipelineName) {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("%s-%d-%04d", pipelineName.toUpperCase(Locale.ROOT), year, count);
    }

    private PipelineRun create(PipelineGraph graph, TriggerContext trigger) {
        var stageOrder = graph.topologicalOrder().stream().map(Stage::name).toList();
        PipelineRun run = new PipelineRun(generateRunId(graph.name()), graph.name(), trigger, stageOrder);
        store.save(run);
        return run;
    }

    private PipelineRun execute(PipelineGraph graph, PipelineRun run) {
        // A downstream run executes inside the upstream's completion event; keep the caller's MDC.
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        MdcContext.setRun(run.runId(), run.pipeline());
        try {
            log.info("Starting {} run {} for {}@{}{}", run.pipeline(), run.runId(), run.refName(), run.commitId(),
                    run.trigger().upstreamRunId() != null ? " (after " + run.trigger().upstreamRunId() + ")" : "");
            eventBus.publish(new PipelineEvent(PipelineEvent.PIPELINE_STARTED, run.runId(), null,
                    runPayload(run), Instant.now()));

            executor.execute(graph, run);

            long ms = Duration.between(run.startedAt(), run.finishedAt()).toMillis();
            if (metrics != null) {
                metrics.recordRunResult(run.pipeline(), run.status().name(), ms);
            }
            log.info("{} run {} completed {} in {} ms", run.pipeline(), run.runId(), run.status(), ms);

            var payload = runPayload(run);
            payload.put(PipelineEvent.KEY_RUN, run);
            eventBus.publish(new PipelineEvent(PipelineEvent.PIPELINE_COMPLETED, run.runId(), null,
                    payload, Instant.now()));
            return run;
        } finally {
            MdcContext.clear();
            if (callerMdc != null) {
                MDC.setContextMap(callerMdc);
            }
        }
    }

    private static Map<String, Object> runPayload(PipelineRun run) {
        var payload = new HashMap<String, Object>();
        payload.put("pipeline", run.pipeline());
        payload.put("refName", run.refName());
        payload.put("commitId", run.commitId());
        payload.put("status", run.status().name());
        if (run.trigger().changeRequest() != null) {
            payload.put("changeRequest", run.trigger().changeRequest());
        }
        if (run.trigger().upstreamRunId() != null) {
            payload.put("upstreamRunId", run.trigger().upstreamRunId());
        }
        return payload;
    }
}
