package com.shipyard.core.engine;

import com.shipyard.core.events.EventBus;
import com.shipyard.core.events.PipelineEvent;
import com.shipyard.core.gate.GateEvaluator;
import com.shipyard.core.graph.PipelineGraph;
import com.shipyard.core.metrics.PipelineMetrics;
import com.shipyard.core.model.GatePolicy;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.RunStatus;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;
import com.shipyard.core.model.TriggerContext;
import com.shipyard.core.scheduler.StageScheduler;
import com.shipyard.core.stage.StageHandler;
import com.shipyard.core.stage.StageRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class PipelineEngineTest {

    private final EventBus eventBus = new EventBus();
    private final PipelineRunStore store = new PipelineRunStore();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<Runnable> deferred = new ArrayList<>();
    private PipelineEngine engine;

    @BeforeEach
    void setUp() {
        StageHandler handler = mock(StageHandler.class);
        when(handler.kind()).thenReturn(StageKind.TEST);
        when(handler.handle(any(), any())).thenAnswer(inv ->
                StageResult.success(inv.getArgument(0), "ok", Map.of(), Instant.now()));

        PipelineDefinitions definitions = mock(PipelineDefinitions.class);
        when(definitions.graph("ci")).thenReturn(PipelineGraph.of("ci", List.of(
                new Stage("lint", List.of(), StageKind.TEST, GatePolicy.BLOCKING))));
        when(definitions.graph("nope")).thenThrow(new IllegalArgumentException("Unknown pipeline 'nope'"));

        var metrics = new PipelineMetrics(registry);
        var executor = new PipelineExecutor(new GateEvaluator(), new StageRunner(List.of(handler)),
                new StageScheduler(), eventBus, metrics, 2);
        Executor capture = deferred::add;
        engine = new PipelineEngine(definitions, executor, store, eventBus, metrics, capture);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void runCompletesSynchronouslyAndPublishesLifecycle() {
        List<PipelineEvent> events = new ArrayList<>();
        eventBus.on(PipelineEvent.PIPELINE_STARTED, events::add);
        eventBus.on(PipelineEvent.PIPELINE_COMPLETED, events::add);

        PipelineRun run = engine.run("ci", TriggerContext.commit("main", "abc"));

        assertEquals(RunStatus.SUCCESS, run.status());
        assertSame(run, store.find(run.runId()).orElseThrow());
        assertEquals(PipelineEvent.PIPELINE_STARTED, events.get(0).eventType());
        PipelineEvent last = events.get(events.size() - 1);
        assertEquals(PipelineEvent.PIPELINE_COMPLETED, last.eventType());
        assertSame(run, last.payload().get(PipelineEvent.KEY_RUN));
        assertEquals("SUCCESS", last.payload().get("status"));
        assertEquals(1.0, registry.get("shipyard.runs.total").tag("pipeline", "ci").counter().count());
    }

    @Test
    void launchReturnsPendingRunThenExecutes() {
        PipelineRun run = engine.launch("ci", TriggerContext.commit("main", "abc"));

        assertEquals(RunStatus.PENDING, run.status());
        assertTrue(store.find(run.runId()).isPresent());

        deferred.forEach(Runnable::run);
        assertEquals(RunStatus.SUCCESS, run.status());
    }

    @Test
    void unknownPipelineRejectedBeforeAnythingIsStored() {
        assertThrows(IllegalArgumentException.class, () -> engine.run("nope", TriggerContext.commit("main", "abc")));
        assertTrue(store.list().isEmpty());
    }

    @Test
    void runIdsAreSequentialPerProcess() {
        String first = engine.generateRunId("ci");
        String second = engine.generateRunId("cd");

        assertTrue(first.matches("CI-\\d{4}-\\d{4}"), first);
        assertTrue(second.startsWith("CD-"));
        assertEquals(Integer.parseInt(first.substring(first.length() - 4)) + 1,
                Integer.parseInt(second.substring(second.length() - 4)));
    }

    @Test
    void callerMdcRestoredAfterRun() {
        MDC.put("runId", "OUTER");

        engine.run("ci", TriggerContext.commit("main", "abc"));

        assertEquals("OUTER", MDC.get("runId"));
    }

    @Test
    void shutdownStopsOwnedLaunchPool() throws InterruptedException {
        ExecutorService pool = mock(ExecutorService.class);
        when(pool.awaitTermination(anyLong(), any())).thenReturn(true);
        var owning = new PipelineEngine(mock(PipelineDefinitions.class), mock(PipelineExecutor.class), store,
                eventBus, null, pool, true);

        owning.shutdown();

        verify(pool).shutdown();
        verify(pool, never()).shutdownNow();
    }

    @Test
    void shutdownInterruptsRunsThatOutlastTheGracePeriod() throws InterruptedException {
        ExecutorService pool = mock(ExecutorService.class);
        when(pool.awaitTermination(anyLong(), any())).thenReturn(false);
        var owning = new PipelineEngine(mock(PipelineDefinitions.class), mock(PipelineExecutor.class), store,
                eventBus, null, pool, true);

        owning.shutdown();

        verify(pool).shutdownNow();
    }

    @Test
    void shutdownLeavesInjectedExecutorAlone() {
        ExecutorService pool = mock(ExecutorService.class);
        var borrowing = new PipelineEngine(mock(PipelineDefinitions.class), mock(PipelineExecutor.class), store,
                eventBus, null, pool);

        borrowing.shutdown();

        verifyNoInteractions(pool);
    }
}
