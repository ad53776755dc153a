package com.shipyard.core.trigger;

import com.shipyard.core.collaborator.ChangeRequestHost;
import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.engine.PipelineEngine;
import com.shipyard.core.events.EventBus;
import com.shipyard.core.events.PipelineEvent;
import com.shipyard.core.model.ChangeRequest;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.RunStatus;
import com.shipyard.core.model.TriggerContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.annotation.DependsOn;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CrossPipelineTriggerTest {

    private EventBus eventBus;
    private PipelineEngine engine;
    private ChangeRequestHost changeRequests;
    private CrossPipelineTrigger trigger;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        engine = mock(PipelineEngine.class);
        changeRequests = mock(ChangeRequestHost.class);
        trigger = new CrossPipelineTrigger(eventBus, engine, changeRequests, null, "ci", "cd");
        trigger.subscribe();
    }

    private static PipelineRun completed(String pipeline, RunStatus status, TriggerContext context) {
        var run = new PipelineRun("CI-2026-0007", pipeline, context, List.of());
        run.complete(status);
        return run;
    }

    private void publishCompleted(PipelineRun run) {
        eventBus.publish(new PipelineEvent(PipelineEvent.PIPELINE_COMPLETED, run.runId(), null,
                Map.of(PipelineEvent.KEY_RUN, run), Instant.now()));
    }

    @Test
    @DisplayName("a successful upstream run starts the downstream with the same ref and commit")
    void startsDownstream() {
        publishCompleted(completed("ci", RunStatus.SUCCESS,
                TriggerContext.commit("2/merge", "abc123").withChangeRequest(2)));

        var captor = ArgumentCaptor.forClass(TriggerContext.class);
        verify(engine).run(eq("cd"), captor.capture());
        TriggerContext downstream = captor.getValue();
        assertEquals("2/merge", downstream.refName());
        assertEquals("abc123", downstream.commitId());
        assertEquals(2, downstream.changeRequest());
        assertEquals("CI-2026-0007", downstream.upstreamRunId());
        verifyNoInteractions(changeRequests);
    }

    @Test
    @DisplayName("a failed upstream run never starts the downstream")
    void failedUpstream() {
        publishCompleted(completed("ci", RunStatus.FAILED, TriggerContext.commit("main", "abc123")));

        verify(engine, never()).run(anyString(), any());
    }

    @Test
    @DisplayName("downstream completions do not loop")
    void ignoresDownstreamCompletion() {
        publishCompleted(completed("cd", RunStatus.SUCCESS, TriggerContext.commit("main", "abc123")));

        verify(engine, never()).run(anyString(), any());
    }

    @Test
    @DisplayName("disabled trigger starts nothing")
    void disabled() {
        trigger.setEnabled(false);

        publishCompleted(completed("ci", RunStatus.SUCCESS, TriggerContext.commit("main", "abc123")));

        verify(engine, never()).run(anyString(), any());
        assertFalse(trigger.isEnabled());
    }

    @Test
    @DisplayName("looks up the change request by head commit when the trigger has none")
    void resolvesChangeRequest() {
        when(changeRequests.findOpenByHeadCommit("abc123"))
                .thenReturn(Optional.of(new ChangeRequest(9, "abc123", null)));

        publishCompleted(completed("ci", RunStatus.SUCCESS, TriggerContext.commit("feature/x", "abc123")));

        var captor = ArgumentCaptor.forClass(TriggerContext.class);
        verify(engine).run(eq("cd"), captor.capture());
        assertEquals(9, captor.getValue().changeRequest());
    }

    @Test
    @DisplayName("a failed lookup still starts the downstream")
    void lookupFailureTolerated() {
        when(changeRequests.findOpenByHeadCommit(anyString())).thenThrow(new CollaboratorException("rate limited"));

        publishCompleted(completed("ci", RunStatus.SUCCESS, TriggerContext.commit("main", "abc123")));

        var captor = ArgumentCaptor.forClass(TriggerContext.class);
        verify(engine).run(eq("cd"), captor.capture());
        assertNull(captor.getValue().changeRequest());
    }

    @Test
    void rejectsSelfTrigger() {
        assertThrows(IllegalArgumentException.class,
                () -> new CrossPipelineTrigger(eventBus, engine, changeRequests, null, "ci", "ci"));
    }

    @Test
    @DisplayName("subscribes after the report dispatcher so the upstream comment is posted first")
    void ordersAfterReportDispatcher() {
        DependsOn dependsOn = CrossPipelineTrigger.class.getAnnotation(DependsOn.class);

        assertNotNull(dependsOn);
        assertArrayEquals(new String[]{"reportDispatcher"}, dependsOn.value());
    }
}
