package com.shipyard.core.verify;

import com.shipyard.core.collaborator.ArtifactNotFoundException;
import com.shipyard.core.collaborator.ArtifactRegistry;
import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.collaborator.CommandResult;
import com.shipyard.core.collaborator.ExecutionSandbox;
import com.shipyard.core.metrics.PipelineMetrics;
import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.DeploymentCheck;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.tagging.TagDeriver;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class DeploymentVerifierTest {

    private final TagDeriver tagDeriver = new TagDeriver("ghcr.io", "acme", "adder");
    private final ArtifactTag mutable = tagDeriver.mutableTag("main");
    private final ArtifactTag immutable = tagDeriver.immutableTag("abc123");

    private ArtifactRegistry registry;
    private ExecutionSandbox sandbox;
    private SimpleMeterRegistry meterRegistry;
    private DeploymentVerifier verifier;

    @BeforeEach
    void setUp() {
        registry = mock(ArtifactRegistry.class);
        sandbox = mock(ExecutionSandbox.class);
        meterRegistry = new SimpleMeterRegistry();
        verifier = new DeploymentVerifier(tagDeriver, registry, sandbox, Duration.ofSeconds(10),
                new PipelineMetrics(meterRegistry));
    }

    @Test
    @DisplayName("passes when the artifact prints 5 for inputs 2 and 3")
    void passes() {
        when(sandbox.run(mutable, List.of("2", "3"), Duration.ofSeconds(10))).thenReturn(new CommandResult(0, "5\n"));

        DeploymentCheck check = verifier.verify("main", "abc123");

        assertTrue(check.passed());
        assertEquals(mutable, check.tag());
        verify(registry).pull(mutable);
        verify(registry, never()).pull(immutable);
        assertEquals(1.0, meterRegistry.get("shipyard.deployment.checks").tag("result", "pass").counter().count());
    }

    @Test
    @DisplayName("wrong output is an assertion failure")
    void wrongOutput() {
        when(sandbox.run(any(), any(), any())).thenReturn(new CommandResult(0, "6"));

        DeploymentCheck check = verifier.verify("main", "abc123");

        assertFalse(check.passed());
        assertEquals(FailureKind.ASSERTION, check.failureKind());
        assertEquals("6", check.stdout());
    }

    @Test
    @DisplayName("a non-zero exit fails even with the right output")
    void nonZeroExit() {
        when(sandbox.run(any(), any(), any())).thenReturn(new CommandResult(3, "5"));

        DeploymentCheck check = verifier.verify("main", "abc123");

        assertEquals(FailureKind.ASSERTION, check.failureKind());
        assertEquals(3, check.exitCode());
    }

    @Test
    @DisplayName("falls back to the immutable tag when the mutable one cannot be pulled")
    void fallsBackToImmutable() {
        doThrow(new ArtifactNotFoundException(mutable.reference())).when(registry).pull(mutable);
        when(sandbox.run(eq(immutable), any(), any())).thenReturn(new CommandResult(0, "5"));

        DeploymentCheck check = verifier.verify("main", "abc123");

        assertTrue(check.passed());
        assertEquals(immutable, check.tag());
    }

    @Test
    @DisplayName("both pulls failing is an infrastructure failure and nothing runs")
    void bothPullsFail() {
        doThrow(new CollaboratorException("unauthorized")).when(registry).pull(any());

        DeploymentCheck check = verifier.verify("main", "abc123");

        assertEquals(FailureKind.INFRASTRUCTURE, check.failureKind());
        assertNull(check.tag());
        assertEquals(-1, check.exitCode());
        verifyNoInteractions(sandbox);
    }

    @Test
    @DisplayName("a sandbox that cannot start the artifact is an infrastructure failure")
    void sandboxFailure() {
        when(sandbox.run(any(), any(), any())).thenThrow(new CollaboratorException("timed out"));

        DeploymentCheck check = verifier.verify("main", "abc123");

        assertEquals(FailureKind.INFRASTRUCTURE, check.failureKind());
        assertEquals(mutable, check.tag());
        assertTrue(check.message().contains("timed out"));
    }
}
