package com.shipyard.core.metrics;

import com.shipyard.core.model.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunResult(String pipeline, String status, long ms) {
        Counter.builder("shipyard.runs.total")
                .tag("pipeline", pipeline)
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("shipyard.run.duration")
                .tag("pipeline", pipeline)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStageExecution(String kind, String status, long ms) {
        Timer.builder("shipyard.stage.duration")
                .tag("kind", kind)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateDecision(String outcome) {
        Counter.builder("shipyard.gate.decisions")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records a deployment check outcome.
     *
     * @param passed      whether the check passed
     * @param failureKind failure classification, {@code null} when passed
     */
    public void recordDeploymentCheck(boolean passed, FailureKind failureKind) {
        Counter.builder("shipyard.deployment.checks")
                .tag("result", passed ? "pass" : "fail")
                .tag("kind", failureKind != null ? failureKind.name() : "NONE")
                .register(registry)
                .increment();
    }

    public void recordReport(boolean posted) {
        Counter.builder("shipyard.reports")
                .tag("result", posted ? "posted" : "skipped")
                .register(registry)
                .increment();
    }

    public void recordDownstreamTrigger(String pipeline) {
        Counter.builder("shipyard.triggers.total")
                .tag("pipeline", pipeline)
                .register(registry)
                .increment();
    }
}
