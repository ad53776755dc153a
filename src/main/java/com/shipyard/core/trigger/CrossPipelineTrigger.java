package com.shipyard.core.trigger;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.collaborator.ChangeRequestHost;
import com.shipyard.core.engine.PipelineEngine;
import com.shipyard.core.events.EventBus;
import com.shipyard.core.events.PipelineEvent;
import com.shipyard.core.metrics.PipelineMetrics;
import com.shipyard.core.model.ChangeRequest;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.RunStatus;
import com.shipyard.core.model.TriggerContext;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Starts the downstream pipeline when an upstream run completes successfully.
 * <p>
 * The downstream run executes on the thread that delivered the completion event
 * and reuses the upstream's ref and commit, so it pulls exactly what was published.
 * It subscribes after {@link com.shipyard.core.report.ReportDispatcher}, so the
 * upstream report is posted before the downstream run starts.
 */
@Component
@DependsOn("reportDispatcher")
public class CrossPipelineTrigger {

    private static final Logger log = LoggerFactory.getLogger(CrossPipelineTrigger.class);

    private final EventBus eventBus;
    private final PipelineEngine engine;
    private final ChangeRequestHost changeRequestHost;
    private final PipelineMetrics metrics;
    private final String upstream;
    private final String downstream;
    private final AtomicBoolean enabled = new AtomicBoolean(true);

    @Autowired
    public CrossPipelineTrigger(EventBus eventBus, PipelineEngine engine, ChangeRequestHost changeRequestHost,
                                ShipyardProperties properties,
                                @Autowired(required = false) PipelineMetrics metrics) {
        this(eventBus, engine, changeRequestHost, metrics,
                properties.getPipeline().getUpstream(), properties.getPipeline().getDownstream());
    }

    public CrossPipelineTrigger(EventBus eventBus, PipelineEngine engine, ChangeRequestHost changeRequestHost,
                                PipelineMetrics metrics, String upstream, String downstream) {
        if (upstream.equals(downstream)) {
            throw new IllegalArgumentException("Upstream and downstream pipelines must differ: " + upstream);
        }
        this.eventBus = eventBus;
        this.engine = engine;
        this.changeRequestHost = changeRequestHost;
        this.metrics = metrics;
        this.upstream = upstream;
        this.downstream = downstream;
    }

    @PostConstruct
    public void subscribe() {
        eventBus.on(PipelineEvent.PIPELINE_COMPLETED, this::onCompleted);
        log.debug("Listening for {} completions to start {}", upstream, downstream);
    }

    /** Used by {@code run --no-deploy}. */
    public void setEnabled(boolean enabled) {
        this.enabled.set(enabled);
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    void onCompleted(PipelineEvent event) {
        if (!(event.payload().get(PipelineEvent.KEY_RUN) instanceof PipelineRun run)) return;
        if (!upstream.equals(run.pipeline()) || downstream.equals(run.pipeline())) return;

        if (run.status() != RunStatus.SUCCESS) {
            log.info("Not starting {}: {} run {} finished {}", downstream, upstream, run.runId(), run.status());
            return;
        }
        if (!enabled.get()) {
            log.info("Downstream trigger disabled; {} not started for {}", downstream, run.runId());
            return;
        }

        TriggerContext trigger = run.trigger().downstreamOf(run.runId());
        if (trigger.changeRequest() == null) {
            Integer number = resolveChangeRequest(run.commitId()).map(ChangeRequest::number).orElse(null);
            trigger = trigger.withChangeRequest(number);
        }

        log.info("{} run {} succeeded; starting {} for {}@{}", upstream, run.runId(), downstream,
                run.refName(), run.commitId());
        if (metrics != null) {
            metrics.recordDownstreamTrigger(downstream);
        }
        engine.run(downstream, trigger);
    }

    private Optional<ChangeRequest> resolveChangeRequest(String commitId) {
        try {
            Optional<ChangeRequest> found = changeRequestHost.findOpenByHeadCommit(commitId);
            if (found.isEmpty()) {
                log.info("No open change request has head commit {}", commitId);
            }
            return found;
        } catch (RuntimeException e) {
            log.warn("Change request lookup for {} failed: {}", commitId, e.getMessage());
            return Optional.empty();
        }
    }
}
