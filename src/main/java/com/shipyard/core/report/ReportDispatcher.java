package com.shipyard.core.report;

import com.shipyard.core.collaborator.ChangeRequestHost;
import com.shipyard.core.events.EventBus;
import com.shipyard.core.events.PipelineEvent;
import com.shipyard.core.metrics.PipelineMetrics;
import com.shipyard.core.model.ChangeRequest;
import com.shipyard.core.model.PipelineRun;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Posts one comment per completed run to the change request it belongs to.
 * Runs without a change request are not reported. Posting failures are logged only.
 */
@Component
public class ReportDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ReportDispatcher.class);
    private static final int RECENT_RUNS_TRACKED = 1024;

    private final EventBus eventBus;
    private final Reporter reporter;
    private final ChangeRequestHost changeRequestHost;
    private final PipelineMetrics metrics;
    /** Recently reported run ids, oldest evicted first. */
    private final Set<String> reported;

    @Autowired
    public ReportDispatcher(EventBus eventBus, Reporter reporter, ChangeRequestHost changeRequestHost,
                            @Autowired(required = false) PipelineMetrics metrics) {
        this(eventBus, reporter, changeRequestHost, metrics, RECENT_RUNS_TRACKED);
    }

    ReportDispatcher(EventBus eventBus, Reporter reporter, ChangeRequestHost changeRequestHost,
                     PipelineMetrics metrics, int recentRunsTracked) {
        this.eventBus = eventBus;
        this.reporter = reporter;
        this.changeRequestHost = changeRequestHost;
        this.metrics = metrics;
        this.reported = Collections.synchronizedSet(Collections.newSetFromMap(
                new LinkedHashMap<String, Boolean>(16, 0.75f, false) {
                    @Override
                    protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                        return size() > recentRunsTracked;
                    }
                }));
    }

    @PostConstruct
    public void subscribe() {
        eventBus.on(PipelineEvent.PIPELINE_COMPLETED, this::onCompleted);
    }

    void onCompleted(PipelineEvent event) {
        if (event.payload().get(PipelineEvent.KEY_RUN) instanceof PipelineRun run) {
            dispatch(run);
        }
    }

    /**
     * @return whether a comment was posted
     */
    public boolean dispatch(PipelineRun run) {
        if (!reported.add(run.runId())) {
            log.debug("Run {} already reported", run.runId());
            return false;
        }
        Optional<Integer> target = changeRequestFor(run);
        if (target.isEmpty()) {
            log.info("Run {} has no change request; not reporting", run.runId());
            recordReport(false);
            return false;
        }
        try {
            changeRequestHost.postComment(target.get(), reporter.render(run));
            log.info("Reported run {} ({}) on change request #{}", run.runId(), run.status(), target.get());
            recordReport(true);
            return true;
        } catch (RuntimeException e) {
            log.warn("Could not post report for run {} to #{}: {}", run.runId(), target.get(), e.getMessage());
            recordReport(false);
            return false;
        }
    }

    private Optional<Integer> changeRequestFor(PipelineRun run) {
        if (run.trigger().changeRequest() != null) {
            return Optional.of(run.trigger().changeRequest());
        }
        try {
            return changeRequestHost.findOpenByHeadCommit(run.commitId()).map(ChangeRequest::number);
        } catch (RuntimeException e) {
            log.warn("Change request lookup for {} failed: {}", run.commitId(), e.getMessage());
            return Optional.empty();
        }
    }

    private void recordReport(boolean posted) {
        if (metrics != null) {
            metrics.recordReport(posted);
        }
    }
}
