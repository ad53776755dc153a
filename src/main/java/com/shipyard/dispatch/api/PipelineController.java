package com.shipyard.dispatch.api;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.engine.PipelineEngine;
import com.shipyard.core.engine.PipelineRunStore;
import com.shipyard.core.model.PipelineRun;
import com.shipyard.core.model.TriggerContext;
import com.shipyard.core.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for commit events and run status.
 */
@RestController
@RequestMapping("/api/v1/pipelines")
public class PipelineController {

    private static final Logger log = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineEngine engine;
    private final PipelineRunStore store;
    private final Reporter reporter;
    private final ShipyardProperties properties;

    public PipelineController(PipelineEngine engine, PipelineRunStore store, Reporter reporter,
                              ShipyardProperties properties) {
        this.engine = engine;
        this.store = store;
        this.reporter = reporter;
        this.properties = properties;
    }

    /**
     * POST /api/v1/pipelines — Accept a commit event and start the upstream pipeline. Runs asynchronously.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody PipelineRequest request) {
        if (request == null || request.commit() == null || request.commit().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "commit is required"));
        }
        if (request.changeRequest() != null && request.changeRequest() <= 0) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "change_request must be positive: " + request.changeRequest()));
        }

        var trigger = TriggerContext.commit(request.ref(), request.commit())
                .withChangeRequest(request.changeRequest());
        PipelineRun run = engine.launch(properties.getPipeline().getUpstream(), trigger);
        log.info("Accepted commit event {}@{} as run {}", trigger.refName(), trigger.commitId(), run.runId());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "run_id", run.runId(),
                "status", run.status().name()));
    }

    /**
     * GET /api/v1/pipelines — All runs known to this process, newest first.
     */
    @GetMapping
    public List<PipelineResponse> list() {
        return store.list().stream().map(PipelineResponse::from).toList();
    }

    @GetMapping("/{runId}")
    public ResponseEntity<PipelineResponse> get(@PathVariable String runId) {
        return store.find(runId)
                .map(PipelineResponse::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * GET /api/v1/pipelines/{runId}/report — The Markdown report that is (or would be) posted.
     */
    @GetMapping(value = "/{runId}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> report(@PathVariable String runId) {
        return store.find(runId)
                .map(reporter::render)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
