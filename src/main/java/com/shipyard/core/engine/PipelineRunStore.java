package com.shipyard.core.engine;

import com.shipyard.core.model.PipelineRun;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds every run started by this process, for the status API. Nothing is persisted.
 */
@Component
public class PipelineRunStore {

    private final ConcurrentHashMap<String, PipelineRun> runs = new ConcurrentHashMap<>();

    public void save(PipelineRun run) {
        runs.put(run.runId(), run);
    }

    public Optional<PipelineRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /** All known runs, most recently started first. */
    public List<PipelineRun> list() {
        return runs.values().stream()
                .sorted(Comparator.comparing(PipelineRun::startedAt).reversed()
                        .thenComparing(PipelineRun::runId))
                .toList();
    }
}
