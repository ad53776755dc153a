package com.shipyard.core.stage;

import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.logging.MdcContext;
import com.shipyard.core.metrics.PipelineMetrics;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Executes one stage by dispatching to the handler registered for its kind.
 * <p>
 * Never throws for a stage failure: collaborator problems and unexpected handler
 * errors both come back as a FAILURE result marked {@link FailureKind#INFRASTRUCTURE}.
 * There are no retries at this layer.
 */
@Service
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final Map<StageKind, StageHandler> handlers = new EnumMap<>(StageKind.class);
    private final PipelineMetrics metrics;

    @Autowired
    public StageRunner(List<StageHandler> handlers, @Autowired(required = false) PipelineMetrics metrics) {
        for (StageHandler handler : handlers) {
            StageHandler previous = this.handlers.put(handler.kind(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for " + handler.kind() + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        this.metrics = metrics;
    }

    public StageRunner(List<StageHandler> handlers) {
        this(handlers, null);
    }

    public StageResult run(Stage stage, StageContext context) {
        MdcContext.setStage(context.runId(), context.pipeline(), stage.name());
        Instant startedAt = Instant.now();
        StageResult result;
        try {
            StageHandler handler = handlers.get(stage.kind());
            if (handler == null) {
                result = StageResult.failure(stage, FailureKind.INFRASTRUCTURE,
                        "No handler registered for stage kind " + stage.kind(), Map.of(), startedAt);
            } else {
                log.info("Running stage {} [{} / {}]", stage.name(), stage.kind(), stage.policy());
                result = handler.handle(stage, context);
            }
        } catch (CollaboratorException e) {
            log.warn("Stage {} hit an infrastructure failure: {}", stage.name(), e.getMessage());
            result = StageResult.failure(stage, FailureKind.INFRASTRUCTURE, e.getMessage(),
                    Map.of("error", e.getClass().getSimpleName()), startedAt);
        } catch (RuntimeException e) {
            log.error("Stage {} failed unexpectedly", stage.name(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            result = StageResult.failure(stage, FailureKind.INFRASTRUCTURE, "Unexpected error: " + message,
                    Map.of("error", e.getClass().getSimpleName()), startedAt);
        } finally {
            MdcContext.clearStage();
        }

        log.info("Stage {} finished {}{} in {}ms", stage.name(), result.status(),
                result.failureKind() != null ? " (" + result.failureKind() + ")" : "", result.durationMs());
        if (metrics != null) {
            metrics.recordStageExecution(stage.kind().name(), result.status().name(), result.durationMs());
        }
        return result;
    }
}
