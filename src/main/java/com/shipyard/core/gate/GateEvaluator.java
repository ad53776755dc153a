package com.shipyard.core.gate;

import com.shipyard.core.model.GateDecision;
import com.shipyard.core.model.GatePolicy;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageResult;
import com.shipyard.core.model.StageStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a stage may run, based only on the results of its direct upstream stages.
 * <p>
 * Transitive propagation needs no special handling: a skipped upstream is itself failing,
 * so the skip cascades one edge at a time.
 * <ul>
 *   <li>Any blocking upstream that failed or was skipped: {@code FAIL_PIPELINE}</li>
 *   <li>Otherwise, any advisory upstream that was skipped: {@code SKIP}</li>
 *   <li>Otherwise (successes, or failures of advisory stages): {@code PROCEED}</li>
 * </ul>
 */
@Service
public class GateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GateEvaluator.class);

    /**
     * @param stage           the stage about to run
     * @param upstreamResults results keyed by stage name; must contain every direct upstream
     * @throws IllegalStateException if an upstream has not produced a result yet
     */
    public GateDecision evaluate(Stage stage, Map<String, StageResult> upstreamResults) {
        var blockingFailures = new ArrayList<String>();
        var skippedAdvisory = new ArrayList<String>();

        for (String upstreamName : stage.upstream()) {
            StageResult upstream = upstreamResults.get(upstreamName);
            if (upstream == null) {
                throw new IllegalStateException("Gate for " + stage.name()
                        + " evaluated before upstream " + upstreamName + " completed");
            }
            if (!upstream.isFailing()) continue;

            if (upstream.policy() == GatePolicy.BLOCKING) {
                blockingFailures.add(upstreamName);
            } else if (upstream.status() == StageStatus.SKIPPED) {
                skippedAdvisory.add(upstreamName);
            }
        }

        if (!blockingFailures.isEmpty()) {
            String reason = "blocking upstream did not succeed: " + String.join(", ", blockingFailures);
            log.info("Gate {} -> FAIL_PIPELINE ({})", stage.name(), reason);
            return GateDecision.failPipeline(reason);
        }
        if (!skippedAdvisory.isEmpty()) {
            String reason = "advisory upstream was skipped: " + String.join(", ", skippedAdvisory);
            log.info("Gate {} -> SKIP ({})", stage.name(), reason);
            return GateDecision.skip(reason);
        }
        log.debug("Gate {} -> PROCEED", stage.name());
        return GateDecision.proceed();
    }

    /** Convenience overload for callers holding results as a list. */
    public GateDecision evaluate(Stage stage, List<StageResult> upstreamResults) {
        var byName = new HashMap<String, StageResult>();
        for (var r : upstreamResults) {
            byName.put(r.stageName(), r);
        }
        return evaluate(stage, byName);
    }
}
