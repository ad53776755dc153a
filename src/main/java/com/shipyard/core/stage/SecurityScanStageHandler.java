package com.shipyard.core.stage;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.collaborator.VulnerabilityScanner;
import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.Finding;
import com.shipyard.core.model.GatePolicy;
import com.shipyard.core.model.Severity;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scans the artifact published earlier in the run.
 * <p>
 * The stage's policy selects the mode. An advisory scan always succeeds and
 * records the full report. A blocking scan fails when any finding is at or
 * above the configured severity threshold.
 */
@Component
public class SecurityScanStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(SecurityScanStageHandler.class);

    private static final int MAX_FINDINGS_IN_PAYLOAD = 50;

    private final VulnerabilityScanner scanner;
    private final Severity threshold;

    @Autowired
    public SecurityScanStageHandler(VulnerabilityScanner scanner, ShipyardProperties properties) {
        this(scanner, properties.getScanSeverityThreshold());
    }

    SecurityScanStageHandler(VulnerabilityScanner scanner, Severity threshold) {
        this.scanner = scanner;
        this.threshold = threshold;
    }

    @Override
    public StageKind kind() {
        return StageKind.SECURITY_SCAN;
    }

    @Override
    public StageResult handle(Stage stage, StageContext context) {
        Instant startedAt = Instant.now();
        ArtifactTag target = context.immutableTag()
                .orElseThrow(() -> new CollaboratorException(
                        "No published artifact for commit " + context.trigger().commitId() + " to scan"));

        List<Finding> findings = scanner.scan(target);
        Map<Severity, Integer> histogram = histogram(findings);
        List<Finding> blocking = findings.stream()
                .filter(f -> f.severity().isAtLeast(threshold))
                .toList();

        var payload = new HashMap<String, Object>();
        payload.put("target", target.reference());
        payload.put("mode", stage.policy().name().toLowerCase(Locale.ROOT));
        payload.put("severityThreshold", threshold.name());
        payload.put("severities", severityCounts(histogram));
        payload.put("findingCount", findings.size());
        payload.put("blockingCount", blocking.size());

        if (stage.policy() == GatePolicy.ADVISORY) {
            payload.put("findings", findings.stream().limit(MAX_FINDINGS_IN_PAYLOAD).toList());
            log.info("Advisory scan of {}: {} findings {}", target, findings.size(), histogram);
            return StageResult.success(stage, findings.size() + " findings reported", payload, startedAt);
        }

        payload.put("findings", blocking.stream().limit(MAX_FINDINGS_IN_PAYLOAD).toList());
        if (blocking.isEmpty()) {
            log.info("Blocking scan of {} passed: nothing at or above {}", target, threshold);
            return StageResult.success(stage, "no findings at or above " + threshold, payload, startedAt);
        }
        log.info("Blocking scan of {} failed: {} findings at or above {}", target, blocking.size(), threshold);
        return StageResult.failure(stage, FailureKind.ASSERTION,
                blocking.size() + " findings at or above " + threshold, payload, startedAt);
    }

    private static Map<Severity, Integer> histogram(List<Finding> findings) {
        var counts = new EnumMap<Severity, Integer>(Severity.class);
        for (Finding f : findings) {
            counts.merge(f.severity(), 1, Integer::sum);
        }
        return counts;
    }

    /** Most severe first, every level present so reports line up. */
    private static Map<String, Integer> severityCounts(Map<Severity, Integer> histogram) {
        var ordered = new LinkedHashMap<String, Integer>();
        Severity[] levels = Severity.values();
        for (int i = levels.length - 1; i >= 0; i--) {
            ordered.put(levels[i].name(), histogram.getOrDefault(levels[i], 0));
        }
        return ordered;
    }
}
