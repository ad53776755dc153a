package com.shipyard.core.stage;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.collaborator.CommandResult;
import com.shipyard.core.collaborator.CommandRunner;
import com.shipyard.core.gate.ThresholdCheck;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the coverage reporter and compares the total percentage with the configured threshold.
 */
@Component
public class CoverageStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(CoverageStageHandler.class);

    /** coverage.py report footer: "TOTAL    120     10    92%" */
    private static final Pattern TOTAL_ROW = Pattern.compile("(?m)^TOTAL\\b.*?(\\d+(?:\\.\\d+)?)%\\s*$");
    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private final CommandRunner commandRunner;
    private final List<String> command;
    private final double threshold;
    private final Path workDir;
    private final Duration timeout;

    @Autowired
    public CoverageStageHandler(CommandRunner commandRunner, ShipyardProperties properties) {
        this(commandRunner, properties.getCi().getCoverageCommand(), properties.getCoverageThreshold(),
                Path.of(properties.getCi().getWorkspace()), properties.getCommandTimeout());
    }

    CoverageStageHandler(CommandRunner commandRunner, List<String> command, double threshold,
                         Path workDir, Duration timeout) {
        this.commandRunner = commandRunner;
        this.command = List.copyOf(command);
        this.threshold = threshold;
        this.workDir = workDir;
        this.timeout = timeout;
    }

    @Override
    public StageKind kind() {
        return StageKind.COVERAGE_CHECK;
    }

    @Override
    public StageResult handle(Stage stage, StageContext context) {
        Instant startedAt = Instant.now();
        CommandResult result = commandRunner.run(command, workDir, Map.of(), timeout);

        var payload = new HashMap<String, Object>();
        payload.put("threshold", threshold);
        payload.put("exitCode", result.exitCode());

        if (!result.succeeded()) {
            return StageResult.failure(stage, FailureKind.ASSERTION,
                    "coverage reporter exited with status " + result.exitCode(), payload, startedAt);
        }

        OptionalDouble measured = parsePercentage(result.output());
        if (measured.isEmpty()) {
            log.warn("No coverage percentage found in output for stage {}", stage.name());
            payload.put("output", result.outputTail(500));
            return StageResult.failure(stage, FailureKind.ASSERTION,
                    "no coverage percentage in reporter output", payload, startedAt);
        }

        double coverage = measured.getAsDouble();
        payload.put("coverage", coverage);
        String detail = String.format("coverage %.2f%% (threshold %.2f%%)", coverage, threshold);
        if (ThresholdCheck.passes(coverage, threshold)) {
            log.info("Coverage gate passed: {}", detail);
            return StageResult.success(stage, detail, payload, startedAt);
        }
        log.info("Coverage gate failed: {}", detail);
        return StageResult.failure(stage, FailureKind.ASSERTION, detail, payload, startedAt);
    }

    /**
     * Reads the total percentage: the TOTAL row of a coverage table if present,
     * otherwise the last number in the output (e.g. {@code coverage report --format=total}).
     */
    static OptionalDouble parsePercentage(String output) {
        if (output == null || output.isBlank()) {
            return OptionalDouble.empty();
        }
        Matcher total = TOTAL_ROW.matcher(output);
        if (total.find()) {
            return OptionalDouble.of(Double.parseDouble(total.group(1)));
        }
        Matcher number = NUMBER.matcher(output);
        String last = null;
        while (number.find()) {
            last = number.group(1);
        }
        return last != null ? OptionalDouble.of(Double.parseDouble(last)) : OptionalDouble.empty();
    }
}
