package com.shipyard.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of running one stage within one pipeline run.
 *
 * @param stageName   the stage this result belongs to
 * @param policy      the stage's gate policy, carried so gating and reporting need not look it up
 * @param status      success, failure or skipped
 * @param failureKind why the stage failed; {@code null} unless status is FAILURE
 * @param message     short human-readable detail (nullable)
 * @param payload     structured output such as coverage, findings or produced tags
 * @param startedAt   when the side effect started (equals finishedAt for skipped stages)
 * @param finishedAt  when the side effect completed
 */
public record StageResult(
    String stageName,
    GatePolicy policy,
    StageStatus status,
    FailureKind failureKind,
    String message,
    Map<String, Object> payload,
    Instant startedAt,
    Instant finishedAt
) implements Serializable {

    public StageResult {
        payload = payload != null ? Map.copyOf(payload) : Map.of();
    }

    public static StageResult success(Stage stage, String message, Map<String, Object> payload,
                                      Instant startedAt) {
        return new StageResult(stage.name(), stage.policy(), StageStatus.SUCCESS, null,
                message, payload, startedAt, Instant.now());
    }

    public static StageResult failure(Stage stage, FailureKind kind, String message,
                                      Map<String, Object> payload, Instant startedAt) {
        return new StageResult(stage.name(), stage.policy(), StageStatus.FAILURE, kind,
                message, payload, startedAt, Instant.now());
    }

    public static StageResult skipped(Stage stage, String reason) {
        Instant now = Instant.now();
        return new StageResult(stage.name(), stage.policy(), StageStatus.SKIPPED, null,
                reason, Map.of(), now, now);
    }

    /** Failing for gating purposes: anything other than SUCCESS. */
    public boolean isFailing() {
        return status != StageStatus.SUCCESS;
    }

    public boolean isInfrastructureFailure() {
        return status == StageStatus.FAILURE && failureKind == FailureKind.INFRASTRUCTURE;
    }

    public long durationMs() {
        if (startedAt == null || finishedAt == null) return 0;
        return finishedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
