package com.tradecycle.backend.trading.model;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Append-only audit entry for one cycle run.
 */
@Builder(toBuilder = true)
public record CycleRecord(
        String cycleId,
        Instant startedAt,
        Instant finishedAt,
        CycleStatus status,
        MarketSnapshot snapshot,
        Decision decision,
        List<RiskVerdict> verdicts,
        List<ExecutionResult> executions,
        List<String> errors,
        String abortReason
) {
    public CycleRecord {
        verdicts = verdicts == null ? List.of() : List.copyOf(verdicts);
        executions = executions == null ? List.of() : List.copyOf(executions);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static CycleRecord skipped(String cycleId, Instant at, String reason) {
        return CycleRecord.builder()
                .cycleId(cycleId)
                .startedAt(at)
                .finishedAt(at)
                .status(CycleStatus.SKIPPED)
                .abortReason(reason)
                .build();
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
