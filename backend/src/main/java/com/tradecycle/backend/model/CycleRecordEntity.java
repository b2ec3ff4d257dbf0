package com.tradecycle.backend.model;

import com.tradecycle.backend.trading.model.CycleStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "cycle_records", indexes = {
        @Index(name = "idx_cycle_records_started_at", columnList = "started_at"),
        @Index(name = "idx_cycle_records_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleRecordEntity {

    @Id
    @Column(name = "cycle_id", length = 64)
    private String cycleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private CycleStatus status;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "item_count")
    private Integer itemCount;

    @Column(name = "execution_count")
    private Integer executionCount;

    @Column(name = "failed_execution_count")
    private Integer failedExecutionCount;

    @Column(name = "abort_reason", length = 1000)
    private String abortReason;

    @Column(name = "strategy_for_next_cycle", columnDefinition = "TEXT")
    private String strategyForNextCycle;

    @Column(name = "snapshot_json", columnDefinition = "TEXT")
    private String snapshotJson;

    @Column(name = "decision_json", columnDefinition = "TEXT")
    private String decisionJson;

    @Column(name = "verdicts_json", columnDefinition = "TEXT")
    private String verdictsJson;

    @Column(name = "executions_json", columnDefinition = "TEXT")
    private String executionsJson;

    @Column(name = "errors_json", columnDefinition = "TEXT")
    private String errorsJson;

    @Version
    private Long version;
}
