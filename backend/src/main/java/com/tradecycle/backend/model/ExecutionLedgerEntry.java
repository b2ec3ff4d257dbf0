package com.tradecycle.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "execution_ledger", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"execution_key"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "execution_key", nullable = false, length = 160)
    private String executionKey;

    @Column(name = "cycle_id", nullable = false, length = 64)
    private String cycleId;

    @Column(nullable = false, length = 32)
    private String instrument;

    @Column(nullable = false, length = 16)
    private String action;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private Status status;

    @Column(name = "result_payload", columnDefinition = "TEXT")
    private String resultPayload;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public enum Status {
        IN_PROGRESS,
        COMPLETED
    }
}
