package com.tradecycle.backend.repository;

import com.tradecycle.backend.model.ExecutionLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ExecutionLedgerRepository extends JpaRepository<ExecutionLedgerEntry, Long> {
    Optional<ExecutionLedgerEntry> findByExecutionKey(String executionKey);

    List<ExecutionLedgerEntry> findByCycleIdOrderByIdAsc(String cycleId);
}
