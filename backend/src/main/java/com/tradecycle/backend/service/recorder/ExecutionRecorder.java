package com.tradecycle.backend.service.recorder;

import com.tradecycle.backend.trading.model.CycleRecord;

import java.util.List;
import java.util.Optional;

/**
 * Append-only store of cycle records.
 */
public interface ExecutionRecorder {

    /**
     * Persists the record in one transaction. A second append for the same cycle id fails.
     */
    void append(CycleRecord record);

    Optional<CycleRecord> findById(String cycleId);

    /**
     * Newest first.
     */
    List<CycleRecord> findRecent(int limit);

    /**
     * Latest cycle that reached execution, with or without errors.
     */
    Optional<CycleRecord> findLatestCompleted();
}
