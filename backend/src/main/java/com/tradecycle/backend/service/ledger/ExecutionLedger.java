package com.tradecycle.backend.service.ledger;

import com.tradecycle.backend.trading.model.DecisionAction;
import com.tradecycle.backend.trading.model.ExecutionResult;

import java.util.Optional;

/**
 * Durable record of which decision items have been sent to the venue, keyed by
 * {@code cycleId:instrument:action}.
 */
public interface ExecutionLedger {

    static String key(String cycleId, String instrument, DecisionAction action) {
        return cycleId + ":" + instrument + ":" + action.name();
    }

    /**
     * Claims the key. Returns {@code false} when another attempt already claimed it.
     */
    boolean begin(String key, String cycleId, String instrument, DecisionAction action);

    Optional<ExecutionResult> findCompleted(String key);

    void complete(String key, ExecutionResult result);
}
