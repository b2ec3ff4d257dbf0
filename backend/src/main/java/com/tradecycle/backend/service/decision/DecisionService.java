package com.tradecycle.backend.service.decision;

import com.tradecycle.backend.trading.model.Decision;

public interface DecisionService {

    /**
     * Asks the external reasoning service for a decision on the snapshot.
     *
     * @throws com.tradecycle.backend.exception.DecisionServiceException when the call fails
     * @throws com.tradecycle.backend.exception.DecisionIntegrityException when the reply is malformed
     */
    Decision propose(DecisionRequest request);
}
