package com.tradecycle.backend.trading.pipeline;

import com.tradecycle.backend.trading.model.DecisionItem;
import com.tradecycle.backend.trading.model.ExecutionContext;
import com.tradecycle.backend.trading.model.ExecutionResult;
import com.tradecycle.backend.trading.model.RiskVerdict;

public interface TradeExecutor {

    /**
     * Sends one decision item to the venue. Failures come back as a failed result, never as an exception.
     */
    ExecutionResult execute(ExecutionContext context, DecisionItem item, RiskVerdict verdict);
}
