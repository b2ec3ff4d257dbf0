package com.tradecycle.backend.service.decision;

import com.tradecycle.backend.trading.model.MarketSnapshot;

import java.util.Map;

/**
 * @param previousStrategy notes the previous completed cycle left for this one, or {@code null}
 */
public record DecisionRequest(
        String cycleId,
        MarketSnapshot snapshot,
        Map<String, Object> riskLimits,
        String previousStrategy
) {
    public DecisionRequest {
        riskLimits = riskLimits == null ? Map.of() : Map.copyOf(riskLimits);
    }
}
