package com.tradecycle.backend.trading.model;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable copy of the risk configuration, taken once at cycle start.
 */
public record RiskLimits(
        BigDecimal maxPositionSizeUsd,
        int maxLeverage,
        BigDecimal riskPerTradePct,
        int maxOpenPositions,
        double minConfidence,
        BigDecimal minNotionalUsd,
        int quantityScale
) {
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("max_position_size_usd", maxPositionSizeUsd);
        summary.put("max_leverage", maxLeverage);
        summary.put("risk_per_trade_pct", riskPerTradePct);
        summary.put("max_open_positions", maxOpenPositions);
        summary.put("min_confidence", minConfidence);
        summary.put("min_notional_usd", minNotionalUsd);
        return summary;
    }
}
