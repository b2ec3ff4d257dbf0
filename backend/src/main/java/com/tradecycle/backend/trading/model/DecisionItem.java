package com.tradecycle.backend.trading.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * One proposed action. Quantity is in base-asset units; notional is quantity times price.
 */
@Builder(toBuilder = true)
public record DecisionItem(
        String instrument,
        DecisionAction action,
        BigDecimal quantity,
        Integer leverage,
        BigDecimal stopLoss,
        BigDecimal takeProfit,
        double confidence,
        String rationale
) {
}
