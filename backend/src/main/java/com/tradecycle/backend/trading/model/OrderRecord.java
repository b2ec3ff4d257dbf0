package com.tradecycle.backend.trading.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Mirror of a venue order. Never authoritative on its own; reloaded from the venue every cycle.
 */
@Builder(toBuilder = true)
public record OrderRecord(
        String orderId,
        String clientOrderId,
        String instrument,
        OrderSide side,
        OrderType type,
        BigDecimal quantity,
        BigDecimal executedQuantity,
        BigDecimal price,
        BigDecimal stopPrice,
        BigDecimal averagePrice,
        boolean reduceOnly,
        OrderStatus status
) {
    public BigDecimal filledOrRequested() {
        if (executedQuantity != null && executedQuantity.signum() > 0) {
            return executedQuantity;
        }
        return quantity;
    }
}
