package com.tradecycle.backend.trading.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

@Builder(toBuilder = true)
public record PositionRecord(
        String instrument,
        PositionSide side,
        BigDecimal quantity,
        BigDecimal entryPrice,
        BigDecimal markPrice,
        int leverage,
        BigDecimal unrealizedPnl,
        List<String> stopLossOrderIds,
        List<String> takeProfitOrderIds,
        boolean tradable
) {
    public PositionRecord {
        stopLossOrderIds = stopLossOrderIds == null ? List.of() : List.copyOf(stopLossOrderIds);
        takeProfitOrderIds = takeProfitOrderIds == null ? List.of() : List.copyOf(takeProfitOrderIds);
    }

    public boolean protectedByStopAndTarget() {
        return !stopLossOrderIds.isEmpty() && !takeProfitOrderIds.isEmpty();
    }
}
