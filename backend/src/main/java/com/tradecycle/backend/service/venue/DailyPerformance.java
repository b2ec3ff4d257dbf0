package com.tradecycle.backend.service.venue;

import java.math.BigDecimal;

/**
 * Realized PnL since UTC midnight. Each realized-PnL income entry counts as one trade.
 */
public record DailyPerformance(BigDecimal realizedPnl, int winningTrades, int losingTrades) {

    public static DailyPerformance none() {
        return new DailyPerformance(BigDecimal.ZERO, 0, 0);
    }
}
