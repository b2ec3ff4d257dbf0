package com.tradecycle.backend.trading.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record AccountState(
        BigDecimal walletBalance,
        BigDecimal availableBalance,
        BigDecimal marginUsed,
        BigDecimal unrealizedPnl,
        BigDecimal realizedDailyPnl,
        int winningTrades,
        int losingTrades
) {
    public int tradeCount() {
        return winningTrades + losingTrades;
    }

    public BigDecimal winRatePct() {
        if (tradeCount() == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(winningTrades * 100L)
                .divide(BigDecimal.valueOf(tradeCount()), 2, RoundingMode.HALF_UP);
    }
}
