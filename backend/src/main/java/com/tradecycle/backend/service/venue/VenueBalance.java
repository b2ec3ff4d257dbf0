package com.tradecycle.backend.service.venue;

import java.math.BigDecimal;

public record VenueBalance(BigDecimal walletBalance, BigDecimal availableBalance, BigDecimal marginUsed, BigDecimal unrealizedPnl) {
}
