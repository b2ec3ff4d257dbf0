package com.tradecycle.backend.service.venue;

import com.tradecycle.backend.trading.model.OrderSide;
import com.tradecycle.backend.trading.model.OrderType;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
public record OrderRequest(
        String instrument,
        OrderSide side,
        OrderType type,
        BigDecimal quantity,
        BigDecimal stopPrice,
        boolean reduceOnly,
        String clientOrderId
) {
}
