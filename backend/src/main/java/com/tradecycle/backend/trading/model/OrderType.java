package com.tradecycle.backend.trading.model;

public enum OrderType {
    MARKET,
    LIMIT,
    STOP_MARKET,
    TAKE_PROFIT_MARKET;

    public boolean isProtective() {
        return this == STOP_MARKET || this == TAKE_PROFIT_MARKET;
    }
}
