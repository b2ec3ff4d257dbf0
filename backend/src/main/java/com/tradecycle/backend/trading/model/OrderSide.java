package com.tradecycle.backend.trading.model;

public enum OrderSide {
    BUY,
    SELL
}
