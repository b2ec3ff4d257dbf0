package com.tradecycle.backend.trading.model;

public enum PositionSide {
    LONG,
    SHORT;

    public OrderSide entrySide() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    public OrderSide closingSide() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }
}
