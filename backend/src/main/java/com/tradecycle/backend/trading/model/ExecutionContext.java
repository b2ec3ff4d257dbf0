package com.tradecycle.backend.trading.model;

public record ExecutionContext(String cycleId, MarketSnapshot snapshot) {
}
