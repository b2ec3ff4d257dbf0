package com.tradecycle.backend.trading.model;

import java.util.Locale;

public enum OrderStatus {
    PENDING,
    FILLED,
    PARTIALLY_FILLED,
    CANCELED,
    REJECTED;

    public boolean isLive() {
        return this == PENDING || this == PARTIALLY_FILLED;
    }

    public boolean isDead() {
        return this == CANCELED || this == REJECTED;
    }

    public static OrderStatus fromVenue(String status) {
        if (status == null) {
            return PENDING;
        }
        return switch (status.trim().toUpperCase(Locale.ROOT)) {
            case "FILLED" -> FILLED;
            case "PARTIALLY_FILLED" -> PARTIALLY_FILLED;
            case "CANCELED", "CANCELLED", "EXPIRED", "EXPIRED_IN_MATCH" -> CANCELED;
            case "REJECTED" -> REJECTED;
            default -> PENDING;
        };
    }
}
