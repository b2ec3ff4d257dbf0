package com.tradecycle.backend.trading.model;

import java.util.Locale;

public enum DecisionAction {
    OPEN_LONG,
    OPEN_SHORT,
    CLOSE,
    HOLD;

    public boolean isOpen() {
        return this == OPEN_LONG || this == OPEN_SHORT;
    }

    public PositionSide positionSide() {
        return switch (this) {
            case OPEN_LONG -> PositionSide.LONG;
            case OPEN_SHORT -> PositionSide.SHORT;
            default -> throw new IllegalStateException("No position side for " + this);
        };
    }

    /**
     * Accepts the wire spellings used by the decision service ("open_long", "buy", ...).
     */
    public static DecisionAction fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "OPEN_LONG", "LONG", "BUY" -> OPEN_LONG;
            case "OPEN_SHORT", "SHORT", "SELL" -> OPEN_SHORT;
            case "CLOSE", "CLOSE_POSITION", "EXIT" -> CLOSE;
            case "HOLD", "WAIT", "NONE" -> HOLD;
            default -> throw new IllegalArgumentException("Unknown action: " + value);
        };
    }
}
