package com.tradecycle.backend.exception;

/**
 * Account, position or order state could not be loaded. The cycle cannot continue without it.
 */
public class SnapshotAggregationException extends TradingException {
    public SnapshotAggregationException(String message) {
        super(message);
    }

    public SnapshotAggregationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String reasonCode() {
        return "data_integrity";
    }
}
