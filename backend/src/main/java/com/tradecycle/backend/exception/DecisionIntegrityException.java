package com.tradecycle.backend.exception;

/**
 * The decision payload does not match the expected schema.
 */
public class DecisionIntegrityException extends TradingException {
    public DecisionIntegrityException(String message) {
        super(message);
    }

    public DecisionIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String reasonCode() {
        return "decision_malformed";
    }
}
