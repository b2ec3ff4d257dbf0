package com.tradecycle.backend.exception;

/**
 * The decision service could not be reached, failed, or timed out.
 */
public class DecisionServiceException extends TradingException {
    public DecisionServiceException(String message) {
        super(message);
    }

    public DecisionServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String reasonCode() {
        return "decision_failed";
    }
}
