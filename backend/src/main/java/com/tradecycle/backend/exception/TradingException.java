package com.tradecycle.backend.exception;

/**
 * Base of the engine's failures. Each subtype carries the short reason code recorded when it
 * aborts a cycle or fails an execution.
 */
public abstract class TradingException extends RuntimeException {

    protected TradingException(String message) {
        super(message);
    }

    protected TradingException(String message, Throwable cause) {
        super(message, cause);
    }

    protected abstract String reasonCode();

    public String toReason() {
        return reasonCode() + ": " + getMessage();
    }
}
