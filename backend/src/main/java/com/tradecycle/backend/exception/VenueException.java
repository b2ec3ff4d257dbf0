package com.tradecycle.backend.exception;

/**
 * Typed failure of a venue call.
 */
public class VenueException extends TradingException {

    public enum Kind {
        /** Network error, timeout, 5xx or rate limit. Safe to retry. */
        TRANSIENT,
        /** The venue understood the request and refused it. */
        REJECTED,
        /** Bad key, signature or permissions. */
        AUTH,
        /** Malformed response or anything unclassified. */
        UNKNOWN
    }

    private final Kind kind;
    private final Integer venueCode;

    public VenueException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public VenueException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    public VenueException(Kind kind, String message, Integer venueCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.venueCode = venueCode;
    }

    public Kind getKind() {
        return kind;
    }

    public Integer getVenueCode() {
        return venueCode;
    }

    public boolean isRetryable() {
        return kind == Kind.TRANSIENT;
    }

    @Override
    protected String reasonCode() {
        return "venue_" + kind.name().toLowerCase();
    }

    public String describe() {
        String base = kind.name().toLowerCase() + ": " + getMessage();
        return venueCode != null ? base + " (code " + venueCode + ")" : base;
    }
}
