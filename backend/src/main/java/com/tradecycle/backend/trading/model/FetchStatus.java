package com.tradecycle.backend.trading.model;

public record FetchStatus(State state, String reason) {

    public enum State {
        OK,
        FAILED
    }

    private static final FetchStatus OK = new FetchStatus(State.OK, null);

    public static FetchStatus ok() {
        return OK;
    }

    public static FetchStatus failed(String reason) {
        return new FetchStatus(State.FAILED, reason == null ? "unknown" : reason);
    }

    public boolean succeeded() {
        return state == State.OK;
    }
}
