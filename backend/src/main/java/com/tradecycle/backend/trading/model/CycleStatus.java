package com.tradecycle.backend.trading.model;

public enum CycleStatus {
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    ABORTED,
    SKIPPED
}
