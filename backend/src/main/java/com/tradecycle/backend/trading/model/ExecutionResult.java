package com.tradecycle.backend.trading.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

@Builder(toBuilder = true)
public record ExecutionResult(
        String instrument,
        DecisionAction action,
        Status status,
        String entryOrderId,
        String stopLossOrderId,
        String takeProfitOrderId,
        String closeOrderId,
        BigDecimal executedQuantity,
        List<OrderRecord> orders,
        String failureReason,
        List<String> warnings,
        boolean replayed
) {
    public enum Status {
        SUCCESS,
        FAILED
    }

    public ExecutionResult {
        orders = orders == null ? List.of() : List.copyOf(orders);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ExecutionResult failed(String instrument, DecisionAction action, String reason) {
        return ExecutionResult.builder()
                .instrument(instrument)
                .action(action)
                .status(Status.FAILED)
                .failureReason(reason)
                .build();
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}
