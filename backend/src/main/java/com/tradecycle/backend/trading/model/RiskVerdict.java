package com.tradecycle.backend.trading.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public record RiskVerdict(
        DecisionItem item,
        Outcome outcome,
        String reason,
        BigDecimal adjustedQuantity,
        Integer adjustedLeverage
) {
    public enum Outcome {
        APPROVED,
        REJECTED,
        CLAMPED
    }

    public static RiskVerdict approved(DecisionItem item) {
        return new RiskVerdict(item, Outcome.APPROVED, null, null, null);
    }

    public static RiskVerdict rejected(DecisionItem item, String reason) {
        return new RiskVerdict(item, Outcome.REJECTED, reason, null, null);
    }

    public static RiskVerdict clamped(DecisionItem item, String reason, BigDecimal quantity, Integer leverage) {
        return new RiskVerdict(item, Outcome.CLAMPED, reason, quantity, leverage);
    }

    /**
     * Approved or clamped, and not a hold.
     */
    public boolean executable() {
        return outcome != Outcome.REJECTED && item.action() != DecisionAction.HOLD;
    }

    /**
     * The item the executor should act on: the proposal with any clamped values applied.
     */
    public DecisionItem effectiveItem() {
        if (outcome != Outcome.CLAMPED) {
            return item;
        }
        DecisionItem.DecisionItemBuilder builder = item.toBuilder();
        if (adjustedQuantity != null) {
            builder.quantity(adjustedQuantity);
        }
        if (adjustedLeverage != null) {
            builder.leverage(adjustedLeverage);
        }
        return builder.build();
    }

    public List<String> adjustedFields() {
        List<String> fields = new ArrayList<>();
        if (adjustedQuantity != null) {
            fields.add("quantity");
        }
        if (adjustedLeverage != null) {
            fields.add("leverage");
        }
        return fields;
    }
}
