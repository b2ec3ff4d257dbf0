package com.tradecycle.backend.trading.model;

import java.util.List;

public record Decision(List<DecisionItem> items, String rationale, String strategyForNextCycle) {

    public Decision {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static Decision empty(String rationale) {
        return new Decision(List.of(), rationale, null);
    }
}
