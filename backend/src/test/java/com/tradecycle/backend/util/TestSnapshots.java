package com.tradecycle.backend.util;

import com.tradecycle.backend.trading.model.AccountState;
import com.tradecycle.backend.trading.model.Decision;
import com.tradecycle.backend.trading.model.DecisionAction;
import com.tradecycle.backend.trading.model.DecisionItem;
import com.tradecycle.backend.trading.model.InstrumentSnapshot;
import com.tradecycle.backend.trading.model.MarketSnapshot;
import com.tradecycle.backend.trading.model.PositionRecord;
import com.tradecycle.backend.trading.model.PositionSide;
import com.tradecycle.backend.trading.model.RiskLimits;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class TestSnapshots {

    public static final Instant NOW = Instant.parse("2026-01-15T12:00:00Z");

    private TestSnapshots() {}

    public static RiskLimits defaultLimits() {
        return new RiskLimits(new BigDecimal("1000"), 10, new BigDecimal("2"), 3, 0.7, new BigDecimal("100"), 3);
    }

    public static InstrumentSnapshot instrument(String instrument, String price) {
        return InstrumentSnapshot.ok(instrument, NOW, new BigDecimal(price), Map.of("rsi_14", 55.0));
    }

    public static InstrumentSnapshot failedInstrument(String instrument) {
        return InstrumentSnapshot.failed(instrument, NOW, "timeout");
    }

    public static AccountState account(String balance) {
        BigDecimal value = new BigDecimal(balance);
        return new AccountState(value, value, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0, 0);
    }

    public static MarketSnapshot snapshot(String balance, List<InstrumentSnapshot> instruments, List<PositionRecord> positions) {
        return new MarketSnapshot(NOW, instruments, account(balance), positions, List.of());
    }

    public static MarketSnapshot snapshot(List<InstrumentSnapshot> instruments) {
        return snapshot("10000", instruments, List.of());
    }

    public static PositionRecord position(String instrument, PositionSide side, String quantity) {
        return PositionRecord.builder()
                .instrument(instrument)
                .side(side)
                .quantity(new BigDecimal(quantity))
                .entryPrice(new BigDecimal("100"))
                .markPrice(new BigDecimal("100"))
                .leverage(5)
                .unrealizedPnl(BigDecimal.ZERO)
                .tradable(true)
                .build();
    }

    public static DecisionItem openLong(String instrument, String quantity, String stopLoss, String takeProfit, double confidence) {
        return open(DecisionAction.OPEN_LONG, instrument, quantity, stopLoss, takeProfit, confidence);
    }

    public static DecisionItem openShort(String instrument, String quantity, String stopLoss, String takeProfit, double confidence) {
        return open(DecisionAction.OPEN_SHORT, instrument, quantity, stopLoss, takeProfit, confidence);
    }

    public static DecisionItem close(String instrument, double confidence) {
        return DecisionItem.builder()
                .instrument(instrument)
                .action(DecisionAction.CLOSE)
                .confidence(confidence)
                .rationale("take profit")
                .build();
    }

    public static DecisionItem hold(String instrument) {
        return DecisionItem.builder()
                .instrument(instrument)
                .action(DecisionAction.HOLD)
                .confidence(0.5)
                .build();
    }

    public static Decision decision(DecisionItem... items) {
        return new Decision(List.of(items), "test", null);
    }

    private static DecisionItem open(DecisionAction action, String instrument, String quantity, String stopLoss,
                                     String takeProfit, double confidence) {
        return DecisionItem.builder()
                .instrument(instrument)
                .action(action)
                .quantity(quantity == null ? null : new BigDecimal(quantity))
                .leverage(5)
                .stopLoss(stopLoss == null ? null : new BigDecimal(stopLoss))
                .takeProfit(takeProfit == null ? null : new BigDecimal(takeProfit))
                .confidence(confidence)
                .rationale("trend")
                .build();
    }
}
