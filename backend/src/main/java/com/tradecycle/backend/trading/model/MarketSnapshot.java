package com.tradecycle.backend.trading.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything the decision service sees for one cycle. Built once, never modified.
 */
public record MarketSnapshot(
        Instant timestamp,
        List<InstrumentSnapshot> instruments,
        AccountState account,
        List<PositionRecord> positions,
        List<OrderRecord> openOrders
) {
    public MarketSnapshot {
        instruments = instruments == null ? List.of() : List.copyOf(instruments);
        positions = positions == null ? List.of() : List.copyOf(positions);
        openOrders = openOrders == null ? List.of() : List.copyOf(openOrders);
    }

    public Optional<InstrumentSnapshot> instrument(String instrument) {
        return instruments.stream()
                .filter(snapshot -> snapshot.instrument().equalsIgnoreCase(instrument))
                .findFirst();
    }

    /**
     * True when the instrument was fetched successfully and has a usable price.
     */
    public boolean isTradable(String instrument) {
        return instrument(instrument).map(InstrumentSnapshot::usable).orElse(false);
    }

    public Optional<PositionRecord> position(String instrument) {
        return positions.stream()
                .filter(position -> position.instrument().equalsIgnoreCase(instrument))
                .findFirst();
    }

    public int openPositionCount() {
        return positions.size();
    }

    public long usableInstrumentCount() {
        return instruments.stream().filter(InstrumentSnapshot::usable).count();
    }
}
