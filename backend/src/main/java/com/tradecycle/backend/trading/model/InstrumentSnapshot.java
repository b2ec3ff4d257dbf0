package com.tradecycle.backend.trading.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Technical state of one instrument at collection time. A failed fetch has no price and no indicators.
 */
public record InstrumentSnapshot(
        String instrument,
        Instant timestamp,
        BigDecimal price,
        Map<String, Double> indicators,
        FetchStatus status
) {
    public InstrumentSnapshot {
        indicators = indicators == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(indicators));
        status = status == null ? FetchStatus.ok() : status;
    }

    public static InstrumentSnapshot ok(String instrument, Instant timestamp, BigDecimal price, Map<String, Double> indicators) {
        return new InstrumentSnapshot(instrument, timestamp, price, indicators, FetchStatus.ok());
    }

    public static InstrumentSnapshot failed(String instrument, Instant timestamp, String reason) {
        return new InstrumentSnapshot(instrument, timestamp, null, Map.of(), FetchStatus.failed(reason));
    }

    public boolean usable() {
        return status.succeeded() && price != null && price.signum() > 0;
    }
}
