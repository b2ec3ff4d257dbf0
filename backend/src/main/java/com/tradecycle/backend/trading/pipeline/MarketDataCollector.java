package com.tradecycle.backend.trading.pipeline;

import com.tradecycle.backend.trading.model.InstrumentSnapshot;

import java.util.List;
import java.util.Map;

public interface MarketDataCollector {

    /**
     * Fetches every instrument independently. Never throws: an instrument that cannot be
     * loaded comes back as a failed snapshot. Keys keep the order of {@code instruments}.
     */
    Map<String, InstrumentSnapshot> collect(List<String> instruments);
}
