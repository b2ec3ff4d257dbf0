package com.tradecycle.backend.trading.pipeline;

import com.tradecycle.backend.service.venue.DailyPerformance;
import com.tradecycle.backend.service.venue.VenueBalance;
import com.tradecycle.backend.trading.model.OrderRecord;
import com.tradecycle.backend.trading.model.PositionRecord;

import java.util.List;

/**
 * Account-level venue reads, fetched together at cycle start.
 */
public record VenueState(
        VenueBalance balance,
        DailyPerformance performance,
        List<PositionRecord> positions,
        List<OrderRecord> openOrders
) {
}
