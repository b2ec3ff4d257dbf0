package com.tradecycle.backend.service.venue;

import com.tradecycle.backend.model.Candle;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw inputs for indicator computation. Futures metrics are {@code null} when the venue could not supply them.
 */
public record IndicatorFeed(
        String instrument,
        BigDecimal price,
        List<Candle> hourlyCandles,
        List<Candle> dailyCandles,
        Double openInterestLatest,
        Double openInterestAverage,
        Double fundingRatePct
) {
    public IndicatorFeed {
        hourlyCandles = hourlyCandles == null ? List.of() : List.copyOf(hourlyCandles);
        dailyCandles = dailyCandles == null ? List.of() : List.copyOf(dailyCandles);
    }
}
