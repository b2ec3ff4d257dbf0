package com.tradecycle.backend.service.indicator;

import com.tradecycle.backend.model.Candle;
import com.tradecycle.backend.service.venue.IndicatorFeed;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw candles and futures metrics into the named indicator map sent to the decision service.
 * Indicators that cannot be computed from the available history are left out rather than zeroed.
 */
@Service
@RequiredArgsConstructor
public class IndicatorEngine {

    private final EmaService emaService;
    private final MacdService macdService;
    private final RsiService rsiService;
    private final AtrService atrService;

    public Map<String, Double> compute(IndicatorFeed feed) {
        Map<String, Double> indicators = new LinkedHashMap<>();

        List<Candle> hourly = feed.hourlyCandles();
        List<Double> hourlyCloses = hourly.stream().map(Candle::getClose).toList();
        put(indicators, "ema_9", emaService.latest(hourlyCloses, 9));
        MacdService.MacdResult macd = macdService.calculate(hourly);
        if (macd != null) {
            indicators.put("macd", macd.macdLine());
            indicators.put("macd_histogram", macd.histogram());
        }
        put(indicators, "rsi_7", rsiService.calculate(hourly, 7));
        put(indicators, "rsi_14", rsiService.calculate(hourly, 14));

        List<Candle> daily = feed.dailyCandles();
        List<Double> dailyCloses = daily.stream().map(Candle::getClose).toList();
        put(indicators, "ema_9_1d", emaService.latest(dailyCloses, 9));
        put(indicators, "ema_21_1d", emaService.latest(dailyCloses, 21));
        put(indicators, "atr_14", atrService.calculate(daily, 14));
        put(indicators, "atr_28", atrService.calculate(daily, 28));
        if (!daily.isEmpty()) {
            indicators.put("current_volume", daily.get(daily.size() - 1).getVolume());
            indicators.put("average_volume", daily.stream().mapToDouble(Candle::getVolume).average().orElse(0.0));
        }

        put(indicators, "open_interest", feed.openInterestLatest());
        put(indicators, "open_interest_avg", feed.openInterestAverage());
        put(indicators, "funding_rate_pct", feed.fundingRatePct());
        return indicators;
    }

    private static void put(Map<String, Double> indicators, String key, Double value) {
        if (value != null && !value.isNaN() && !value.isInfinite()) {
            indicators.put(key, value);
        }
    }
}
