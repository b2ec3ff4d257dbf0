package com.tradecycle.backend.service.indicator;

import com.tradecycle.backend.model.Candle;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class MacdService {

    public static final int FAST_PERIOD = 12;
    public static final int SLOW_PERIOD = 26;
    public static final int SIGNAL_PERIOD = 9;

    private final EmaService emaService;

    public MacdResult calculate(List<Candle> candles) {
        return calculate(candles, FAST_PERIOD, SLOW_PERIOD, SIGNAL_PERIOD);
    }

    /**
     * Returns {@code null} when the series is too short to produce a signal line.
     */
    public MacdResult calculate(List<Candle> candles, int fast, int slow, int signal) {
        if (candles == null || candles.isEmpty()) {
            return null;
        }
        List<Double> closes = candles.stream().map(Candle::getClose).toList();
        List<Double> fastSeries = emaService.series(closes, fast);
        List<Double> slowSeries = emaService.series(closes, slow);

        // both EMAs exist from the slower seed onwards
        int first = Math.max(fast, slow) - 1;
        List<Double> macdSeries = new ArrayList<>();
        for (int i = first; i < closes.size(); i++) {
            macdSeries.add(fastSeries.get(i) - slowSeries.get(i));
        }
        if (macdSeries.size() < signal) {
            return null;
        }

        Double signalLine = emaService.latest(macdSeries, signal);
        double macdLine = macdSeries.get(macdSeries.size() - 1);
        return new MacdResult(macdLine, signalLine, macdLine - signalLine);
    }

    public record MacdResult(double macdLine, double signalLine, double histogram) {}
}
