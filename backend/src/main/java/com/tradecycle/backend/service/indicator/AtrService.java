package com.tradecycle.backend.service.indicator;

import com.tradecycle.backend.model.Candle;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class AtrService {

    /**
     * Wilder-smoothed ATR. Returns {@code null} when fewer than {@code period + 1} candles exist.
     */
    public Double calculate(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period + 1) {
            return null;
        }
        double seed = 0.0;
        for (int i = 1; i <= period; i++) {
            seed += trueRange(candles.get(i), candles.get(i - 1).getClose());
        }
        double atr = seed / period;
        for (int i = period + 1; i < candles.size(); i++) {
            atr = (atr * (period - 1) + trueRange(candles.get(i), candles.get(i - 1).getClose())) / period;
        }
        return atr;
    }

    static double trueRange(Candle candle, double previousClose) {
        double range = candle.getHigh() - candle.getLow();
        double gapUp = Math.abs(candle.getHigh() - previousClose);
        double gapDown = Math.abs(candle.getLow() - previousClose);
        return Math.max(range, Math.max(gapUp, gapDown));
    }
}
