package com.tradecycle.backend.service.indicator;

import com.tradecycle.backend.model.Candle;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class RsiService {

    /**
     * Wilder RSI over closes. Returns {@code null} when fewer than {@code period + 1} candles exist.
     */
    public Double calculate(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period + 1) {
            return null;
        }
        double[] closes = candles.stream().mapToDouble(Candle::getClose).toArray();

        double gainSum = 0.0;
        double lossSum = 0.0;
        for (int i = 1; i <= period; i++) {
            double delta = closes[i] - closes[i - 1];
            gainSum += Math.max(delta, 0.0);
            lossSum += Math.max(-delta, 0.0);
        }
        double avgGain = gainSum / period;
        double avgLoss = lossSum / period;

        for (int i = period + 1; i < closes.length; i++) {
            double delta = closes[i] - closes[i - 1];
            avgGain = smooth(avgGain, Math.max(delta, 0.0), period);
            avgLoss = smooth(avgLoss, Math.max(-delta, 0.0), period);
        }
        return avgLoss == 0 ? 100.0 : 100.0 - 100.0 / (1.0 + avgGain / avgLoss);
    }

    private static double smooth(double previous, double value, int period) {
        return (previous * (period - 1) + value) / period;
    }
}
