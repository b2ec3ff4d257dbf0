package com.tradecycle.backend.service.indicator;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class EmaService {

    /**
     * Latest EMA of the series, seeded with the SMA of the first {@code period} values.
     * Returns {@code null} when there are not enough values.
     */
    public Double latest(List<Double> values, int period) {
        List<Double> series = series(values, period);
        if (series.isEmpty()) {
            return null;
        }
        return series.get(series.size() - 1);
    }

    /**
     * EMA series aligned with {@code values}; entries before the seed are {@code null}.
     */
    public List<Double> series(List<Double> values, int period) {
        List<Double> emaSeries = new ArrayList<>();
        if (values == null) {
            return emaSeries;
        }
        for (int i = 0; i < values.size(); i++) {
            emaSeries.add(null);
        }
        if (period <= 0 || values.size() < period) {
            return emaSeries;
        }
        double sma = values.subList(0, period).stream().mapToDouble(d -> d).average().orElse(0.0);
        emaSeries.set(period - 1, sma);
        double k = 2.0 / (period + 1);
        double ema = sma;
        for (int i = period; i < values.size(); i++) {
            ema = (values.get(i) * k) + (ema * (1 - k));
            emaSeries.set(i, ema);
        }
        return emaSeries;
    }
}
