package com.signaldesk.backend.model;

import java.util.List;

/**
 * Precomputed indicator values for one symbol. Bollinger bands are {@code null}
 * when there was not enough history to compute them.
 */
public record IndicatorSnapshot(
        String symbol,
        double price,
        double change24h,
        double rsi,
        Macd macd,
        double emaFast,
        double emaMedium,
        double emaSlow,
        BollingerBands bollinger,
        double volumeRatio,
        List<Double> supportLevels,
        List<Double> resistanceLevels
) {
    public IndicatorSnapshot {
        supportLevels = supportLevels == null ? List.of() : List.copyOf(supportLevels);
        resistanceLevels = resistanceLevels == null ? List.of() : List.copyOf(resistanceLevels);
    }

    public record Macd(double line, double signal, double histogram) {}

    public record BollingerBands(double upper, double middle, double lower) {}
}
