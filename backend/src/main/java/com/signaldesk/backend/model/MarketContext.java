package com.signaldesk.backend.model;

public record MarketContext(
        MarketRegime regime,
        String sentiment,
        Integer fearGreedIndex,
        Double volatility
) {
    public static MarketContext of(MarketRegime regime) {
        return new MarketContext(regime, null, null, null);
    }
}
