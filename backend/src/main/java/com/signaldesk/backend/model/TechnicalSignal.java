package com.signaldesk.backend.model;

import java.util.List;

public record TechnicalSignal(
        String symbol,
        SignalDirection direction,
        SignalStrength strength,
        double confidence,
        double currentPrice,
        double entryPrice,
        List<TechnicalObservation> observations,
        String reasoning
) {
    public TechnicalSignal {
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public static TechnicalSignal hold(String symbol, double price, String reasoning) {
        return new TechnicalSignal(symbol, SignalDirection.HOLD, SignalStrength.NONE, 0.0, price, price, List.of(), reasoning);
    }
}
