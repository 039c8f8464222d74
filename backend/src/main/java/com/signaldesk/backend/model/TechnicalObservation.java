package com.signaldesk.backend.model;

public record TechnicalObservation(
        String indicator,
        Bias bias,
        double weight
) {
    public static TechnicalObservation neutral(String indicator) {
        return new TechnicalObservation(indicator, Bias.NEUTRAL, 0.0);
    }

    public boolean isNeutral() {
        return bias == Bias.NEUTRAL;
    }
}
