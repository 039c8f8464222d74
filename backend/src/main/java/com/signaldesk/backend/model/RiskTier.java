package com.signaldesk.backend.model;

public enum RiskTier {
    LOW(1.2),
    MEDIUM(1.0),
    HIGH(0.7);

    private final double sizingMultiplier;

    RiskTier(double sizingMultiplier) {
        this.sizingMultiplier = sizingMultiplier;
    }

    public double sizingMultiplier() {
        return sizingMultiplier;
    }
}
