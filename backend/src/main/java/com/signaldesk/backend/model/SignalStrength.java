package com.signaldesk.backend.model;

public enum SignalStrength {
    NONE,
    WEAK,
    MEDIUM,
    STRONG;

    public static SignalStrength fromConfidence(double confidence) {
        if (confidence > 80) {
            return STRONG;
        }
        if (confidence > 70) {
            return MEDIUM;
        }
        return WEAK;
    }
}
