package com.signaldesk.backend.model;

public enum Recommendation {
    STRONG_BUY,
    BUY,
    HOLD,
    SELL,
    STRONG_SELL;

    public SignalDirection toDirection() {
        return switch (this) {
            case STRONG_BUY, BUY -> SignalDirection.LONG;
            case STRONG_SELL, SELL -> SignalDirection.SHORT;
            case HOLD -> SignalDirection.HOLD;
        };
    }
}
