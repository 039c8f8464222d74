package com.signaldesk.backend.model;

public enum MarketRegime {
    BULL,
    BEAR,
    NEUTRAL
}
