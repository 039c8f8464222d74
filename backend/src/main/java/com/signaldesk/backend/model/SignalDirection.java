package com.signaldesk.backend.model;

public enum SignalDirection {
    LONG,
    SHORT,
    HOLD;

    public boolean isTradable() {
        return this != HOLD;
    }
}
