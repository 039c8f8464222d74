package com.signaldesk.backend.model;

public enum Bias {
    LONG,
    SHORT,
    NEUTRAL
}
