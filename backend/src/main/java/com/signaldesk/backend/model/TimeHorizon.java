package com.signaldesk.backend.model;

public enum TimeHorizon {
    SHORT,
    MEDIUM,
    LONG
}
