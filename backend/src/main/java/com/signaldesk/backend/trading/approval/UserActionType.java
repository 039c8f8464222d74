package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.exception.BadRequestException;

import java.util.Locale;

public enum UserActionType {
    EXECUTE,
    REJECT,
    DELAY,
    DETAILS;

    public static UserActionType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new BadRequestException("Action is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new BadRequestException("Unknown action: " + value);
        }
    }
}
