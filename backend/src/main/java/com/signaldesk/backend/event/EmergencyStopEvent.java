package com.signaldesk.backend.event;

import java.time.Instant;

public record EmergencyStopEvent(
        String reason,
        int count,
        Instant createdAt
) {
}
