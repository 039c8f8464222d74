package com.signaldesk.backend.event;

import com.signaldesk.backend.model.Signal;

import java.time.Instant;

public record ApprovalRequestedEvent(
        Signal signal,
        Instant requestedAt,
        Instant deadline
) {
}
