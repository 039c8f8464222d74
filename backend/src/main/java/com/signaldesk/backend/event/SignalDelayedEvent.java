package com.signaldesk.backend.event;

import com.signaldesk.backend.model.Signal;

import java.time.Instant;

public record SignalDelayedEvent(
        Signal signal,
        long delayMinutes,
        String actorId,
        Instant newDeadline
) {
}
