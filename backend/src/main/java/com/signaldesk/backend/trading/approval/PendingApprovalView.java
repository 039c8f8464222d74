package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.model.SignalDirection;

import java.time.Instant;

public record PendingApprovalView(
        String id,
        String symbol,
        SignalDirection direction,
        double confidence,
        Instant requestedAt,
        long timeRemainingMs
) {}
