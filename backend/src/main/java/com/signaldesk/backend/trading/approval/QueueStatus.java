package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.model.RiskTier;
import com.signaldesk.backend.model.SignalDirection;

import java.time.Instant;
import java.util.Map;

public record QueueStatus(
        int totalPending,
        Map<SignalDirection, Long> byDirection,
        Map<RiskTier, Long> byRiskTier,
        double avgConfidence,
        Instant oldestPendingAt
) {}
