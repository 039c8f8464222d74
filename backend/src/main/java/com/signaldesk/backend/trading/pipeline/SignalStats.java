package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.model.RiskTier;
import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.model.SignalDirection;

import java.util.List;
import java.util.Map;

public record SignalStats(
        int totalSignals,
        Map<SignalDirection, Long> byDirection,
        Map<RiskTier, Long> byRiskTier,
        double avgConfidence,
        List<Signal> recentSignals
) {}
