package com.signaldesk.backend.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Immutable trade proposal that travels from assembly through the quality gate
 * to the approval workflow.
 */
@Value
@Builder(toBuilder = true)
public class Signal {

    String id;
    String symbol;
    SignalDirection direction;
    SignalStrength strength;

    // qualitative confidence wins; technical confidence is kept for display
    double finalConfidence;
    double technicalConfidence;

    double entryPrice;
    double currentPrice;
    double stopLoss;
    double takeProfit;
    double positionSize;
    RiskTier riskTier;
    double riskRewardRatio;
    double maxLoss;
    double maxGain;

    MarketRegime marketRegime;
    TimeHorizon timeHorizon;
    String technicalReasoning;
    String assessmentReasoning;
    @Singular
    List<TechnicalObservation> observations;

    Instant createdAt;
}
