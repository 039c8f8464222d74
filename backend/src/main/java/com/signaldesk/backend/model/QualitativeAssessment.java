package com.signaldesk.backend.model;

/**
 * Qualitative view of a proposed trade, usually produced by an AI service.
 * Stop loss and take profit are optional; {@code null} means "derive from entry".
 */
public record QualitativeAssessment(
        double confidence,
        Recommendation recommendation,
        RiskTier riskTier,
        Double stopLoss,
        Double takeProfit,
        String reasoning,
        TimeHorizon timeHorizon
) {}
