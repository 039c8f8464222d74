package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.model.MarketContext;
import com.signaldesk.backend.model.QualitativeAssessment;
import com.signaldesk.backend.model.Recommendation;
import com.signaldesk.backend.model.RiskTier;
import com.signaldesk.backend.model.SignalDirection;
import com.signaldesk.backend.model.TechnicalSignal;
import com.signaldesk.backend.model.TimeHorizon;

/**
 * Fallback assessor used when no qualitative service is wired in. It echoes the
 * technical view, so the final confidence equals the technical confidence and the
 * stop and target fall back to the configured percentages.
 */
public class TechnicalOnlyAssessor implements QualitativeAssessor {

    @Override
    public QualitativeAssessment assess(String symbol, TechnicalSignal technicalSignal, MarketContext context) {
        double confidence = technicalSignal.confidence();
        return new QualitativeAssessment(
                confidence,
                recommendation(technicalSignal.direction(), confidence),
                riskTier(confidence),
                null,
                null,
                "Technical assessment only: " + technicalSignal.reasoning(),
                TimeHorizon.SHORT
        );
    }

    static Recommendation recommendation(SignalDirection direction, double confidence) {
        return switch (direction) {
            case LONG -> confidence > 80 ? Recommendation.STRONG_BUY : Recommendation.BUY;
            case SHORT -> confidence > 80 ? Recommendation.STRONG_SELL : Recommendation.SELL;
            case HOLD -> Recommendation.HOLD;
        };
    }

    static RiskTier riskTier(double confidence) {
        if (confidence >= 80) {
            return RiskTier.LOW;
        }
        if (confidence >= 65) {
            return RiskTier.MEDIUM;
        }
        return RiskTier.HIGH;
    }
}
