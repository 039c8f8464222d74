package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.config.SignalDeskProperties;
import com.signaldesk.backend.model.MarketContext;
import com.signaldesk.backend.model.QualitativeAssessment;
import com.signaldesk.backend.model.RiskTier;
import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.model.SignalDirection;
import com.signaldesk.backend.model.TechnicalSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class SignalAssembler {

    private final SignalDeskProperties properties;

    /**
     * Builds the final {@link Signal}, or returns {@code null} when the qualitative
     * confidence is below the configured minimum.
     */
    public Signal assemble(TechnicalSignal technical, QualitativeAssessment assessment, MarketContext context) {
        double finalConfidence = Math.min(100.0, Math.max(0.0, assessment.confidence()));
        if (finalConfidence < properties.getQuality().getMinConfidence()) {
            log.debug("Dropping {}: confidence {} below minimum {}", technical.symbol(), finalConfidence,
                    properties.getQuality().getMinConfidence());
            return null;
        }

        SignalDirection direction = assessment.recommendation() != null
                ? assessment.recommendation().toDirection()
                : SignalDirection.HOLD;
        RiskTier riskTier = assessment.riskTier() != null ? assessment.riskTier() : RiskTier.MEDIUM;
        double entry = technical.entryPrice();
        double positionSize = positionSize(riskTier);
        double stopLoss = stopLoss(entry, direction, assessment.stopLoss());
        double takeProfit = takeProfit(entry, direction, assessment.takeProfit());
        Instant createdAt = Instant.now();

        return Signal.builder()
                .id(technical.symbol() + "_" + createdAt.toEpochMilli())
                .symbol(technical.symbol())
                .direction(direction)
                .strength(technical.strength())
                .finalConfidence(finalConfidence)
                .technicalConfidence(technical.confidence())
                .entryPrice(entry)
                .currentPrice(technical.currentPrice())
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .positionSize(positionSize)
                .riskTier(riskTier)
                .riskRewardRatio(riskReward(direction, entry, stopLoss, takeProfit))
                .maxLoss(entry > 0 ? positionSize * Math.abs(entry - stopLoss) / entry : 0.0)
                .maxGain(entry > 0 ? positionSize * Math.abs(takeProfit - entry) / entry : 0.0)
                .marketRegime(context != null ? context.regime() : null)
                .timeHorizon(assessment.timeHorizon())
                .technicalReasoning(technical.reasoning())
                .assessmentReasoning(assessment.reasoning())
                .observations(technical.observations())
                .createdAt(createdAt)
                .build();
    }

    double positionSize(RiskTier riskTier) {
        SignalDeskProperties.Capital capital = properties.getCapital();
        double baseRisk = capital.getTotal() * (capital.getRiskPerTradePercent() / 100.0);
        double adjusted = baseRisk * riskTier.sizingMultiplier();
        return Math.max(capital.getMinTradeAmount(), Math.min(capital.getMaxTradeAmount(), adjusted));
    }

    double stopLoss(double entry, SignalDirection direction, Double suggested) {
        if (suggested != null && suggested > 0) {
            return suggested;
        }
        double pct = properties.getCapital().getStopLossPercent() / 100.0;
        return switch (direction) {
            case LONG -> entry * (1 - pct);
            case SHORT -> entry * (1 + pct);
            case HOLD -> entry;
        };
    }

    double takeProfit(double entry, SignalDirection direction, Double suggested) {
        if (suggested != null && suggested > 0) {
            return suggested;
        }
        double pct = properties.getCapital().getTakeProfitPercent() / 100.0;
        return switch (direction) {
            case LONG -> entry * (1 + pct);
            case SHORT -> entry * (1 - pct);
            case HOLD -> entry;
        };
    }

    /**
     * Reward over risk measured in the trade's direction. A stop or target on the
     * wrong side of the entry yields 0, which the quality gate rejects.
     */
    static double riskReward(SignalDirection direction, double entry, double stopLoss, double takeProfit) {
        double risk;
        double reward;
        switch (direction) {
            case LONG -> {
                risk = entry - stopLoss;
                reward = takeProfit - entry;
            }
            case SHORT -> {
                risk = stopLoss - entry;
                reward = entry - takeProfit;
            }
            default -> {
                return 0.0;
            }
        }
        if (risk <= 0 || reward <= 0) {
            return 0.0;
        }
        return reward / risk;
    }
}
