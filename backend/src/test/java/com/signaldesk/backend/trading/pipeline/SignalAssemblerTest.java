package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.config.SignalDeskProperties;
import com.signaldesk.backend.model.MarketContext;
import com.signaldesk.backend.model.MarketRegime;
import com.signaldesk.backend.model.QualitativeAssessment;
import com.signaldesk.backend.model.Recommendation;
import com.signaldesk.backend.model.RiskTier;
import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.model.SignalDirection;
import com.signaldesk.backend.model.SignalStrength;
import com.signaldesk.backend.model.TechnicalSignal;
import com.signaldesk.backend.model.TimeHorizon;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalAssemblerTest {

    private final SignalDeskProperties properties = new SignalDeskProperties();
    private final SignalAssembler assembler = new SignalAssembler(properties);
    private final MarketContext neutral = MarketContext.of(MarketRegime.NEUTRAL);

    @Test
    void assemblesLongSignalWithDefaultStopAndTarget() {
        Signal signal = assembler.assemble(technical(SignalDirection.LONG, 72.0),
                assessment(82.0, Recommendation.BUY, RiskTier.LOW, null, null), neutral);

        assertThat(signal).isNotNull();
        assertThat(signal.getId()).startsWith("BTC_");
        assertThat(signal.getDirection()).isEqualTo(SignalDirection.LONG);
        assertThat(signal.getFinalConfidence()).isEqualTo(82.0);
        assertThat(signal.getTechnicalConfidence()).isEqualTo(72.0);
        assertThat(signal.getStrength()).isEqualTo(SignalStrength.MEDIUM);
        assertThat(signal.getEntryPrice()).isEqualTo(100.0);
        assertThat(signal.getCurrentPrice()).isEqualTo(99.9);
        assertThat(signal.getStopLoss()).isCloseTo(97.0, within(1e-9));
        assertThat(signal.getTakeProfit()).isCloseTo(105.0, within(1e-9));
        assertThat(signal.getPositionSize()).isCloseTo(18.0, within(1e-9));
        assertThat(signal.getRiskRewardRatio()).isCloseTo(5.0 / 3.0, within(1e-9));
        assertThat(signal.getMaxLoss()).isCloseTo(0.54, within(1e-9));
        assertThat(signal.getMaxGain()).isCloseTo(0.9, within(1e-9));
        assertThat(signal.getMarketRegime()).isEqualTo(MarketRegime.NEUTRAL);
        assertThat(signal.getObservations()).isEmpty();
        assertThat(signal.getCreatedAt()).isNotNull();
    }

    @Test
    void confidenceBelowMinimumReturnsNull() {
        Signal signal = assembler.assemble(technical(SignalDirection.LONG, 90.0),
                assessment(65.0, Recommendation.STRONG_BUY, RiskTier.LOW, null, null), neutral);

        assertThat(signal).isNull();
    }

    @Test
    void confidenceIsClampedToHundred() {
        Signal signal = assembler.assemble(technical(SignalDirection.LONG, 72.0),
                assessment(130.0, Recommendation.BUY, RiskTier.MEDIUM, null, null), neutral);

        assertThat(signal.getFinalConfidence()).isEqualTo(100.0);
    }

    @Test
    void suggestedLevelsOverrideDefaultsForShort() {
        Signal signal = assembler.assemble(technical(SignalDirection.SHORT, 75.0),
                assessment(80.0, Recommendation.SELL, RiskTier.MEDIUM, 103.0, 94.0), neutral);

        assertThat(signal.getDirection()).isEqualTo(SignalDirection.SHORT);
        assertThat(signal.getStopLoss()).isEqualTo(103.0);
        assertThat(signal.getTakeProfit()).isEqualTo(94.0);
        assertThat(signal.getRiskRewardRatio()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void recommendationDecidesDirection() {
        Signal signal = assembler.assemble(technical(SignalDirection.LONG, 72.0),
                assessment(80.0, Recommendation.STRONG_SELL, RiskTier.MEDIUM, null, null), neutral);

        assertThat(signal.getDirection()).isEqualTo(SignalDirection.SHORT);
        assertThat(signal.getStopLoss()).isCloseTo(103.0, within(1e-9));
        assertThat(signal.getTakeProfit()).isCloseTo(95.0, within(1e-9));
    }

    @Test
    void missingRecommendationAndRiskTierFallBack() {
        Signal signal = assembler.assemble(technical(SignalDirection.LONG, 72.0),
                assessment(80.0, null, null, null, null), neutral);

        assertThat(signal.getDirection()).isEqualTo(SignalDirection.HOLD);
        assertThat(signal.getRiskTier()).isEqualTo(RiskTier.MEDIUM);
        assertThat(signal.getRiskRewardRatio()).isZero();
    }

    @Test
    void positionSizeScalesWithRiskTierAndIsClamped() {
        assertThat(assembler.positionSize(RiskTier.MEDIUM)).isCloseTo(15.0, within(1e-9));
        assertThat(assembler.positionSize(RiskTier.HIGH)).isCloseTo(10.5, within(1e-9));

        properties.getCapital().setTotal(5000.0);
        assertThat(assembler.positionSize(RiskTier.LOW)).isEqualTo(50.0);

        properties.getCapital().setTotal(100.0);
        assertThat(assembler.positionSize(RiskTier.HIGH)).isEqualTo(10.0);
    }

    @Test
    void riskRewardMatchesWorkedExamples() {
        assertThat(SignalAssembler.riskReward(SignalDirection.LONG, 100, 98, 106)).isCloseTo(3.0, within(1e-9));
        assertThat(SignalAssembler.riskReward(SignalDirection.LONG, 100, 95, 102)).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void riskRewardIsZeroWhenLevelsAreOnTheWrongSide() {
        assertThat(SignalAssembler.riskReward(SignalDirection.LONG, 100, 101, 106)).isZero();
        assertThat(SignalAssembler.riskReward(SignalDirection.SHORT, 100, 98, 94)).isZero();
        assertThat(SignalAssembler.riskReward(SignalDirection.LONG, 100, 100, 106)).isZero();
        assertThat(SignalAssembler.riskReward(SignalDirection.HOLD, 100, 98, 106)).isZero();
    }

    private static TechnicalSignal technical(SignalDirection direction, double confidence) {
        return new TechnicalSignal("BTC", direction, SignalStrength.fromConfidence(confidence), confidence,
                99.9, 100.0, List.of(), "technical");
    }

    private static QualitativeAssessment assessment(double confidence, Recommendation recommendation, RiskTier riskTier,
                                                    Double stopLoss, Double takeProfit) {
        return new QualitativeAssessment(confidence, recommendation, riskTier, stopLoss, takeProfit, "qualitative",
                TimeHorizon.SHORT);
    }
}
