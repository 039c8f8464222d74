package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.config.SignalDeskProperties;
import com.signaldesk.backend.model.Bias;
import com.signaldesk.backend.model.IndicatorSnapshot;
import com.signaldesk.backend.model.MarketContext;
import com.signaldesk.backend.model.MarketRegime;
import com.signaldesk.backend.model.SignalDirection;
import com.signaldesk.backend.model.SignalStrength;
import com.signaldesk.backend.model.TechnicalObservation;
import com.signaldesk.backend.model.TechnicalSignal;
import com.signaldesk.backend.util.TestSignalFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class IndicatorAggregatorTest {

    private final IndicatorAggregator aggregator = new IndicatorAggregator(new SignalDeskProperties());
    private final MarketContext neutral = MarketContext.of(MarketRegime.NEUTRAL);

    @Test
    void bullishSnapshotProducesLongSignal() {
        TechnicalSignal signal = aggregator.aggregate(TestSignalFactory.bullishSnapshot("BTC"), neutral);

        assertThat(signal.direction()).isEqualTo(SignalDirection.LONG);
        assertThat(signal.confidence()).isEqualTo(72.0);
        assertThat(signal.strength()).isEqualTo(SignalStrength.MEDIUM);
        assertThat(signal.observations())
                .extracting(TechnicalObservation::indicator)
                .containsExactlyInAnyOrder(IndicatorAggregator.EMA_CROSSOVER, IndicatorAggregator.RSI,
                        IndicatorAggregator.MACD, IndicatorAggregator.VOLUME);
        assertThat(signal.currentPrice()).isEqualTo(105.0);
        assertThat(signal.entryPrice()).isCloseTo(105.105, within(1e-9));
        assertThat(signal.reasoning()).startsWith("Mean reversion in sideways market").contains("Total weight: 72");
    }

    @Test
    void bearishSnapshotProducesShortSignalWithEntryBelowPrice() {
        TechnicalSignal signal = aggregator.aggregate(TestSignalFactory.bearishSnapshot("ETH"), neutral);

        assertThat(signal.direction()).isEqualTo(SignalDirection.SHORT);
        assertThat(signal.confidence()).isEqualTo(72.0);
        assertThat(signal.entryPrice()).isCloseTo(94.905, within(1e-9));
    }

    @Test
    void noObservationsGivesHold() {
        TechnicalSignal signal = aggregator.aggregate(TestSignalFactory.neutralSnapshot("SOL", 20.0), neutral);

        assertThat(signal.direction()).isEqualTo(SignalDirection.HOLD);
        assertThat(signal.strength()).isEqualTo(SignalStrength.NONE);
        assertThat(signal.observations()).isEmpty();
        assertThat(signal.reasoning()).isEqualTo("No clear signals");
    }

    @Test
    void weightAtOrBelowThresholdGivesHold() {
        // EMA stack (25) + MACD (20) = 45
        IndicatorSnapshot snapshot = new IndicatorSnapshot("BTC", 105.0, 0.0, 50.0,
                new IndicatorSnapshot.Macd(1.0, 0.5, 0.5), 104.0, 102.0, 100.0,
                null, 1.0, List.of(), List.of());

        TechnicalSignal signal = aggregator.aggregate(snapshot, neutral);

        assertThat(signal.direction()).isEqualTo(SignalDirection.HOLD);
        assertThat(signal.strength()).isEqualTo(SignalStrength.NONE);
        assertThat(signal.confidence()).isEqualTo(45.0);
        assertThat(signal.observations()).hasSize(2);
    }

    @Test
    void equalVoteCountsGiveHold() {
        // LONG: EMA 25 + MACD 20; SHORT: RSI 75 (18) + volume on a 3% drop (15)
        IndicatorSnapshot snapshot = new IndicatorSnapshot("BTC", 105.0, -3.0, 75.0,
                new IndicatorSnapshot.Macd(1.0, 0.5, 0.5), 104.0, 102.0, 100.0,
                null, 2.0, List.of(), List.of());

        TechnicalSignal signal = aggregator.aggregate(snapshot, neutral);

        assertThat(signal.confidence()).isEqualTo(78.0);
        assertThat(signal.direction()).isEqualTo(SignalDirection.HOLD);
    }

    @Test
    void confidenceIsCappedAtHundred() {
        IndicatorSnapshot snapshot = new IndicatorSnapshot("BTC", 100.0, 3.0, 20.0,
                new IndicatorSnapshot.Macd(1.0, 0.5, 0.5), 99.0, 98.0, 97.0,
                new IndicatorSnapshot.BollingerBands(110.0, 105.0, 99.5), 2.0, List.of(99.0), List.of());

        TechnicalSignal signal = aggregator.aggregate(snapshot, neutral);

        assertThat(signal.direction()).isEqualTo(SignalDirection.LONG);
        assertThat(signal.confidence()).isEqualTo(100.0);
        assertThat(signal.strength()).isEqualTo(SignalStrength.STRONG);
    }

    @Test
    void emaRuleDistinguishesFullStackFromPartialCross() {
        assertThat(aggregator.analyzeEmaCrossover(snapshotWithEma(105, 104, 102, 100)))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.EMA_CROSSOVER, Bias.LONG, 25));
        assertThat(aggregator.analyzeEmaCrossover(snapshotWithEma(103, 104, 102, 106)))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.EMA_CROSSOVER, Bias.LONG, 15));
        assertThat(aggregator.analyzeEmaCrossover(snapshotWithEma(95, 96, 98, 100)))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.EMA_CROSSOVER, Bias.SHORT, 25));
        assertThat(aggregator.analyzeEmaCrossover(snapshotWithEma(97, 96, 98, 94)))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.EMA_CROSSOVER, Bias.SHORT, 15));
        assertThat(aggregator.analyzeEmaCrossover(snapshotWithEma(100, 100, 100, 100)).isNeutral()).isTrue();
    }

    @Test
    void rsiRuleDependsOnRegime() {
        assertThat(aggregator.analyzeRsi(snapshotWithRsi(25), MarketRegime.BULL).weight()).isEqualTo(20);
        assertThat(aggregator.analyzeRsi(snapshotWithRsi(75), MarketRegime.BEAR).bias()).isEqualTo(Bias.SHORT);
        assertThat(aggregator.analyzeRsi(snapshotWithRsi(60), MarketRegime.BULL))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.RSI, Bias.LONG, 10));
        assertThat(aggregator.analyzeRsi(snapshotWithRsi(40), MarketRegime.BEAR))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.RSI, Bias.SHORT, 10));
        assertThat(aggregator.analyzeRsi(snapshotWithRsi(25), MarketRegime.NEUTRAL))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.RSI, Bias.LONG, 18));
        assertThat(aggregator.analyzeRsi(snapshotWithRsi(65), MarketRegime.NEUTRAL))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.RSI, Bias.SHORT, 12));
        assertThat(aggregator.analyzeRsi(snapshotWithRsi(45), MarketRegime.BULL).isNeutral()).isTrue();
        assertThat(aggregator.analyzeRsi(snapshotWithRsi(75), MarketRegime.BULL).isNeutral()).isTrue();
    }

    @Test
    void macdWeightFollowsHistogramSign() {
        assertThat(aggregator.analyzeMacd(snapshotWithMacd(1.0, 0.5, 0.5)).weight()).isEqualTo(20);
        assertThat(aggregator.analyzeMacd(snapshotWithMacd(1.0, 0.5, -0.1)).weight()).isEqualTo(15);
        assertThat(aggregator.analyzeMacd(snapshotWithMacd(-1.0, -0.5, -0.5)).bias()).isEqualTo(Bias.SHORT);
        assertThat(aggregator.analyzeMacd(snapshotWithMacd(0.3, 0.3, 0.0)).isNeutral()).isTrue();
    }

    @Test
    void volumeNeedsSpikeAndPriceMove() {
        assertThat(aggregator.analyzeVolume(snapshotWithVolume(2.0, 2.5)).bias()).isEqualTo(Bias.LONG);
        assertThat(aggregator.analyzeVolume(snapshotWithVolume(2.0, -2.5)).bias()).isEqualTo(Bias.SHORT);
        assertThat(aggregator.analyzeVolume(snapshotWithVolume(1.5, 5.0)).isNeutral()).isTrue();
        assertThat(aggregator.analyzeVolume(snapshotWithVolume(3.0, 1.0)).isNeutral()).isTrue();
    }

    @Test
    void supportAndResistanceProximity() {
        assertThat(aggregator.analyzeSupportResistance(snapshotWithLevels(40, List.of(99.0), List.of())))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.SUPPORT_RESISTANCE, Bias.LONG, 20));
        assertThat(aggregator.analyzeSupportResistance(snapshotWithLevels(60, List.of(), List.of(101.0))))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.SUPPORT_RESISTANCE, Bias.SHORT, 20));
        assertThat(aggregator.analyzeSupportResistance(snapshotWithLevels(50, List.of(99.0), List.of())))
                .isEqualTo(new TechnicalObservation(IndicatorAggregator.SUPPORT_RESISTANCE, Bias.LONG, 15));
        assertThat(aggregator.analyzeSupportResistance(snapshotWithLevels(50, List.of(90.0), List.of(110.0))).isNeutral())
                .isTrue();
    }

    @Test
    void bollingerBandEdges() {
        assertThat(aggregator.analyzeBollinger(snapshotWithBands(100.0, new IndicatorSnapshot.BollingerBands(110, 105, 99.5))).bias())
                .isEqualTo(Bias.LONG);
        assertThat(aggregator.analyzeBollinger(snapshotWithBands(100.0, new IndicatorSnapshot.BollingerBands(100.5, 95, 90))).bias())
                .isEqualTo(Bias.SHORT);
        assertThat(aggregator.analyzeBollinger(snapshotWithBands(100.0, new IndicatorSnapshot.BollingerBands(110, 100, 90))).isNeutral())
                .isTrue();
        assertThat(aggregator.analyzeBollinger(snapshotWithBands(100.0, null)).isNeutral()).isTrue();
    }

    @Test
    void identicalInputsGiveIdenticalOutput() {
        IndicatorSnapshot snapshot = TestSignalFactory.bullishSnapshot("BTC");
        MarketContext bull = MarketContext.of(MarketRegime.BULL);

        assertThat(aggregator.aggregate(snapshot, bull)).isEqualTo(aggregator.aggregate(snapshot, bull));
    }

    @Test
    void everyWeightStaysWithinRuleBounds() {
        TechnicalSignal signal = aggregator.aggregate(TestSignalFactory.bullishSnapshot("BTC"), neutral);

        assertThat(signal.observations())
                .allSatisfy(observation -> assertThat(observation.weight()).isBetween(10.0, 25.0));
    }

    private static IndicatorSnapshot snapshotWithEma(double price, double fast, double medium, double slow) {
        return new IndicatorSnapshot("BTC", price, 0.0, 50.0, null, fast, medium, slow, null, 1.0, List.of(), List.of());
    }

    private static IndicatorSnapshot snapshotWithRsi(double rsi) {
        return new IndicatorSnapshot("BTC", 100.0, 0.0, rsi, null, 100.0, 100.0, 100.0, null, 1.0, List.of(), List.of());
    }

    private static IndicatorSnapshot snapshotWithMacd(double line, double signal, double histogram) {
        return new IndicatorSnapshot("BTC", 100.0, 0.0, 50.0, new IndicatorSnapshot.Macd(line, signal, histogram),
                100.0, 100.0, 100.0, null, 1.0, List.of(), List.of());
    }

    private static IndicatorSnapshot snapshotWithVolume(double volumeRatio, double change24h) {
        return new IndicatorSnapshot("BTC", 100.0, change24h, 50.0, null, 100.0, 100.0, 100.0, null, volumeRatio,
                List.of(), List.of());
    }

    private static IndicatorSnapshot snapshotWithLevels(double rsi, List<Double> support, List<Double> resistance) {
        return new IndicatorSnapshot("BTC", 100.0, 0.0, rsi, null, 100.0, 100.0, 100.0, null, 1.0, support, resistance);
    }

    private static IndicatorSnapshot snapshotWithBands(double price, IndicatorSnapshot.BollingerBands bands) {
        return new IndicatorSnapshot("BTC", price, 0.0, 50.0, null, price, price, price, bands, 1.0, List.of(), List.of());
    }
}
