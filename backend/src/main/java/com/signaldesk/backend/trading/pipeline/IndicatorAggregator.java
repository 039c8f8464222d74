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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Folds six indicator rules into one directional {@link TechnicalSignal}.
 * <p>
 * Each rule looks at a single indicator family and either stays neutral or votes
 * for a direction with a fixed weight. The majority of non-neutral votes picks the
 * direction, and the summed weight must clear {@code minTotalWeight} before a
 * non-HOLD signal is produced. Equal vote counts resolve to HOLD.
 * <p>
 * No I/O and no state: identical inputs always give identical output.
 */
@Service
@RequiredArgsConstructor
public class IndicatorAggregator {

    static final String EMA_CROSSOVER = "EMA_CROSSOVER";
    static final String RSI = "RSI";
    static final String MACD = "MACD";
    static final String VOLUME = "VOLUME";
    static final String SUPPORT_RESISTANCE = "SUPPORT_RESISTANCE";
    static final String BOLLINGER_BANDS = "BOLLINGER_BANDS";

    private static final double LEVEL_PROXIMITY = 0.02;
    private static final double VOLUME_PRICE_MOVE_PCT = 2.0;

    private final SignalDeskProperties properties;

    public TechnicalSignal aggregate(IndicatorSnapshot snapshot, MarketContext context) {
        MarketRegime regime = context != null && context.regime() != null ? context.regime() : MarketRegime.NEUTRAL;

        List<TechnicalObservation> observations = List.of(
                analyzeEmaCrossover(snapshot),
                analyzeRsi(snapshot, regime),
                analyzeMacd(snapshot),
                analyzeVolume(snapshot),
                analyzeSupportResistance(snapshot),
                analyzeBollinger(snapshot)
        ).stream().filter(o -> !o.isNeutral()).toList();

        if (observations.isEmpty()) {
            return TechnicalSignal.hold(snapshot.symbol(), snapshot.price(), "No clear signals");
        }

        long bullish = observations.stream().filter(o -> o.bias() == Bias.LONG).count();
        long bearish = observations.stream().filter(o -> o.bias() == Bias.SHORT).count();
        double totalWeight = observations.stream().mapToDouble(TechnicalObservation::weight).sum();
        double confidence = Math.min(100.0, totalWeight);
        String reasoning = buildReasoning(observations, regime, totalWeight);

        SignalDirection direction = SignalDirection.HOLD;
        if (totalWeight > properties.getIndicators().getMinTotalWeight()) {
            if (bullish > bearish) {
                direction = SignalDirection.LONG;
            } else if (bearish > bullish) {
                direction = SignalDirection.SHORT;
            }
        }

        if (direction == SignalDirection.HOLD) {
            return new TechnicalSignal(snapshot.symbol(), SignalDirection.HOLD, SignalStrength.NONE, confidence,
                    snapshot.price(), snapshot.price(), observations, reasoning);
        }
        return new TechnicalSignal(
                snapshot.symbol(),
                direction,
                SignalStrength.fromConfidence(confidence),
                confidence,
                snapshot.price(),
                entryPrice(snapshot, direction),
                observations,
                reasoning
        );
    }

    TechnicalObservation analyzeEmaCrossover(IndicatorSnapshot s) {
        double fast = s.emaFast();
        double medium = s.emaMedium();
        double slow = s.emaSlow();
        double price = s.price();

        if (fast > medium && medium > slow && price > fast) {
            return new TechnicalObservation(EMA_CROSSOVER, Bias.LONG, 25);
        }
        if (fast < medium && medium < slow && price < fast) {
            return new TechnicalObservation(EMA_CROSSOVER, Bias.SHORT, 25);
        }
        if (fast > medium && price > medium) {
            return new TechnicalObservation(EMA_CROSSOVER, Bias.LONG, 15);
        }
        if (fast < medium && price < medium) {
            return new TechnicalObservation(EMA_CROSSOVER, Bias.SHORT, 15);
        }
        return TechnicalObservation.neutral(EMA_CROSSOVER);
    }

    TechnicalObservation analyzeRsi(IndicatorSnapshot s, MarketRegime regime) {
        double rsi = s.rsi();
        double oversold = properties.getIndicators().getRsiOversold();
        double overbought = properties.getIndicators().getRsiOverbought();

        if (regime == MarketRegime.BULL && rsi < oversold) {
            return new TechnicalObservation(RSI, Bias.LONG, 20);
        }
        if (regime == MarketRegime.BEAR && rsi > overbought) {
            return new TechnicalObservation(RSI, Bias.SHORT, 20);
        }
        if (regime == MarketRegime.NEUTRAL) {
            // mean reversion while ranging
            if (rsi < 30) {
                return new TechnicalObservation(RSI, Bias.LONG, 18);
            }
            if (rsi > 70) {
                return new TechnicalObservation(RSI, Bias.SHORT, 18);
            }
            if (rsi < 40) {
                return new TechnicalObservation(RSI, Bias.LONG, 12);
            }
            if (rsi > 60) {
                return new TechnicalObservation(RSI, Bias.SHORT, 12);
            }
            return TechnicalObservation.neutral(RSI);
        }
        if (regime == MarketRegime.BULL && rsi > 50 && rsi < 70) {
            return new TechnicalObservation(RSI, Bias.LONG, 10);
        }
        if (regime == MarketRegime.BEAR && rsi < 50 && rsi > 30) {
            return new TechnicalObservation(RSI, Bias.SHORT, 10);
        }
        return TechnicalObservation.neutral(RSI);
    }

    TechnicalObservation analyzeMacd(IndicatorSnapshot s) {
        IndicatorSnapshot.Macd macd = s.macd();
        if (macd == null) {
            return TechnicalObservation.neutral(MACD);
        }
        if (macd.line() > macd.signal()) {
            return new TechnicalObservation(MACD, Bias.LONG, macd.histogram() > 0 ? 20 : 15);
        }
        if (macd.line() < macd.signal()) {
            return new TechnicalObservation(MACD, Bias.SHORT, macd.histogram() < 0 ? 20 : 15);
        }
        return TechnicalObservation.neutral(MACD);
    }

    TechnicalObservation analyzeVolume(IndicatorSnapshot s) {
        if (s.volumeRatio() <= properties.getIndicators().getVolumeSpikeFactor()) {
            return TechnicalObservation.neutral(VOLUME);
        }
        if (s.change24h() > VOLUME_PRICE_MOVE_PCT) {
            return new TechnicalObservation(VOLUME, Bias.LONG, 15);
        }
        if (s.change24h() < -VOLUME_PRICE_MOVE_PCT) {
            return new TechnicalObservation(VOLUME, Bias.SHORT, 15);
        }
        return TechnicalObservation.neutral(VOLUME);
    }

    TechnicalObservation analyzeSupportResistance(IndicatorSnapshot s) {
        boolean nearSupport = isNearAny(s.price(), s.supportLevels());
        boolean nearResistance = isNearAny(s.price(), s.resistanceLevels());

        if (nearSupport && s.rsi() < 45) {
            return new TechnicalObservation(SUPPORT_RESISTANCE, Bias.LONG, 20);
        }
        if (nearResistance && s.rsi() > 55) {
            return new TechnicalObservation(SUPPORT_RESISTANCE, Bias.SHORT, 20);
        }
        if (nearSupport) {
            return new TechnicalObservation(SUPPORT_RESISTANCE, Bias.LONG, 15);
        }
        if (nearResistance) {
            return new TechnicalObservation(SUPPORT_RESISTANCE, Bias.SHORT, 15);
        }
        return TechnicalObservation.neutral(SUPPORT_RESISTANCE);
    }

    TechnicalObservation analyzeBollinger(IndicatorSnapshot s) {
        IndicatorSnapshot.BollingerBands bands = s.bollinger();
        if (bands == null) {
            return TechnicalObservation.neutral(BOLLINGER_BANDS);
        }
        if (s.price() <= bands.lower() * 1.01) {
            return new TechnicalObservation(BOLLINGER_BANDS, Bias.LONG, 15);
        }
        if (s.price() >= bands.upper() * 0.99) {
            return new TechnicalObservation(BOLLINGER_BANDS, Bias.SHORT, 15);
        }
        return TechnicalObservation.neutral(BOLLINGER_BANDS);
    }

    /**
     * Nudges the entry away from the current price: above it for longs, below it for shorts.
     */
    static double entryPrice(IndicatorSnapshot s, SignalDirection direction) {
        if (direction == SignalDirection.LONG) {
            return Math.max(s.price() * 1.001, s.emaFast() * 1.002);
        }
        if (direction == SignalDirection.SHORT) {
            return Math.min(s.price() * 0.999, s.emaFast() * 0.998);
        }
        return s.price();
    }

    private static boolean isNearAny(double price, List<Double> levels) {
        if (price <= 0) {
            return false;
        }
        return levels.stream().anyMatch(level -> Math.abs(price - level) / price < LEVEL_PROXIMITY);
    }

    private static String buildReasoning(List<TechnicalObservation> observations, MarketRegime regime, double totalWeight) {
        String strategy = switch (regime) {
            case NEUTRAL -> "Mean reversion in sideways market";
            case BULL -> "Momentum continuation in bull market";
            case BEAR -> "Trend following in bear market";
        };
        String indicators = observations.stream()
                .map(TechnicalObservation::indicator)
                .collect(Collectors.joining(", "));
        return String.format("%s: %s. Total weight: %.0f", strategy, indicators, totalWeight);
    }
}
