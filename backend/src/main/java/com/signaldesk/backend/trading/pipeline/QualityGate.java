package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.config.SignalDeskProperties;
import com.signaldesk.backend.model.MarketContext;
import com.signaldesk.backend.model.MarketRegime;
import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.model.SignalDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Post-assembly filter. The threshold checks are stateless; the only state is the
 * per-symbol time of the last accepted signal, used for rate limiting. Times come
 * from a monotonic millisecond source, never from the wall clock.
 */
@Service
@Slf4j
public class QualityGate {

    private final SignalDeskProperties properties;
    private final LongSupplier monotonicMillis;
    private final Map<String, Long> lastAcceptedAt = new ConcurrentHashMap<>();

    @Autowired
    public QualityGate(SignalDeskProperties properties) {
        this(properties, () -> System.nanoTime() / 1_000_000L);
    }

    QualityGate(SignalDeskProperties properties, LongSupplier monotonicMillis) {
        this.properties = properties;
        this.monotonicMillis = monotonicMillis;
    }

    public GateDecision evaluate(Signal signal, MarketContext context) {
        SignalDeskProperties.Quality quality = properties.getQuality();
        List<String> reasons = new ArrayList<>();

        if (signal.getDirection() == null || !signal.getDirection().isTradable()) {
            reasons.add("HOLD signals are not tradable");
        }
        if (signal.getFinalConfidence() < quality.getMinConfidence()) {
            reasons.add(String.format(Locale.ROOT, "Confidence %.1f below minimum %.1f",
                    signal.getFinalConfidence(), quality.getMinConfidence()));
        }
        if (signal.getRiskRewardRatio() < quality.getMinRiskReward()) {
            reasons.add(String.format(Locale.ROOT, "Risk/reward %.2f below minimum %.2f",
                    signal.getRiskRewardRatio(), quality.getMinRiskReward()));
        }
        double maxLossAllowed = properties.getCapital().getMaxTradeAmount() * quality.getMaxLossFractionOfMaxTrade();
        if (signal.getMaxLoss() > maxLossAllowed) {
            reasons.add(String.format(Locale.ROOT, "Max loss %.2f exceeds limit %.2f", signal.getMaxLoss(), maxLossAllowed));
        }
        if (isCounterTrend(signal, context) && signal.getFinalConfidence() < quality.getCounterTrendMinConfidence()) {
            reasons.add(String.format(Locale.ROOT, "Counter-trend %s in %s regime needs confidence %.1f",
                    signal.getDirection(), context.regime(), quality.getCounterTrendMinConfidence()));
        }
        if (isTooSoon(signal.getSymbol())) {
            reasons.add("Signal too soon after last accepted signal for " + signal.getSymbol());
        }

        return reasons.isEmpty() ? GateDecision.accept() : GateDecision.reject(reasons);
    }

    /**
     * Evaluates the signal and, when accepted, records it as the symbol's latest
     * accepted signal. Two concurrent admissions for the same symbol cannot both pass.
     */
    public GateDecision admit(Signal signal, MarketContext context) {
        GateDecision decision = evaluate(signal, context);
        if (!decision.accepted()) {
            log.debug("Quality gate rejected {}: {}", signal.getId(), decision.reasons());
            return decision;
        }
        long now = monotonicMillis.getAsLong();
        long gapMillis = minGap().toMillis();
        AtomicBoolean recorded = new AtomicBoolean(false);
        lastAcceptedAt.compute(key(signal.getSymbol()), (symbol, last) -> {
            if (last != null && now - last < gapMillis) {
                return last;
            }
            recorded.set(true);
            return now;
        });
        if (!recorded.get()) {
            return GateDecision.reject("Signal too soon after last accepted signal for " + signal.getSymbol());
        }
        return decision;
    }

    public boolean isTooSoon(String symbol) {
        if (symbol == null) {
            return false;
        }
        Long last = lastAcceptedAt.get(key(symbol));
        if (last == null) {
            return false;
        }
        return monotonicMillis.getAsLong() - last < minGap().toMillis();
    }

    public void clear() {
        lastAcceptedAt.clear();
    }

    private boolean isCounterTrend(Signal signal, MarketContext context) {
        if (context == null || context.regime() == null) {
            return false;
        }
        return (context.regime() == MarketRegime.BEAR && signal.getDirection() == SignalDirection.LONG)
                || (context.regime() == MarketRegime.BULL && signal.getDirection() == SignalDirection.SHORT);
    }

    private Duration minGap() {
        return Duration.ofMinutes(properties.getQuality().getMinSignalGapMinutes());
    }

    private String key(String symbol) {
        return symbol.toUpperCase(Locale.ROOT);
    }
}
