package com.signaldesk.backend.trading.pipeline;

import com.signaldesk.backend.config.SignalDeskProperties;
import com.signaldesk.backend.exception.SignalGenerationException;
import com.signaldesk.backend.model.IndicatorSnapshot;
import com.signaldesk.backend.model.MarketContext;
import com.signaldesk.backend.model.QualitativeAssessment;
import com.signaldesk.backend.model.RiskTier;
import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.model.SignalDirection;
import com.signaldesk.backend.model.TechnicalSignal;
import com.signaldesk.backend.service.MetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Service
@Slf4j
@RequiredArgsConstructor
public class SignalGenerationService {

    private static final int HISTORY_LIMIT = 500;
    private static final int RECENT_LIMIT = 10;

    private final SignalDeskProperties properties;
    private final MarketContextProvider marketContextProvider;
    private final IndicatorSnapshotProvider snapshotProvider;
    private final QualitativeAssessor qualitativeAssessor;
    private final IndicatorAggregator indicatorAggregator;
    private final SignalAssembler signalAssembler;
    private final QualityGate qualityGate;
    private final MetricsService metricsService;
    @Qualifier("signalExecutor")
    private final Executor signalExecutor;

    private final Deque<Signal> history = new ArrayDeque<>();

    /**
     * Runs every configured symbol concurrently and waits for all of them. A symbol
     * that fails is logged and skipped; the rest still produce signals.
     *
     * @return accepted signals, highest confidence first
     */
    public List<Signal> generateSignals() {
        MarketContext context = marketContextProvider.currentContext();
        List<String> symbols = properties.getSymbols();
        log.info("🔍 Generating signals | regime: {} | symbols: {}", context.regime(), symbols.size());

        List<CompletableFuture<Optional<Signal>>> futures = symbols.stream()
                .map(symbol -> CompletableFuture.supplyAsync(() -> generateForSymbol(symbol, context), signalExecutor)
                        .exceptionally(ex -> {
                            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                            log.warn("⚠️ Failed to generate signal for {}: {}", symbol, cause.getMessage());
                            return Optional.empty();
                        }))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<Signal> signals = new ArrayList<>();
        for (CompletableFuture<Optional<Signal>> future : futures) {
            future.join().ifPresent(signals::add);
        }
        signals.sort(Comparator.comparingDouble(Signal::getFinalConfidence).reversed());
        log.info("✅ Generated {} quality signals", signals.size());
        return signals;
    }

    /**
     * Full scoring path for one symbol. Empty when the symbol produces nothing this
     * cycle; a failing qualitative assessment surfaces as {@link SignalGenerationException}.
     */
    public Optional<Signal> generateForSymbol(String symbol, MarketContext context) {
        if (qualityGate.isTooSoon(symbol)) {
            log.debug("Skipping {}: too soon after last accepted signal", symbol);
            return Optional.empty();
        }
        Optional<IndicatorSnapshot> snapshot = snapshotProvider.getSnapshot(symbol);
        if (snapshot.isEmpty()) {
            log.debug("No indicator data for {}", symbol);
            return Optional.empty();
        }

        TechnicalSignal technical = indicatorAggregator.aggregate(snapshot.get(), context);
        if (!technical.direction().isTradable()) {
            return Optional.empty();
        }

        QualitativeAssessment assessment;
        try {
            assessment = qualitativeAssessor.assess(symbol, technical, context);
        } catch (RuntimeException ex) {
            throw new SignalGenerationException("Qualitative assessment failed for " + symbol, ex);
        }
        if (assessment == null) {
            throw new SignalGenerationException("Qualitative assessment returned nothing for " + symbol);
        }

        Signal signal = signalAssembler.assemble(technical, assessment, context);
        if (signal == null) {
            return Optional.empty();
        }
        GateDecision decision = qualityGate.admit(signal, context);
        if (!decision.accepted()) {
            metricsService.recordGateRejection();
            log.info("🚫 {} {} filtered: {}", signal.getSymbol(), signal.getDirection(), decision.reasons());
            return Optional.empty();
        }
        record(signal);
        return Optional.of(signal);
    }

    public SignalStats getSignalStats() {
        List<Signal> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        Map<SignalDirection, Long> byDirection = new EnumMap<>(SignalDirection.class);
        Map<RiskTier, Long> byRiskTier = new EnumMap<>(RiskTier.class);
        double confidenceSum = 0;
        for (Signal signal : snapshot) {
            byDirection.merge(signal.getDirection(), 1L, Long::sum);
            byRiskTier.merge(signal.getRiskTier(), 1L, Long::sum);
            confidenceSum += signal.getFinalConfidence();
        }
        double avgConfidence = snapshot.isEmpty() ? 0.0 : confidenceSum / snapshot.size();
        List<Signal> recent = snapshot.subList(Math.max(0, snapshot.size() - RECENT_LIMIT), snapshot.size());
        return new SignalStats(snapshot.size(), byDirection, byRiskTier, avgConfidence, List.copyOf(recent));
    }

    private void record(Signal signal) {
        synchronized (history) {
            history.addLast(signal);
            while (history.size() > HISTORY_LIMIT) {
                history.removeFirst();
            }
        }
    }
}
