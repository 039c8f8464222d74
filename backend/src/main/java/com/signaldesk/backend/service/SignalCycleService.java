package com.signaldesk.backend.service;

import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.trading.approval.ApprovalOutcome;
import com.signaldesk.backend.trading.approval.ApprovalWorkflow;
import com.signaldesk.backend.trading.pipeline.SignalGenerationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One trading cycle: generate signals, send each for approval and wait for every outcome.
 * Cycles never overlap.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SignalCycleService {

    private final SignalGenerationService signalGenerationService;
    private final ApprovalWorkflow approvalWorkflow;
    private final MetricsService metricsService;
    @Qualifier("cycleExecutor")
    private final Executor cycleExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public CycleSummary runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.info("⏭️ Signal cycle already running, skipping");
            return CycleSummary.skipped();
        }
        try {
            List<Signal> signals = signalGenerationService.generateSignals();
            metricsService.recordSignalsGenerated(signals.size());
            if (signals.isEmpty()) {
                log.info("💤 No signals this cycle");
                return new CycleSummary(true, 0, 0, 0, 0);
            }

            List<CompletableFuture<ApprovalOutcome>> outcomes = signals.stream()
                    .map(approvalWorkflow::requestApproval)
                    .toList();
            CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0])).join();

            int approved = 0;
            int rejected = 0;
            int timedOut = 0;
            for (int i = 0; i < signals.size(); i++) {
                Signal signal = signals.get(i);
                ApprovalOutcome outcome = outcomes.get(i).join();
                if (outcome.approved()) {
                    approved++;
                    log.info("🚀 {} {} cleared for execution ({})", signal.getSymbol(), signal.getDirection(),
                            outcome.method());
                } else if (outcome.timedOut()) {
                    timedOut++;
                } else {
                    rejected++;
                }
            }
            log.info("📊 Cycle complete | signals: {} | approved: {} | rejected: {} | timed out: {}",
                    signals.size(), approved, rejected, timedOut);
            return new CycleSummary(true, signals.size(), approved, rejected, timedOut);
        } catch (RuntimeException ex) {
            log.error("❌ Signal cycle failed: {}", ex.getMessage(), ex);
            throw ex;
        } finally {
            running.set(false);
        }
    }

    /**
     * Starts a cycle in the background.
     *
     * @return {@code false} when a cycle is already in progress
     */
    public boolean triggerCycle() {
        if (running.get()) {
            return false;
        }
        try {
            cycleExecutor.execute(this::runCycle);
        } catch (RejectedExecutionException ex) {
            log.info("⏭️ Signal cycle already queued");
            return false;
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }
}
