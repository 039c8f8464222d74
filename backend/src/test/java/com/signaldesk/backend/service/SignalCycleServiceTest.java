package com.signaldesk.backend.service;

import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.trading.approval.ApprovalMethod;
import com.signaldesk.backend.trading.approval.ApprovalOutcome;
import com.signaldesk.backend.trading.approval.ApprovalWorkflow;
import com.signaldesk.backend.trading.pipeline.SignalGenerationService;
import com.signaldesk.backend.util.TestSignalFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignalCycleServiceTest {

    private SignalGenerationService signalGenerationService;
    private ApprovalWorkflow approvalWorkflow;
    private MetricsService metricsService;
    private SignalCycleService service;

    @BeforeEach
    void setUp() {
        signalGenerationService = mock(SignalGenerationService.class);
        approvalWorkflow = mock(ApprovalWorkflow.class);
        metricsService = new MetricsService(new SimpleMeterRegistry());
        service = new SignalCycleService(signalGenerationService, approvalWorkflow, metricsService, Runnable::run);
    }

    @Test
    void cycleCountsEveryOutcome() {
        Signal btc = TestSignalFactory.longSignal("BTC_1", 90);
        Signal eth = TestSignalFactory.longSignal("ETH_1", 85);
        Signal sol = TestSignalFactory.longSignal("SOL_1", 80);
        when(signalGenerationService.generateSignals()).thenReturn(List.of(btc, eth, sol));
        when(approvalWorkflow.requestApproval(btc)).thenReturn(completed(true, ApprovalMethod.MANUAL));
        when(approvalWorkflow.requestApproval(eth)).thenReturn(completed(false, ApprovalMethod.MANUAL));
        when(approvalWorkflow.requestApproval(sol)).thenReturn(completed(false, ApprovalMethod.TIMEOUT));

        CycleSummary summary = service.runCycle();

        assertThat(summary).isEqualTo(new CycleSummary(true, 3, 1, 1, 1));
        assertThat(metricsService.getSignalsGenerated()).isEqualTo(3);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void emptyCycleNeverTouchesApprovals() {
        when(signalGenerationService.generateSignals()).thenReturn(List.of());

        CycleSummary summary = service.runCycle();

        assertThat(summary.executed()).isTrue();
        assertThat(summary.generated()).isZero();
        verify(approvalWorkflow, never()).requestApproval(any());
    }

    @Test
    void cyclesDoNotOverlap() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(signalGenerationService.generateSignals()).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });

        Thread first = new Thread(service::runCycle);
        first.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(service.runCycle()).isEqualTo(CycleSummary.skipped());
        assertThat(service.triggerCycle()).isFalse();

        release.countDown();
        first.join(5_000);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void triggerRunsCycleOnExecutor() {
        when(signalGenerationService.generateSignals()).thenReturn(List.of());

        assertThat(service.triggerCycle()).isTrue();

        verify(signalGenerationService).generateSignals();
    }

    private static CompletableFuture<ApprovalOutcome> completed(boolean approved, ApprovalMethod method) {
        return CompletableFuture.completedFuture(new ApprovalOutcome(approved, method, "tester", "test", 5L, Instant.now()));
    }
}
