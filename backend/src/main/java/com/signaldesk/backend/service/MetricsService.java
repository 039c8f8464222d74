package com.signaldesk.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong signalsGenerated = new AtomicLong();
    private final AtomicLong gateRejections = new AtomicLong();

    private Counter approvalsRequestedCounter;
    private Counter approvalsApprovedCounter;
    private Counter approvalsRejectedCounter;
    private Counter approvalsTimedOutCounter;
    private Counter approvalsDelayedCounter;
    private Counter emergencyStopsCounter;

    private volatile IntSupplier pendingApprovalsSource = () -> 0;

    @PostConstruct
    void init() {
        approvalsRequestedCounter = Counter.builder("approvals_requested_total").register(meterRegistry);
        approvalsApprovedCounter = Counter.builder("approvals_approved_total").register(meterRegistry);
        approvalsRejectedCounter = Counter.builder("approvals_rejected_total").register(meterRegistry);
        approvalsTimedOutCounter = Counter.builder("approvals_timed_out_total").register(meterRegistry);
        approvalsDelayedCounter = Counter.builder("approvals_delayed_total").register(meterRegistry);
        emergencyStopsCounter = Counter.builder("emergency_stops_total").register(meterRegistry);
        Gauge.builder("pending_approvals", this, MetricsService::getPendingApprovals).register(meterRegistry);
    }

    /**
     * Points the pending gauge at the live approval registry.
     */
    public void bindPendingApprovals(IntSupplier source) {
        pendingApprovalsSource = source;
    }

    public void recordApprovalRequested() {
        increment(approvalsRequestedCounter);
    }

    public void recordApproved() {
        increment(approvalsApprovedCounter);
    }

    public void recordRejected() {
        increment(approvalsRejectedCounter);
    }

    public void recordTimedOut() {
        increment(approvalsTimedOutCounter);
    }

    public void recordDelayed() {
        increment(approvalsDelayedCounter);
    }

    public void recordEmergencyStop() {
        increment(emergencyStopsCounter);
    }

    public void recordSignalsGenerated(int count) {
        signalsGenerated.addAndGet(count);
        Counter.builder("signals_generated_total")
                .register(meterRegistry)
                .increment(count);
    }

    public void recordGateRejection() {
        gateRejections.incrementAndGet();
        Counter.builder("signals_rejected_total")
                .tag("stage", "quality_gate")
                .register(meterRegistry)
                .increment();
    }

    public int getPendingApprovals() {
        return pendingApprovalsSource.getAsInt();
    }

    public long getSignalsGenerated() {
        return signalsGenerated.get();
    }

    public long getGateRejections() {
        return gateRejections.get();
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
