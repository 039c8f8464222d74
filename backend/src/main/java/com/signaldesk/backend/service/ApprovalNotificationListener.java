package com.signaldesk.backend.service;

import com.signaldesk.backend.event.ApprovalRequestedEvent;
import com.signaldesk.backend.event.ApprovalSettingsUpdatedEvent;
import com.signaldesk.backend.event.EmergencyStopEvent;
import com.signaldesk.backend.event.SignalApprovedEvent;
import com.signaldesk.backend.event.SignalDelayedEvent;
import com.signaldesk.backend.event.SignalRejectedEvent;
import com.signaldesk.backend.event.SignalTimeoutEvent;
import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.trading.approval.ApprovalWorkflow;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Default consumer of approval notifications: one log line per event plus counters. The
 * pending gauge reads the workflow's registry directly.
 * A chat transport plugs in as another listener on the same events.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalNotificationListener {

    private final MetricsService metricsService;
    private final ApprovalWorkflow approvalWorkflow;

    @PostConstruct
    void bindPendingGauge() {
        metricsService.bindPendingApprovals(approvalWorkflow::pendingCount);
    }

    @EventListener
    public void onApprovalRequested(ApprovalRequestedEvent event) {
        metricsService.recordApprovalRequested();
        log.info("🔔 Approval needed: {} | deadline {}", describe(event.signal()), event.deadline());
    }

    @EventListener
    public void onApproved(SignalApprovedEvent event) {
        metricsService.recordApproved();
        log.info("🔔 Approved: {} | by {} in {}ms", describe(event.signal()), event.outcome().actorId(),
                event.outcome().processingTimeMs());
    }

    @EventListener
    public void onRejected(SignalRejectedEvent event) {
        metricsService.recordRejected();
        log.info("🔔 Rejected: {} | by {} | {}", describe(event.signal()), event.outcome().actorId(),
                event.outcome().reason());
    }

    @EventListener
    public void onDelayed(SignalDelayedEvent event) {
        metricsService.recordDelayed();
        log.info("🔔 Delayed: {} | {} min by {}", describe(event.signal()), event.delayMinutes(), event.actorId());
    }

    @EventListener
    public void onTimeout(SignalTimeoutEvent event) {
        metricsService.recordTimedOut();
        log.warn("🔔 Timed out: {} | {}", describe(event.signal()), event.outcome().reason());
    }

    @EventListener
    public void onEmergencyStop(EmergencyStopEvent event) {
        metricsService.recordEmergencyStop();
        log.warn("🚨 Emergency stop: {} | {} approvals rejected", event.reason(), event.count());
    }

    @EventListener
    public void onSettingsUpdated(ApprovalSettingsUpdatedEvent event) {
        log.info("⚙️ Approval settings now: {}", event.updated());
    }

    private static String describe(Signal signal) {
        return String.format("%s %s @ %.4f (%.0f%%, %s risk)", signal.getSymbol(), signal.getDirection(),
                signal.getEntryPrice(), signal.getFinalConfidence(), signal.getRiskTier());
    }
}
