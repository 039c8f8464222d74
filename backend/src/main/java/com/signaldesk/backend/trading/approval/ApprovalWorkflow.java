package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.config.SignalDeskProperties;
import com.signaldesk.backend.event.ApprovalRequestedEvent;
import com.signaldesk.backend.event.ApprovalSettingsUpdatedEvent;
import com.signaldesk.backend.event.EmergencyStopEvent;
import com.signaldesk.backend.event.SignalApprovedEvent;
import com.signaldesk.backend.event.SignalDelayedEvent;
import com.signaldesk.backend.event.SignalRejectedEvent;
import com.signaldesk.backend.event.SignalTimeoutEvent;
import com.signaldesk.backend.exception.BadRequestException;
import com.signaldesk.backend.model.RiskTier;
import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.model.SignalDirection;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Human-in-the-loop gate between signal generation and execution.
 * <p>
 * Each signal sent for approval becomes a {@link PendingApproval} keyed by signal id and
 * ends in exactly one of APPROVED, REJECTED or TIMED_OUT. Approve, reject, the deadline
 * timer, emergency stop and shutdown all race through the entry's monitor; the first one
 * to flip the entry removes it from the registry, cancels its timer and completes the
 * caller's future. Losers see {@code false} and publish nothing.
 * <p>
 * The request notification is published while the entry's monitor is held, so no outcome
 * for the same signal can be published before it. Outcome notifications are published once
 * the monitor is released.
 */
@Service
@Slf4j
public class ApprovalWorkflow {

    static final String SYSTEM_ACTOR = "system";
    static final String BULK_ACTOR = "bulk_system";
    static final String SHUTDOWN_REASON = "Approval workflow shut down";
    static final String DEFAULT_EMERGENCY_REASON = "Emergency stop";

    static final String SETTING_TIMEOUT = "approvalTimeoutMs";
    static final String SETTING_MANUAL = "manualApproval";
    static final String SETTING_DELAY = "defaultDelayMinutes";

    static final long MAX_DELAY_MINUTES = 1440;
    static final long MAX_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(MAX_DELAY_MINUTES);

    private final ApplicationEventPublisher eventPublisher;
    private final ScheduledExecutorService timerScheduler;
    private final Clock clock;

    private final Map<String, PendingApproval> registry = new ConcurrentHashMap<>();
    private volatile ApprovalSettings settings;
    private volatile boolean shutdown;

    @Autowired
    public ApprovalWorkflow(SignalDeskProperties properties,
                            ApplicationEventPublisher eventPublisher,
                            @Qualifier("approvalTimerScheduler") ScheduledExecutorService timerScheduler) {
        this(ApprovalSettings.from(properties.getApproval()), eventPublisher, timerScheduler, Clock.systemUTC());
    }

    ApprovalWorkflow(ApprovalSettings settings,
                     ApplicationEventPublisher eventPublisher,
                     ScheduledExecutorService timerScheduler,
                     Clock clock) {
        this.settings = settings;
        this.eventPublisher = eventPublisher;
        this.timerScheduler = timerScheduler;
        this.clock = clock;
    }

    /**
     * Sends a signal for approval. The returned future completes exactly once with the
     * terminal outcome; it is never completed exceptionally.
     * <p>
     * With manual approval disabled the signal is approved immediately and never enters
     * the registry. A second request for an id that is already pending returns a handle
     * on the existing request without re-arming its deadline.
     */
    public CompletableFuture<ApprovalOutcome> requestApproval(Signal signal) {
        Objects.requireNonNull(signal, "signal");
        ApprovalSettings current = settings;
        if (!current.manualApproval()) {
            log.info("✅ Auto-approved {} {} ({}%)", signal.getSymbol(), signal.getDirection(),
                    Math.round(signal.getFinalConfidence()));
            return CompletableFuture.completedFuture(ApprovalOutcome.auto(clock.instant()));
        }
        if (shutdown) {
            log.warn("⚠️ Approval requested for {} after shutdown", signal.getId());
            return CompletableFuture.completedFuture(shutdownOutcome(0L));
        }

        PendingApproval entry = new PendingApproval(signal, clock.instant(), System.nanoTime());
        PendingApproval existing = registry.putIfAbsent(signal.getId(), entry);
        if (existing != null) {
            log.warn("⚠️ Approval already pending for {}", signal.getId());
            return existing.result().copy();
        }

        synchronized (entry) {
            try {
                armTimer(entry, Duration.ofMillis(current.approvalTimeoutMs()));
            } catch (RejectedExecutionException ex) {
                log.warn("⚠️ Timer rejected for {}, workflow is shutting down", signal.getId());
                resolveQuietly(entry, shutdownOutcome(entry.elapsedMs(System.nanoTime())));
            }
            // shutdown may have swept the registry between the check above and the insert
            if (shutdown) {
                resolveQuietly(entry, shutdownOutcome(entry.elapsedMs(System.nanoTime())));
            }
            if (!entry.isResolved()) {
                log.info("📨 Approval requested: {} {} ({}%) | timeout {}ms", signal.getSymbol(),
                        signal.getDirection(), Math.round(signal.getFinalConfidence()), current.approvalTimeoutMs());
                // outcome events need this monitor, so none of them can overtake the request
                publish(new ApprovalRequestedEvent(signal, entry.requestedAt(), entry.deadline()));
            }
        }
        return entry.result().copy();
    }

    /**
     * Blocking form of {@link #requestApproval(Signal)}.
     */
    public ApprovalOutcome awaitApproval(Signal signal) {
        return requestApproval(signal).join();
    }

    public boolean approve(String signalId, String actorId, String reason) {
        PendingApproval entry = registry.get(signalId);
        if (entry == null) {
            log.warn("⚠️ Attempted to approve non-pending signal: {}", signalId);
            return false;
        }
        ApprovalOutcome outcome = resolve(entry, true, ApprovalMethod.MANUAL, actorOrSystem(actorId), reason);
        if (outcome == null) {
            log.warn("⚠️ Attempted to approve non-pending signal: {}", signalId);
            return false;
        }
        log.info("✅ Signal approved: {} {} by {}", entry.signal().getSymbol(), entry.signal().getDirection(),
                outcome.actorId());
        publish(new SignalApprovedEvent(entry.signal(), outcome));
        return true;
    }

    public boolean reject(String signalId, String actorId, String reason) {
        PendingApproval entry = registry.get(signalId);
        if (entry == null) {
            log.warn("⚠️ Attempted to reject non-pending signal: {}", signalId);
            return false;
        }
        ApprovalOutcome outcome = resolve(entry, false, ApprovalMethod.MANUAL, actorOrSystem(actorId), reason);
        if (outcome == null) {
            log.warn("⚠️ Attempted to reject non-pending signal: {}", signalId);
            return false;
        }
        log.info("❌ Signal rejected: {} {} by {}", entry.signal().getSymbol(), entry.signal().getDirection(),
                outcome.actorId());
        publish(new SignalRejectedEvent(entry.signal(), outcome));
        return true;
    }

    public boolean delay(String signalId, long extraMinutes, String actorId) {
        if (extraMinutes > MAX_DELAY_MINUTES) {
            throw new BadRequestException("Delay must not exceed " + MAX_DELAY_MINUTES + " minutes");
        }
        return delay(signalId, Duration.ofMinutes(extraMinutes), actorId);
    }

    /**
     * Replaces the deadline of a pending approval with {@code now + extra}. The signal stays pending.
     */
    public boolean delay(String signalId, Duration extra, String actorId) {
        if (extra == null || extra.isNegative() || extra.isZero()) {
            throw new BadRequestException("Delay must be positive");
        }
        if (extra.compareTo(Duration.ofMinutes(MAX_DELAY_MINUTES)) > 0) {
            throw new BadRequestException("Delay must not exceed " + MAX_DELAY_MINUTES + " minutes");
        }
        PendingApproval entry = registry.get(signalId);
        if (entry == null) {
            log.warn("⚠️ Attempted to delay non-pending signal: {}", signalId);
            return false;
        }
        Instant newDeadline;
        synchronized (entry) {
            if (entry.isResolved() || shutdown) {
                log.warn("⚠️ Attempted to delay non-pending signal: {}", signalId);
                return false;
            }
            try {
                armTimer(entry, extra);
            } catch (RejectedExecutionException ex) {
                log.warn("⚠️ Timer rejected for {}, workflow is shutting down", signalId);
                return false;
            }
            newDeadline = entry.deadline();
        }
        String actor = actorOrSystem(actorId);
        log.info("⏰ Signal delayed: {} {} for {} by {}", entry.signal().getSymbol(), entry.signal().getDirection(),
                extra, actor);
        publish(new SignalDelayedEvent(entry.signal(), extra.toMinutes(), actor, newDeadline));
        return true;
    }

    /**
     * Rejects everything currently pending with {@code reason} and publishes one summary event.
     */
    public List<EmergencyRejection> emergencyRejectAll(String reason) {
        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_EMERGENCY_REASON : reason;
        List<String> ids = new ArrayList<>(registry.keySet());
        log.warn("🚨 Emergency rejection of {} pending signals: {}", ids.size(), effectiveReason);

        List<EmergencyRejection> results = new ArrayList<>(ids.size());
        int rejected = 0;
        for (String id : ids) {
            boolean success = reject(id, SYSTEM_ACTOR, effectiveReason);
            if (success) {
                rejected++;
            }
            results.add(new EmergencyRejection(id, success));
        }
        publish(new EmergencyStopEvent(effectiveReason, rejected, clock.instant()));
        return results;
    }

    /**
     * Approves every pending signal matching all constraints of {@code criteria}.
     * Non-matching approvals are left untouched and are not listed in the result.
     */
    public List<BulkApprovalResult> bulkApprove(BulkApprovalCriteria criteria) {
        BulkApprovalCriteria effective = criteria != null ? criteria : BulkApprovalCriteria.any();
        List<BulkApprovalResult> results = new ArrayList<>();
        for (PendingApproval entry : new ArrayList<>(registry.values())) {
            Signal signal = entry.signal();
            if (!effective.matches(signal)) {
                continue;
            }
            boolean approved = approve(signal.getId(), BULK_ACTOR, "Bulk approval");
            results.add(new BulkApprovalResult(signal.getId(), signal.getSymbol(), approved));
        }
        log.info("🔄 Bulk approval completed: {} signals processed", results.size());
        return results;
    }

    public Optional<Signal> getSignalDetails(String signalId) {
        return Optional.ofNullable(registry.get(signalId)).map(PendingApproval::signal);
    }

    public List<PendingApprovalView> getPendingApprovals() {
        long now = System.nanoTime();
        return registry.values().stream()
                .sorted(Comparator.comparing(PendingApproval::requestedAt))
                .map(entry -> new PendingApprovalView(
                        entry.id(),
                        entry.signal().getSymbol(),
                        entry.signal().getDirection(),
                        entry.signal().getFinalConfidence(),
                        entry.requestedAt(),
                        entry.timeRemainingMs(now)))
                .toList();
    }

    public long getTimeRemaining(String signalId) {
        PendingApproval entry = registry.get(signalId);
        return entry == null ? 0L : entry.timeRemainingMs(System.nanoTime());
    }

    public QueueStatus getQueueStatus() {
        List<PendingApproval> entries = new ArrayList<>(registry.values());
        Map<SignalDirection, Long> byDirection = new EnumMap<>(SignalDirection.class);
        Map<RiskTier, Long> byRiskTier = new EnumMap<>(RiskTier.class);
        double confidenceSum = 0;
        Instant oldest = null;
        for (PendingApproval entry : entries) {
            Signal signal = entry.signal();
            byDirection.merge(signal.getDirection(), 1L, Long::sum);
            if (signal.getRiskTier() != null) {
                byRiskTier.merge(signal.getRiskTier(), 1L, Long::sum);
            }
            confidenceSum += signal.getFinalConfidence();
            if (oldest == null || entry.requestedAt().isBefore(oldest)) {
                oldest = entry.requestedAt();
            }
        }
        double avgConfidence = entries.isEmpty() ? 0.0 : confidenceSum / entries.size();
        return new QueueStatus(entries.size(), byDirection, byRiskTier, avgConfidence, oldest);
    }

    public int pendingCount() {
        return registry.size();
    }

    public ApprovalSettings getSettings() {
        return settings;
    }

    /**
     * Applies the allow-listed keys of {@code changes}; other keys are ignored. Nothing is
     * applied when any allowed value is invalid. A new timeout applies to later requests only.
     *
     * @return the keys that were applied, with their coerced values
     */
    public Map<String, Object> updateSettings(Map<String, ?> changes) {
        Map<String, Object> applied = new LinkedHashMap<>();
        synchronized (this) {
            ApprovalSettings next = settings;
            if (changes != null) {
                for (Map.Entry<String, ?> change : changes.entrySet()) {
                    String key = change.getKey();
                    Object value = change.getValue();
                    switch (key) {
                        case SETTING_TIMEOUT -> {
                            long timeoutMs = positiveLong(key, value, MAX_TIMEOUT_MS);
                            next = next.withApprovalTimeoutMs(timeoutMs);
                            applied.put(key, timeoutMs);
                        }
                        case SETTING_MANUAL -> {
                            boolean manual = toBoolean(key, value);
                            next = next.withManualApproval(manual);
                            applied.put(key, manual);
                        }
                        case SETTING_DELAY -> {
                            long minutes = positiveLong(key, value, MAX_DELAY_MINUTES);
                            next = next.withDefaultDelayMinutes(minutes);
                            applied.put(key, minutes);
                        }
                        default -> log.debug("Ignoring unsupported approval setting: {}", key);
                    }
                }
            }
            settings = next;
        }
        log.info("⚙️ Approval settings updated: {}", applied);
        publish(new ApprovalSettingsUpdatedEvent(Map.copyOf(applied)));
        return applied;
    }

    /**
     * Rejects every pending approval with a shutdown reason, stops the timer thread and
     * publishes nothing afterwards. Later requests resolve immediately as rejected.
     */
    @PreDestroy
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        List<PendingApproval> entries = new ArrayList<>(registry.values());
        long now = System.nanoTime();
        for (PendingApproval entry : entries) {
            resolveQuietly(entry, shutdownOutcome(entry.elapsedMs(now)));
        }
        registry.clear();
        timerScheduler.shutdownNow();
        log.info("🛑 Approval workflow stopped, {} pending approvals rejected", entries.size());
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private void armTimer(PendingApproval entry, Duration delay) {
        long delayMs = delay.toMillis();
        long generation = entry.nextGeneration(delayMs, System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs),
                clock.instant().plusMillis(delayMs));
        ScheduledFuture<?> timer = timerScheduler.schedule(() -> onDeadline(entry, generation),
                delayMs, TimeUnit.MILLISECONDS);
        entry.attachTimer(generation, timer);
    }

    private void onDeadline(PendingApproval entry, long generation) {
        ApprovalOutcome outcome;
        synchronized (entry) {
            if (entry.isResolved() || entry.timerGeneration() != generation) {
                return;
            }
            long elapsedMs = entry.elapsedMs(System.nanoTime());
            outcome = new ApprovalOutcome(false, ApprovalMethod.TIMEOUT, null,
                    "approval timeout after " + entry.armedMs() + "ms", elapsedMs, clock.instant());
            if (!complete(entry, outcome)) {
                return;
            }
        }
        log.warn("⏰ Signal approval timeout: {} {}", entry.signal().getSymbol(), entry.signal().getDirection());
        publish(new SignalTimeoutEvent(entry.signal(), outcome));
    }

    private ApprovalOutcome resolve(PendingApproval entry, boolean approved, ApprovalMethod method,
                                    String actorId, String reason) {
        synchronized (entry) {
            if (entry.isResolved()) {
                return null;
            }
            long elapsedMs = entry.elapsedMs(System.nanoTime());
            ApprovalOutcome outcome = new ApprovalOutcome(approved, method, actorId, reason, elapsedMs, clock.instant());
            return complete(entry, outcome) ? outcome : null;
        }
    }

    private void resolveQuietly(PendingApproval entry, ApprovalOutcome outcome) {
        synchronized (entry) {
            complete(entry, outcome);
        }
    }

    // caller holds the entry's monitor; the entry leaves the registry before its caller wakes up
    private boolean complete(PendingApproval entry, ApprovalOutcome outcome) {
        if (entry.isResolved()) {
            return false;
        }
        registry.remove(entry.id(), entry);
        return entry.resolve(outcome);
    }

    private ApprovalOutcome shutdownOutcome(long elapsedMs) {
        return new ApprovalOutcome(false, ApprovalMethod.MANUAL, SYSTEM_ACTOR, SHUTDOWN_REASON, elapsedMs,
                clock.instant());
    }

    private void publish(Object event) {
        if (shutdown) {
            return;
        }
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException ex) {
            log.warn("⚠️ Approval event listener failed for {}: {}", event.getClass().getSimpleName(), ex.getMessage(), ex);
        }
    }

    private static String actorOrSystem(String actorId) {
        return actorId == null || actorId.isBlank() ? SYSTEM_ACTOR : actorId;
    }

    private static long positiveLong(String key, Object value, long max) {
        long parsed;
        if (value instanceof Number number) {
            parsed = number.longValue();
        } else if (value instanceof String text) {
            try {
                parsed = Long.parseLong(text.trim());
            } catch (NumberFormatException ex) {
                throw new BadRequestException("Invalid value for " + key + ": " + text);
            }
        } else {
            throw new BadRequestException("Invalid value for " + key + ": " + value);
        }
        if (parsed <= 0) {
            throw new BadRequestException(key + " must be positive");
        }
        if (parsed > max) {
            throw new BadRequestException(key + " must not exceed " + max);
        }
        return parsed;
    }

    private static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized) || "false".equals(normalized)) {
                return Boolean.parseBoolean(normalized);
            }
        }
        throw new BadRequestException("Invalid value for " + key + ": " + value);
    }
}
