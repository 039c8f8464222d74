package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.model.Signal;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One registry entry. Every mutable field is guarded by the entry's own monitor;
 * {@link ApprovalWorkflow} holds it for each state transition.
 */
final class PendingApproval {

    private final Signal signal;
    private final Instant requestedAt;
    private final long requestedNanos;
    private final CompletableFuture<ApprovalOutcome> result = new CompletableFuture<>();

    private boolean resolved;
    private ScheduledFuture<?> timer;
    private long timerGeneration;
    private long deadlineNanos;
    private Instant deadline;
    private long armedMs;

    PendingApproval(Signal signal, Instant requestedAt, long requestedNanos) {
        this.signal = signal;
        this.requestedAt = requestedAt;
        this.requestedNanos = requestedNanos;
        this.deadlineNanos = requestedNanos;
        this.deadline = requestedAt;
    }

    Signal signal() {
        return signal;
    }

    String id() {
        return signal.getId();
    }

    Instant requestedAt() {
        return requestedAt;
    }

    CompletableFuture<ApprovalOutcome> result() {
        return result;
    }

    synchronized boolean isResolved() {
        return resolved;
    }

    synchronized Instant deadline() {
        return deadline;
    }

    synchronized long timerGeneration() {
        return timerGeneration;
    }

    /**
     * Length of the wait the current timer was armed with: the request timeout, or the last delay.
     */
    synchronized long armedMs() {
        return armedMs;
    }

    synchronized long timeRemainingMs(long nowNanos) {
        if (resolved) {
            return 0L;
        }
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - nowNanos));
    }

    long elapsedMs(long nowNanos) {
        return Math.max(0L, TimeUnit.NANOSECONDS.toMillis(nowNanos - requestedNanos));
    }

    /**
     * Starts a new timer generation. Callbacks carrying an older generation are stale.
     */
    synchronized long nextGeneration(long armedMs, long deadlineNanos, Instant deadline) {
        cancelTimer();
        this.armedMs = armedMs;
        this.deadlineNanos = deadlineNanos;
        this.deadline = deadline;
        return ++timerGeneration;
    }

    synchronized void attachTimer(long generation, ScheduledFuture<?> timer) {
        if (resolved || generation != timerGeneration) {
            timer.cancel(false);
            return;
        }
        this.timer = timer;
    }

    /**
     * Flips PENDING to RESOLVED and completes the waiting caller. Only the first call wins.
     */
    synchronized boolean resolve(ApprovalOutcome outcome) {
        if (resolved) {
            return false;
        }
        resolved = true;
        cancelTimer();
        result.complete(outcome);
        return true;
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }
}
