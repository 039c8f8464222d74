package com.signaldesk.backend.trading.approval;

import java.time.Instant;

/**
 * Terminal result handed to the caller waiting on an approval request.
 */
public record ApprovalOutcome(
        boolean approved,
        ApprovalMethod method,
        String actorId,
        String reason,
        long processingTimeMs,
        Instant resolvedAt
) {

    public static ApprovalOutcome auto(Instant now) {
        return new ApprovalOutcome(true, ApprovalMethod.AUTO, null, "Manual approval disabled", 0L, now);
    }

    public boolean timedOut() {
        return method == ApprovalMethod.TIMEOUT;
    }
}
