package com.signaldesk.backend.event;

import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.trading.approval.ApprovalOutcome;

public record SignalApprovedEvent(
        Signal signal,
        ApprovalOutcome outcome
) {
}
