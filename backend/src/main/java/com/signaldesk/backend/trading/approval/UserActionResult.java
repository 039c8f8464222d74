package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.model.Signal;

public record UserActionResult(
        UserActionType action,
        String signalId,
        boolean success,
        Signal signal
) {}
