package com.signaldesk.backend.trading.pipeline;

import java.util.List;

public record GateDecision(
        boolean accepted,
        List<String> reasons
) {
    public static GateDecision accept() {
        return new GateDecision(true, List.of());
    }

    public static GateDecision reject(List<String> reasons) {
        return new GateDecision(false, List.copyOf(reasons));
    }

    public static GateDecision reject(String reason) {
        return new GateDecision(false, List.of(reason));
    }
}
