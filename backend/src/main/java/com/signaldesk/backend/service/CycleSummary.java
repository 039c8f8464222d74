package com.signaldesk.backend.service;

public record CycleSummary(
        boolean executed,
        int generated,
        int approved,
        int rejected,
        int timedOut
) {

    public static CycleSummary skipped() {
        return new CycleSummary(false, 0, 0, 0, 0);
    }
}
