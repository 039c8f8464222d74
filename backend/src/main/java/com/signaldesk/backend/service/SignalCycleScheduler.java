package com.signaldesk.backend.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "signal-desk.scheduler.enabled", havingValue = "true")
public class SignalCycleScheduler {

    private final SignalCycleService signalCycleService;

    @Scheduled(fixedDelayString = "${signal-desk.scheduler.interval-seconds:300}000",
            initialDelayString = "${signal-desk.scheduler.interval-seconds:300}000")
    public void runCycle() {
        signalCycleService.runCycle();
    }
}
