package com.signaldesk.backend.controller;

import com.signaldesk.backend.dto.MessageResponse;
import com.signaldesk.backend.service.SignalCycleService;
import com.signaldesk.backend.trading.pipeline.SignalGenerationService;
import com.signaldesk.backend.trading.pipeline.SignalStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
@Tag(name = "Signals")
public class SignalsController {

    private final SignalCycleService signalCycleService;
    private final SignalGenerationService signalGenerationService;

    @PostMapping("/scan-now")
    @Operation(summary = "Trigger a signal cycle")
    public ResponseEntity<MessageResponse> scanNow() {
        if (!signalCycleService.triggerCycle()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new MessageResponse("Cycle already running"));
        }
        log.info("🔍 Manual signal cycle triggered");
        return ResponseEntity.accepted().body(new MessageResponse("Scan triggered"));
    }

    @GetMapping("/stats")
    @Operation(summary = "Statistics over recently accepted signals")
    public SignalStats stats() {
        return signalGenerationService.getSignalStats();
    }
}
