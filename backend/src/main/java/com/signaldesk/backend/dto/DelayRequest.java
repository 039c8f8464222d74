package com.signaldesk.backend.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DelayRequest {

    // falls back to the configured default delay when absent
    @Positive
    @Max(1440)
    private Long minutes;

    private String actorId;
}
