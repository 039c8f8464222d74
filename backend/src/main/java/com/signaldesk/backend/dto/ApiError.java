package com.signaldesk.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Error body for every non-2xx response. {@code requestId} matches the X-Request-Id header;
 * {@code details} only appears for field validation failures.
 */
@Builder
public record ApiError(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String requestId,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ApiErrorDetail> details
) {
}
