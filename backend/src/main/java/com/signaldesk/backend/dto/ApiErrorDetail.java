package com.signaldesk.backend.dto;

import lombok.Builder;

@Builder
public record ApiErrorDetail(String field, String issue) {
}
