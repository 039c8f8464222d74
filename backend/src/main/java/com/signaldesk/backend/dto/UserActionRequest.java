package com.signaldesk.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either {@code callbackData} ("execute_BTC_1700000000000") or {@code action} plus {@code signalId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserActionRequest {

    private String callbackData;
    private String action;
    private String signalId;
    private String actorId;
}
