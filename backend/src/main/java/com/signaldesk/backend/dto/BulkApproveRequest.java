package com.signaldesk.backend.dto;

import com.signaldesk.backend.model.RiskTier;
import com.signaldesk.backend.model.SignalDirection;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkApproveRequest {

    @DecimalMin("0")
    @DecimalMax("100")
    private Double minConfidence;

    private Set<SignalDirection> directions;

    private Set<RiskTier> riskTiers;
}
