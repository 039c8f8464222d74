package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.model.RiskTier;
import com.signaldesk.backend.model.Signal;
import com.signaldesk.backend.model.SignalDirection;

import java.util.Set;

/**
 * Filters for {@link ApprovalWorkflow#bulkApprove(BulkApprovalCriteria)}. A null or empty
 * field places no constraint; a signal must satisfy every constraint that is set.
 */
public record BulkApprovalCriteria(
        Double minConfidence,
        Set<SignalDirection> directions,
        Set<RiskTier> riskTiers
) {

    public static BulkApprovalCriteria any() {
        return new BulkApprovalCriteria(null, null, null);
    }

    public boolean matches(Signal signal) {
        if (minConfidence != null && signal.getFinalConfidence() < minConfidence) {
            return false;
        }
        if (directions != null && !directions.isEmpty() && !directions.contains(signal.getDirection())) {
            return false;
        }
        return riskTiers == null || riskTiers.isEmpty() || riskTiers.contains(signal.getRiskTier());
    }
}
