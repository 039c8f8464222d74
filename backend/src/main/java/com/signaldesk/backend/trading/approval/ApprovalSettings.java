package com.signaldesk.backend.trading.approval;

import com.signaldesk.backend.config.SignalDeskProperties;

/**
 * Runtime approval settings. Starts from configuration and can be changed through
 * {@link ApprovalWorkflow#updateSettings(java.util.Map)}.
 */
public record ApprovalSettings(boolean manualApproval, long approvalTimeoutMs, long defaultDelayMinutes) {

    public static ApprovalSettings from(SignalDeskProperties.Approval approval) {
        return new ApprovalSettings(approval.isManualApproval(), approval.getTimeoutMs(), approval.getDefaultDelayMinutes());
    }

    ApprovalSettings withManualApproval(boolean value) {
        return new ApprovalSettings(value, approvalTimeoutMs, defaultDelayMinutes);
    }

    ApprovalSettings withApprovalTimeoutMs(long value) {
        return new ApprovalSettings(manualApproval, value, defaultDelayMinutes);
    }

    ApprovalSettings withDefaultDelayMinutes(long value) {
        return new ApprovalSettings(manualApproval, approvalTimeoutMs, value);
    }
}
