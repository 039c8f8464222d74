package com.signaldesk.backend.trading.approval;

public record BulkApprovalResult(String signalId, String symbol, boolean approved) {}
