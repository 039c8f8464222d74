package com.signaldesk.backend.trading.approval;

public enum ApprovalMethod {
    AUTO,
    MANUAL,
    TIMEOUT
}
