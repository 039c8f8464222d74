package com.signaldesk.backend.trading.approval;

public record EmergencyRejection(String signalId, boolean success) {}
