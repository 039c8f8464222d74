package com.signaldesk.backend.event;

import java.util.Map;

public record ApprovalSettingsUpdatedEvent(
        Map<String, Object> updated
) {
}
