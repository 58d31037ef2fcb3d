package com.clapgrow.fleet.session.store;

import java.time.Instant;

public record StatsSnapshot(
    String tenantId,
    long commandsUsed,
    long messagesReceived,
    long groupsInteracted,
    Instant lastActiveAt
) {

    public static StatsSnapshot empty(String tenantId) {
        return new StatsSnapshot(tenantId, 0, 0, 0, null);
    }
}
