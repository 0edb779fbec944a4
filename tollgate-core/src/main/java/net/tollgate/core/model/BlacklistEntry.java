package net.tollgate.core.model;

import java.time.Instant;

public record BlacklistEntry(
        String instanceId,
        Instant expiresAt,
        int consecutiveFailures,
        String reason
) {
    public boolean expired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
