package io.coordmesh.model;

import java.time.Duration;
import java.time.Instant;

public record LockRecord(
        String resource,
        String ownerAgentId,
        Instant acquiredAt,
        Instant expiresAt,
        String reason
) {
    /**
     * A lease is live strictly before {@code expires_at}.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isOwnedBy(String agentId) {
        return ownerAgentId != null && ownerAgentId.equals(agentId);
    }

    public long remainingMs(Instant now) {
        return Math.max(0L, Duration.between(now, expiresAt).toMillis());
    }

    public LockRecord refreshed(Instant nextExpiresAt, String nextReason) {
        return new LockRecord(resource, ownerAgentId, acquiredAt, nextExpiresAt, nextReason == null ? reason : nextReason);
    }
}
