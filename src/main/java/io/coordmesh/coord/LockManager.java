package io.coordmesh.coord;

import io.coordmesh.model.EventAction;
import io.coordmesh.model.LockRecord;
import io.coordmesh.storage.RecordKind;
import io.coordmesh.storage.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lease-based exclusive locks keyed by resource name.
 *
 * <p>Expiry is evaluated lazily with {@link LockRecord#isExpired(Instant)} whenever a lock is
 * touched; nothing runs in the background. Every decision re-reads the store first.
 */
public final class LockManager {
    public static final String REASON_UNLOCK = "unlock";
    public static final String REASON_LEASE_EXPIRED = "lease_expired";
    public static final String REASON_STALE_AGENT = "stale_agent_cleanup";

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final Store store;
    private final EventLog events;
    private final Clock clock;
    private final Duration leaseTtl;

    public LockManager(Store store, EventLog events, Clock clock, Duration leaseTtl) {
        this.store = store;
        this.events = events;
        this.clock = clock;
        this.leaseTtl = leaseTtl;
    }

    public LockOutcome lock(String agentId, String resource, String reason) {
        Instant now = clock.instant();
        Optional<LockRecord> current = liveLock(resource, now);

        if (current.isEmpty()) {
            LockRecord granted = new LockRecord(resource, agentId, now, now.plus(leaseTtl), blankToNull(reason));
            store.write(RecordKind.LOCKS, resource, granted);
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("expires_at", granted.expiresAt().toString());
            if (granted.reason() != null) {
                detail.put("reason", granted.reason());
            }
            events.append(agentId, EventAction.LOCK_ACQUIRED, resource, detail);
            log.info("Lock acquired: resource={} owner={} expiresAt={}", resource, agentId, granted.expiresAt());
            return LockOutcome.granted(granted, false, now);
        }

        LockRecord held = current.get();
        if (held.isOwnedBy(agentId)) {
            Instant next = now.plus(leaseTtl);
            if (!next.isAfter(held.expiresAt())) {
                next = held.expiresAt().plusMillis(1);
            }
            LockRecord refreshed = held.refreshed(next, blankToNull(reason));
            store.write(RecordKind.LOCKS, resource, refreshed);
            log.debug("Lock refreshed: resource={} owner={} expiresAt={}", resource, agentId, next);
            return LockOutcome.granted(refreshed, true, now);
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("holder", held.ownerAgentId());
        detail.put("expires_at", held.expiresAt().toString());
        detail.put("remaining_ms", held.remainingMs(now));
        events.append(agentId, EventAction.LOCK_DENIED, resource, detail);
        log.warn("Lock denied: resource={} requester={} holder={} remainingMs={}",
                resource, agentId, held.ownerAgentId(), held.remainingMs(now));
        return LockOutcome.denied(held, now);
    }

    /**
     * Releases a lock owned by {@code agentId}. A missing or already-expired lock is not an error.
     *
     * @throws CoordException {@code UNLOCK_NOT_OWNER} if another agent holds the lock
     */
    public UnlockOutcome unlock(String agentId, String resource) {
        Instant now = clock.instant();
        Optional<LockRecord> current = liveLock(resource, now);
        if (current.isEmpty()) {
            return new UnlockOutcome(false, resource, null);
        }
        LockRecord held = current.get();
        if (!held.isOwnedBy(agentId)) {
            log.warn("Unlock rejected: resource={} requester={} holder={}", resource, agentId, held.ownerAgentId());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("resource", resource);
            details.put("holder", held.ownerAgentId());
            throw new CoordException(
                    CoordErrorCode.UNLOCK_NOT_OWNER,
                    "Lock on " + resource + " is held by " + held.ownerAgentId() + ", not " + agentId,
                    details
            );
        }
        release(held, REASON_UNLOCK, null);
        return new UnlockOutcome(true, resource, held.ownerAgentId());
    }

    /**
     * Non-expired locks ordered by resource; expired ones found along the way are purged.
     */
    public List<LockRecord> activeLocks() {
        Instant now = clock.instant();
        List<LockRecord> out = new ArrayList<>();
        for (LockRecord lock : store.readAll(RecordKind.LOCKS, LockRecord.class)) {
            if (lock.isExpired(now)) {
                release(lock, REASON_LEASE_EXPIRED, null);
            } else {
                out.add(lock);
            }
        }
        out.sort(Comparator.comparing(LockRecord::resource));
        return out;
    }

    /**
     * Removes expired leases and returns the purged resources.
     */
    public List<String> purgeExpired() {
        Instant now = clock.instant();
        List<String> purged = new ArrayList<>();
        for (LockRecord lock : store.readAll(RecordKind.LOCKS, LockRecord.class)) {
            if (lock.isExpired(now)) {
                release(lock, REASON_LEASE_EXPIRED, null);
                purged.add(lock.resource());
            }
        }
        purged.sort(Comparator.naturalOrder());
        return purged;
    }

    /**
     * Releases every lock held by {@code ownerAgentId}; returns the released resources.
     */
    public List<String> releaseAllOwnedBy(String ownerAgentId, String reason, String releasedBy) {
        List<String> released = new ArrayList<>();
        for (LockRecord lock : store.readAll(RecordKind.LOCKS, LockRecord.class)) {
            if (lock.isOwnedBy(ownerAgentId)) {
                release(lock, reason, releasedBy);
                released.add(lock.resource());
            }
        }
        released.sort(Comparator.naturalOrder());
        return released;
    }

    public Optional<LockRecord> find(String resource) {
        return liveLock(resource, clock.instant());
    }

    private Optional<LockRecord> liveLock(String resource, Instant now) {
        Optional<LockRecord> current = store.read(RecordKind.LOCKS, resource, LockRecord.class);
        if (current.isPresent() && current.get().isExpired(now)) {
            release(current.get(), REASON_LEASE_EXPIRED, null);
            return Optional.empty();
        }
        return current;
    }

    private void release(LockRecord lock, String reason, String releasedBy) {
        if (!store.delete(RecordKind.LOCKS, lock.resource())) {
            return;
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("reason", reason);
        if (releasedBy != null) {
            detail.put("released_by", releasedBy);
        }
        events.append(lock.ownerAgentId(), EventAction.LOCK_RELEASED, lock.resource(), detail);
        log.info("Lock released: resource={} owner={} reason={}", lock.resource(), lock.ownerAgentId(), reason);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record LockOutcome(
            boolean granted,
            String resource,
            String ownerAgentId,
            Instant acquiredAt,
            Instant expiresAt,
            boolean refreshed,
            long remainingMs
    ) {
        static LockOutcome granted(LockRecord lock, boolean refreshed, Instant now) {
            return new LockOutcome(true, lock.resource(), lock.ownerAgentId(), lock.acquiredAt(), lock.expiresAt(),
                    refreshed, lock.remainingMs(now));
        }

        static LockOutcome denied(LockRecord holder, Instant now) {
            return new LockOutcome(false, holder.resource(), holder.ownerAgentId(), holder.acquiredAt(),
                    holder.expiresAt(), false, holder.remainingMs(now));
        }
    }

    public record UnlockOutcome(boolean released, String resource, String wasHeldBy) {
    }
}
