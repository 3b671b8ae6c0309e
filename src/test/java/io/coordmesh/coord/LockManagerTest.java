package io.coordmesh.coord;

import io.coordmesh.model.EventAction;
import io.coordmesh.model.EventRecord;
import io.coordmesh.model.LockRecord;
import io.coordmesh.storage.InMemoryStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class LockManagerTest {
    private static final Duration LEASE = Duration.ofMinutes(10);

    private MutableClock clock;
    private EventLog events;
    private LockManager locks;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        InMemoryStore store = new InMemoryStore();
        events = new EventLog(store, clock);
        locks = new LockManager(store, events, clock, LEASE);
    }

    @Test
    void secondAgentIsDeniedWhileLeaseIsLive() {
        LockManager.LockOutcome first = locks.lock("cymoril-code", "src/auth.ts", "refactor auth");
        Assertions.assertTrue(first.granted());
        Assertions.assertFalse(first.refreshed());
        Assertions.assertEquals(clock.instant().plus(LEASE), first.expiresAt());

        clock.advance(Duration.ofMinutes(3));
        LockManager.LockOutcome denied = locks.lock("cymoril-test", "src/auth.ts", null);
        Assertions.assertFalse(denied.granted());
        Assertions.assertEquals("cymoril-code", denied.ownerAgentId());
        Assertions.assertEquals(Duration.ofMinutes(7).toMillis(), denied.remainingMs());
        Assertions.assertEquals(first.acquiredAt(), denied.acquiredAt());

        EventRecord last = events.query(1, null, null).events().get(0);
        Assertions.assertEquals(EventAction.LOCK_DENIED, last.action());
        Assertions.assertEquals("cymoril-test", last.agentId());
        Assertions.assertEquals("cymoril-code", last.detail().get("holder"));
    }

    @Test
    void ownerRefreshExtendsLeaseWithoutEvent() {
        LockManager.LockOutcome first = locks.lock("a", "db/schema", "migrate");
        clock.advance(Duration.ofSeconds(30));
        LockManager.LockOutcome again = locks.lock("a", "db/schema", null);

        Assertions.assertTrue(again.granted());
        Assertions.assertTrue(again.refreshed());
        Assertions.assertTrue(again.expiresAt().isAfter(first.expiresAt()));
        Assertions.assertEquals(first.acquiredAt(), again.acquiredAt());
        Assertions.assertEquals("migrate", locks.find("db/schema").orElseThrow().reason());

        LockManager.LockOutcome sameInstant = locks.lock("a", "db/schema", "new reason");
        Assertions.assertTrue(sameInstant.expiresAt().isAfter(again.expiresAt()));
        Assertions.assertEquals("new reason", locks.find("db/schema").orElseThrow().reason());

        Assertions.assertEquals(1, events.query(50, null, EventAction.LOCK_ACQUIRED).totalCount());
    }

    @Test
    void expiredLeaseIsReclaimableAtExactlyExpiry() {
        locks.lock("a", "tool:deploy", null);
        clock.advance(LEASE.minusMillis(1));
        Assertions.assertFalse(locks.lock("b", "tool:deploy", null).granted());

        clock.advance(Duration.ofMillis(1));
        LockManager.LockOutcome reclaimed = locks.lock("b", "tool:deploy", null);
        Assertions.assertTrue(reclaimed.granted());
        Assertions.assertEquals("b", reclaimed.ownerAgentId());

        List<EventRecord> released = events.query(50, null, EventAction.LOCK_RELEASED).events();
        Assertions.assertEquals(1, released.size());
        Assertions.assertEquals("a", released.get(0).agentId());
        Assertions.assertEquals(LockManager.REASON_LEASE_EXPIRED, released.get(0).detail().get("reason"));
    }

    @Test
    void unlockIsGatedByOwnership() {
        locks.lock("a", "src/app.ts", null);

        CoordException error = Assertions.assertThrows(CoordException.class, () -> locks.unlock("b", "src/app.ts"));
        Assertions.assertEquals(CoordErrorCode.UNLOCK_NOT_OWNER, error.code());
        Assertions.assertEquals("a", error.details().get("holder"));
        Assertions.assertEquals("a", locks.find("src/app.ts").orElseThrow().ownerAgentId());

        LockManager.UnlockOutcome released = locks.unlock("a", "src/app.ts");
        Assertions.assertTrue(released.released());
        Assertions.assertEquals("a", released.wasHeldBy());
        Assertions.assertTrue(locks.find("src/app.ts").isEmpty());
        Assertions.assertTrue(locks.lock("b", "src/app.ts", null).granted());
    }

    @Test
    void unlockWithoutLockIsNoOp() {
        LockManager.UnlockOutcome outcome = locks.unlock("a", "nothing-here");
        Assertions.assertFalse(outcome.released());
        Assertions.assertNull(outcome.wasHeldBy());
        Assertions.assertEquals(0, events.query(50, null, null).totalCount());
    }

    @Test
    void activeLocksAreSortedAndSkipExpired() {
        locks.lock("a", "zeta", null);
        clock.advance(Duration.ofMinutes(5));
        locks.lock("b", "alpha", null);
        locks.lock("b", "mid", null);
        clock.advance(Duration.ofMinutes(5));

        List<String> active = locks.activeLocks().stream().map(LockRecord::resource).toList();
        Assertions.assertEquals(List.of("alpha", "mid"), active);
        Assertions.assertTrue(locks.find("zeta").isEmpty());
    }

    @Test
    void releaseAllOwnedByRecordsReleaser() {
        locks.lock("a", "r1", null);
        locks.lock("a", "r2", null);
        locks.lock("b", "r3", null);

        List<String> released = locks.releaseAllOwnedBy("a", LockManager.REASON_STALE_AGENT, "b");
        Assertions.assertEquals(List.of("r1", "r2"), released);
        Assertions.assertEquals(List.of("r3"), locks.activeLocks().stream().map(LockRecord::resource).toList());

        EventRecord last = events.query(1, null, EventAction.LOCK_RELEASED).events().get(0);
        Assertions.assertEquals("b", last.detail().get("released_by"));
    }
}
