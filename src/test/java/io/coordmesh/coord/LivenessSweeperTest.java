package io.coordmesh.coord;

import io.coordmesh.model.AgentKind;
import io.coordmesh.model.EventAction;
import io.coordmesh.model.EventRecord;
import io.coordmesh.storage.InMemoryStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

final class LivenessSweeperTest {
    private static final Duration STALE_AFTER = Duration.ofSeconds(180);

    private MutableClock clock;
    private EventLog events;
    private AgentRegistry agents;
    private LockManager locks;
    private LivenessSweeper sweeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        InMemoryStore store = new InMemoryStore();
        events = new EventLog(store, clock);
        agents = new AgentRegistry(store, events, clock);
        locks = new LockManager(store, events, clock, Duration.ofMinutes(10));
        sweeper = new LivenessSweeper(agents, locks, clock, STALE_AFTER);
    }

    @Test
    void releasesLocksOfStaleAgentsOnly() {
        agents.register("crashed", AgentKind.AI, Set.of("code"));
        agents.register("alive", AgentKind.AI, Set.of("test"));
        locks.lock("crashed", "src/a.ts", null);
        locks.lock("crashed", "src/b.ts", null);
        locks.lock("alive", "src/c.ts", null);

        clock.advance(STALE_AFTER.plusSeconds(1));
        agents.heartbeat("alive", null, null);
        LivenessSweeper.SweepReport report = sweeper.sweep("alive");

        Assertions.assertEquals(List.of("crashed"), report.staleAgents());
        Assertions.assertEquals(List.of("src/a.ts", "src/b.ts"), report.releasedLocks());
        Assertions.assertTrue(locks.find("src/a.ts").isEmpty());
        Assertions.assertTrue(locks.find("src/c.ts").isPresent());

        List<EventRecord> released = events.query(50, "crashed", EventAction.LOCK_RELEASED).events();
        Assertions.assertEquals(2, released.size());
        for (EventRecord event : released) {
            Assertions.assertEquals(LockManager.REASON_STALE_AGENT, event.detail().get("reason"));
            Assertions.assertEquals("alive", event.detail().get("released_by"));
        }
        Assertions.assertTrue(agents.find("crashed").isPresent());
    }

    @Test
    void agentAtExactlyTtlIsNotStale() {
        agents.register("edge", AgentKind.CI, Set.of());
        locks.lock("edge", "tool:build", null);
        clock.advance(STALE_AFTER);

        LivenessSweeper.SweepReport report = sweeper.sweep(null);
        Assertions.assertTrue(report.staleAgents().isEmpty());
        Assertions.assertTrue(locks.find("tool:build").isPresent());
    }

    @Test
    void systemIsReleaserWhenNoCallerGiven() {
        agents.register("gone", AgentKind.AI, Set.of());
        locks.lock("gone", "r", null);
        clock.advance(Duration.ofMinutes(4));

        sweeper.sweep(" ");
        EventRecord event = events.query(1, null, EventAction.LOCK_RELEASED).events().get(0);
        Assertions.assertEquals(LivenessSweeper.SYSTEM_ACTOR, event.detail().get("released_by"));
    }

    @Test
    void heartbeatRevivesStaleAgent() {
        agents.register("sleepy", AgentKind.HUMAN, Set.of());
        clock.advance(Duration.ofMinutes(5));
        Assertions.assertEquals(List.of("sleepy"), sweeper.sweep(null).staleAgents());

        agents.heartbeat("sleepy", "back at it", null);
        Assertions.assertTrue(sweeper.sweep(null).staleAgents().isEmpty());
    }
}
