package io.coordmesh.coord;

import io.coordmesh.config.CoordSettings;
import io.coordmesh.model.AgentKind;
import io.coordmesh.model.AgentRecord;
import io.coordmesh.model.AgentStatus;
import io.coordmesh.project.ProjectHandle;
import io.coordmesh.storage.InMemoryStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

final class CoordinatorTest {
    private MutableClock clock;
    private Coordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        coordinator = new Coordinator(new ProjectHandle("demo", Path.of("unused")), new InMemoryStore(),
                CoordSettings.defaults(), clock);
    }

    @Test
    void statusMarksStaleAgentsAndDropsTheirLocks() {
        coordinator.register("worker", AgentKind.AI, Set.of("code"));
        coordinator.register("watcher", AgentKind.HUMAN, Set.of());
        coordinator.lock("worker", "src/core.ts", "big change");

        clock.advance(Duration.ofSeconds(90));
        coordinator.heartbeat("watcher", null, AgentStatus.IDLE);
        clock.advance(Duration.ofSeconds(91));

        Coordinator.StatusView status = coordinator.status();
        Assertions.assertEquals(List.of("worker"), status.staleAgents());
        Assertions.assertTrue(status.locks().isEmpty());
        AgentRecord worker = status.agents().stream().filter(a -> a.agentId().equals("worker")).findFirst().orElseThrow();
        AgentRecord watcher = status.agents().stream().filter(a -> a.agentId().equals("watcher")).findFirst().orElseThrow();
        Assertions.assertEquals(AgentStatus.STALE, worker.status());
        Assertions.assertEquals(AgentStatus.IDLE, watcher.status());
    }

    @Test
    void heartbeatReportsSweepResults() {
        coordinator.register("crashed", AgentKind.AI, Set.of());
        coordinator.lock("crashed", "tool:deploy", null);
        clock.advance(Duration.ofMinutes(4));

        Coordinator.HeartbeatResult beat = coordinator.heartbeat("survivor", "deploying", null);
        Assertions.assertEquals(List.of("crashed"), beat.staleAgents());
        Assertions.assertEquals(List.of("tool:deploy"), beat.releasedLocks());
        Assertions.assertEquals(AgentStatus.ACTIVE, beat.status());
        Assertions.assertTrue(coordinator.lock("survivor", "tool:deploy", null).granted());
    }

    @Test
    void crashedHolderNeverBlocksLongerThanLeaseOrStalenessWindow() {
        CoordSettings settings = CoordSettings.defaults();
        Duration bound = settings.leaseTtl().compareTo(settings.stalenessTtl()) > 0
                ? settings.leaseTtl()
                : settings.stalenessTtl();

        coordinator.register("crashed", AgentKind.AI, Set.of());
        coordinator.lock("crashed", "shared/config.yaml", null);
        clock.advance(bound);

        Assertions.assertTrue(coordinator.lock("other", "shared/config.yaml", null).granted());
    }

    @Test
    void logLimitFallsBackToSettings() {
        for (int i = 0; i < 60; i++) {
            coordinator.heartbeat("a", null, null);
        }
        EventLog.EventPage page = coordinator.log(null, null, null);
        Assertions.assertEquals(CoordSettings.DEFAULT_LOG_LIMIT, page.events().size());
        Assertions.assertEquals(60, page.totalCount());
        Assertions.assertEquals(5, coordinator.log(5, "a", null).events().size());
    }

    @Test
    void unknownMessageLookupFails() {
        CoordException error = Assertions.assertThrows(CoordException.class, () -> coordinator.message("msg_nope"));
        Assertions.assertEquals(CoordErrorCode.MESSAGE_NOT_FOUND, error.code());
    }
}
