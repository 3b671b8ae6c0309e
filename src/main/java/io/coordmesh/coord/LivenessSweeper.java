package io.coordmesh.coord;

import io.coordmesh.model.AgentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Releases locks held by agents whose last heartbeat is older than the staleness TTL.
 * Agent records are kept; a later heartbeat or register revives them.
 */
public final class LivenessSweeper {
    public static final String SYSTEM_ACTOR = "system";

    private static final Logger log = LoggerFactory.getLogger(LivenessSweeper.class);

    private final AgentRegistry agents;
    private final LockManager locks;
    private final Clock clock;
    private final Duration stalenessTtl;

    public LivenessSweeper(AgentRegistry agents, LockManager locks, Clock clock, Duration stalenessTtl) {
        this.agents = agents;
        this.locks = locks;
        this.clock = clock;
        this.stalenessTtl = stalenessTtl;
    }

    public SweepReport sweep(String releasedBy) {
        Instant now = clock.instant();
        String actor = releasedBy == null || releasedBy.isBlank() ? SYSTEM_ACTOR : releasedBy;
        List<String> staleAgents = new ArrayList<>();
        List<String> releasedLocks = new ArrayList<>();
        for (AgentRecord agent : agents.list()) {
            if (!agent.isStale(now, stalenessTtl)) {
                continue;
            }
            staleAgents.add(agent.agentId());
            List<String> released = locks.releaseAllOwnedBy(agent.agentId(), LockManager.REASON_STALE_AGENT, actor);
            if (!released.isEmpty()) {
                log.info("Released {} lock(s) of stale agent {}: {}", released.size(), agent.agentId(), released);
            }
            releasedLocks.addAll(released);
        }
        locks.purgeExpired();
        return new SweepReport(List.copyOf(staleAgents), List.copyOf(releasedLocks));
    }

    public boolean isStale(AgentRecord agent) {
        return agent.isStale(clock.instant(), stalenessTtl);
    }

    public record SweepReport(List<String> staleAgents, List<String> releasedLocks) {
    }
}
