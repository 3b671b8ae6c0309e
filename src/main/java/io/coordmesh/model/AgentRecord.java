package io.coordmesh.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record AgentRecord(
        String agentId,
        AgentKind kind,
        @JsonDeserialize(as = LinkedHashSet.class) Set<String> capabilities,
        AgentStatus status,
        String currentTask,
        Instant registeredAt,
        Instant lastHeartbeat
) {
    public AgentRecord {
        kind = kind == null ? AgentKind.AI : kind;
        capabilities = normalizeCapabilities(capabilities);
        status = status == null ? AgentStatus.ACTIVE : status;
    }

    public static AgentRecord registered(String agentId, AgentKind kind, Collection<String> capabilities, Instant now) {
        return new AgentRecord(agentId, kind, normalizeCapabilities(capabilities), AgentStatus.ACTIVE, null, now, now);
    }

    public boolean isStale(Instant now, Duration stalenessTtl) {
        return Duration.between(lastHeartbeat, now).compareTo(stalenessTtl) > 0;
    }

    /**
     * Heartbeats never move {@code last_heartbeat} backwards.
     */
    public AgentRecord heartbeat(Instant now, AgentStatus nextStatus, String nextTask) {
        Instant beat = lastHeartbeat == null || now.isAfter(lastHeartbeat) ? now : lastHeartbeat;
        return new AgentRecord(
                agentId,
                kind,
                capabilities,
                nextStatus == null ? status : nextStatus,
                nextTask == null ? currentTask : nextTask,
                registeredAt,
                beat
        );
    }

    public AgentRecord withLastHeartbeat(Instant beat) {
        return new AgentRecord(agentId, kind, capabilities, status, currentTask, registeredAt, beat);
    }

    public AgentRecord asStale() {
        return new AgentRecord(agentId, kind, capabilities, AgentStatus.STALE, currentTask, registeredAt, lastHeartbeat);
    }

    private static Set<String> normalizeCapabilities(Collection<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return Set.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(out);
    }
}
