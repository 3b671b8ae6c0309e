package io.coordmesh.coord;

import io.coordmesh.model.AgentKind;
import io.coordmesh.model.AgentRecord;
import io.coordmesh.model.AgentStatus;
import io.coordmesh.model.EventAction;
import io.coordmesh.storage.RecordKind;
import io.coordmesh.storage.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class AgentRegistry {
    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Store store;
    private final EventLog events;
    private final Clock clock;

    public AgentRegistry(Store store, EventLog events, Clock clock) {
        this.store = store;
        this.events = events;
        this.clock = clock;
    }

    /**
     * Upserts the agent as {@code active}. Re-registering replaces capabilities and kind;
     * {@code last_heartbeat} never moves backwards.
     */
    public AgentRecord register(String agentId, AgentKind kind, Set<String> capabilities) {
        Instant now = clock.instant();
        AgentRecord record = AgentRecord.registered(agentId, kind, capabilities, now);
        Optional<AgentRecord> existing = find(agentId);
        if (existing.isPresent() && existing.get().lastHeartbeat() != null
                && existing.get().lastHeartbeat().isAfter(now)) {
            record = record.withLastHeartbeat(existing.get().lastHeartbeat());
        }
        store.write(RecordKind.AGENTS, agentId, record);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("kind", record.kind().wireName());
        detail.put("capabilities", List.copyOf(record.capabilities()));
        events.append(agentId, EventAction.REGISTERED, null, detail);
        log.info("Agent registered: id={} kind={} capabilities={}", agentId, record.kind().wireName(), record.capabilities());
        return record;
    }

    /**
     * Refreshes liveness. An unknown agent is registered implicitly with no capabilities.
     */
    public AgentRecord heartbeat(String agentId, String currentTask, AgentStatus status) {
        Instant now = clock.instant();
        Optional<AgentRecord> existing = find(agentId);
        AgentRecord base;
        if (existing.isPresent()) {
            base = existing.get();
        } else {
            base = AgentRecord.registered(agentId, AgentKind.AI, Set.of(), now);
            log.info("Heartbeat from unknown agent, registering implicitly: id={}", agentId);
        }
        AgentRecord updated = base.heartbeat(now, status, currentTask);
        store.write(RecordKind.AGENTS, agentId, updated);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", updated.status().wireName());
        if (updated.currentTask() != null) {
            detail.put("current_task", updated.currentTask());
        }
        if (existing.isEmpty()) {
            detail.put("implicit_register", true);
        }
        events.append(agentId, EventAction.HEARTBEAT, null, detail);
        return updated;
    }

    public Optional<AgentRecord> find(String agentId) {
        return store.read(RecordKind.AGENTS, agentId, AgentRecord.class);
    }

    /**
     * Stored agents ordered by id. Status is the reported one; staleness is applied by callers.
     */
    public List<AgentRecord> list() {
        List<AgentRecord> out = new ArrayList<>(store.readAll(RecordKind.AGENTS, AgentRecord.class));
        out.sort(Comparator.comparing(AgentRecord::agentId));
        return out;
    }
}
