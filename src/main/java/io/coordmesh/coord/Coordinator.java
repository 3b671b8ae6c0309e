package io.coordmesh.coord;

import com.fasterxml.jackson.databind.JsonNode;
import io.coordmesh.config.CoordSettings;
import io.coordmesh.model.AgentKind;
import io.coordmesh.model.AgentRecord;
import io.coordmesh.model.AgentStatus;
import io.coordmesh.model.EventAction;
import io.coordmesh.model.LockRecord;
import io.coordmesh.model.MessageRecord;
import io.coordmesh.model.MessageStatus;
import io.coordmesh.project.ProjectHandle;
import io.coordmesh.storage.Store;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All coordination state of one project. Operations are serialized on this instance; each one
 * re-reads the store before deciding.
 */
public final class Coordinator {
    private final ProjectHandle project;
    private final CoordSettings settings;
    private final EventLog events;
    private final AgentRegistry agents;
    private final LockManager locks;
    private final LivenessSweeper sweeper;
    private final MessageBus messages;

    public Coordinator(ProjectHandle project, Store store, CoordSettings settings, Clock clock) {
        this.project = project;
        this.settings = settings;
        this.events = new EventLog(store, clock);
        this.agents = new AgentRegistry(store, events, clock);
        this.locks = new LockManager(store, events, clock, settings.leaseTtl());
        this.sweeper = new LivenessSweeper(agents, locks, clock, settings.stalenessTtl());
        this.messages = new MessageBus(store, events, clock, settings.messageTtl());
    }

    public ProjectHandle project() {
        return project;
    }

    public synchronized RegisterResult register(String agentId, AgentKind kind, Set<String> capabilities) {
        AgentRecord record = agents.register(agentId, kind, capabilities);
        return new RegisterResult(record.agentId(), record.registeredAt(), List.copyOf(record.capabilities()), record.kind());
    }

    public synchronized HeartbeatResult heartbeat(String agentId, String currentTask, AgentStatus status) {
        AgentRecord record = agents.heartbeat(agentId, currentTask, status);
        LivenessSweeper.SweepReport sweep = sweeper.sweep(agentId);
        return new HeartbeatResult(
                record.agentId(),
                record.lastHeartbeat(),
                record.status(),
                sweep.staleAgents(),
                sweep.releasedLocks()
        );
    }

    public synchronized LockManager.LockOutcome lock(String agentId, String resource, String reason) {
        return locks.lock(agentId, resource, reason);
    }

    public synchronized LockManager.UnlockOutcome unlock(String agentId, String resource) {
        return locks.unlock(agentId, resource);
    }

    public synchronized StatusView status() {
        LivenessSweeper.SweepReport sweep = sweeper.sweep(LivenessSweeper.SYSTEM_ACTOR);
        List<AgentRecord> view = new ArrayList<>();
        for (AgentRecord agent : agents.list()) {
            view.add(sweeper.isStale(agent) ? agent.asStale() : agent);
        }
        return new StatusView(List.copyOf(view), locks.activeLocks(), sweep.staleAgents());
    }

    public synchronized EventLog.EventPage log(Integer limit, String agentId, EventAction action) {
        return events.query(settings.clampLimit(limit, settings.logLimit()), agentId, action);
    }

    public synchronized EventLog.ChainReport verifyEvents() {
        return events.verify();
    }

    public synchronized SendReceipt send(
            String to,
            String from,
            String intent,
            JsonNode payload,
            String replyTo,
            Long ttlMs
    ) {
        MessageRecord message = messages.send(to, from, intent, payload, replyTo, ttlMs);
        return new SendReceipt(message.messageId(), message.expiresAt());
    }

    public synchronized List<MessageRecord> inbox(String agentId, MessageStatus status, Integer limit) {
        return messages.inbox(agentId, status, settings.clampLimit(limit, settings.inboxLimit()));
    }

    public synchronized AckReceipt ack(String messageId, String agentId, JsonNode result) {
        MessageBus.AckOutcome outcome = messages.ack(messageId, agentId, result);
        return new AckReceipt(outcome.message().messageId(), outcome.message().status(), outcome.transitioned());
    }

    public synchronized MessageRecord message(String messageId) {
        return messages.get(messageId).orElseThrow(() -> new CoordException(
                CoordErrorCode.MESSAGE_NOT_FOUND,
                "Unknown message: " + messageId,
                Map.of("message_id", messageId)
        ));
    }

    public record RegisterResult(String agentId, Instant registeredAt, List<String> capabilities, AgentKind kind) {
    }

    public record HeartbeatResult(
            String agentId,
            Instant lastHeartbeat,
            AgentStatus status,
            List<String> staleAgents,
            List<String> releasedLocks
    ) {
    }

    public record StatusView(List<AgentRecord> agents, List<LockRecord> locks, List<String> staleAgents) {
    }

    public record SendReceipt(String messageId, Instant expiresAt) {
    }

    public record AckReceipt(String messageId, MessageStatus status, boolean changed) {
    }
}
