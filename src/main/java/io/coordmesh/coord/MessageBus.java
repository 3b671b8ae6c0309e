package io.coordmesh.coord;

import com.fasterxml.jackson.databind.JsonNode;
import io.coordmesh.model.EventAction;
import io.coordmesh.model.MessageRecord;
import io.coordmesh.model.MessageStatus;
import io.coordmesh.storage.RecordKind;
import io.coordmesh.storage.Store;
import io.coordmesh.util.Jsons;
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
import java.util.UUID;

/**
 * Persistent point-to-point inboxes. Messages survive restarts, expire out of inbox reads after
 * their TTL and are never deleted.
 */
public final class MessageBus {
    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);
    private static final Comparator<MessageRecord> OLDEST_FIRST =
            Comparator.comparing(MessageRecord::createdAt).thenComparing(MessageRecord::messageId);

    private final Store store;
    private final EventLog events;
    private final Clock clock;
    private final Duration defaultTtl;

    public MessageBus(Store store, EventLog events, Clock clock, Duration defaultTtl) {
        this.store = store;
        this.events = events;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    public MessageRecord send(String to, String from, String intent, JsonNode payload, String replyTo, Long ttlMs) {
        if (ttlMs != null && ttlMs <= 0) {
            throw new CoordException(CoordErrorCode.INVALID_ARGUMENT, "ttl_ms must be positive",
                    Map.of("field", "ttl_ms", "value", ttlMs));
        }
        JsonNode body = payload == null || payload.isNull() ? Jsons.mapper().createObjectNode() : payload;
        if (!body.isObject()) {
            throw new CoordException(CoordErrorCode.INVALID_ARGUMENT, "payload must be a JSON object",
                    Map.of("field", "payload"));
        }
        String parent = replyTo == null || replyTo.isBlank() ? null : replyTo.trim();
        if (parent != null && get(parent).isEmpty()) {
            throw notFound(parent);
        }

        Instant now = clock.instant();
        Duration ttl = ttlMs == null ? defaultTtl : Duration.ofMillis(ttlMs);
        MessageRecord message = new MessageRecord(
                "msg_" + UUID.randomUUID(),
                to,
                from,
                intent,
                body,
                parent,
                MessageStatus.PENDING,
                null,
                now,
                now,
                now.plus(ttl)
        );
        store.write(RecordKind.MESSAGES, message.messageId(), message);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("message_id", message.messageId());
        detail.put("to", to);
        detail.put("intent", intent);
        if (parent != null) {
            detail.put("reply_to", parent);
        }
        events.append(from, EventAction.MESSAGE_SENT, to, detail);
        log.info("Message sent: id={} from={} to={} intent={}", message.messageId(), from, to, intent);
        return message;
    }

    /**
     * Non-expired messages addressed to {@code agentId} in {@code status}, oldest first.
     */
    public List<MessageRecord> inbox(String agentId, MessageStatus status, int limit) {
        Instant now = clock.instant();
        MessageStatus wanted = status == null ? MessageStatus.PENDING : status;
        List<MessageRecord> out = new ArrayList<>();
        for (MessageRecord message : store.readAll(RecordKind.MESSAGES, MessageRecord.class)) {
            if (agentId.equals(message.to()) && message.status() == wanted && !message.isExpired(now)) {
                out.add(message);
            }
        }
        out.sort(OLDEST_FIRST);
        int safeLimit = Math.max(1, limit);
        return out.size() > safeLimit ? List.copyOf(out.subList(0, safeLimit)) : List.copyOf(out);
    }

    /**
     * Advances a message: no result moves {@code pending} to {@code acked}; a result completes it.
     * Repeated or backward acks return the current state unchanged.
     */
    public AckOutcome ack(String messageId, String agentId, JsonNode result) {
        MessageRecord message = get(messageId).orElseThrow(() -> notFound(messageId));
        if (!agentId.equals(message.to())) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("message_id", messageId);
            details.put("to", message.to());
            details.put("agent_id", agentId);
            log.warn("Ack rejected: message={} addressedTo={} requester={}", messageId, message.to(), agentId);
            throw new CoordException(CoordErrorCode.MESSAGE_WRONG_RECIPIENT,
                    "Message " + messageId + " is addressed to " + message.to(), details);
        }
        boolean hasResult = result != null && !result.isNull();
        MessageStatus next = hasResult ? MessageStatus.COMPLETED : MessageStatus.ACKED;
        if (!message.status().canAdvanceTo(next)) {
            return new AckOutcome(message, false);
        }
        MessageRecord updated = message.transition(next, hasResult ? result : null, clock.instant());
        store.write(RecordKind.MESSAGES, messageId, updated);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("message_id", messageId);
        detail.put("status", next.wireName());
        events.append(agentId, EventAction.MESSAGE_ACKED, message.from(), detail);
        log.info("Message {}: id={} by={}", next.wireName(), messageId, agentId);
        return new AckOutcome(updated, true);
    }

    /**
     * Reads one message regardless of status or expiry.
     */
    public Optional<MessageRecord> get(String messageId) {
        return store.read(RecordKind.MESSAGES, messageId, MessageRecord.class);
    }

    private static CoordException notFound(String messageId) {
        return new CoordException(CoordErrorCode.MESSAGE_NOT_FOUND, "Unknown message: " + messageId,
                Map.of("message_id", messageId));
    }

    public record AckOutcome(MessageRecord message, boolean transitioned) {
    }
}
