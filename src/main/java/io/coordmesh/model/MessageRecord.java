package io.coordmesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record MessageRecord(
        String messageId,
        String to,
        String from,
        String intent,
        JsonNode payload,
        String replyTo,
        MessageStatus status,
        JsonNode result,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt
) {
    public MessageRecord {
        result = result == null || result.isNull() ? null : result;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public MessageRecord transition(MessageStatus next, JsonNode nextResult, Instant now) {
        return new MessageRecord(
                messageId,
                to,
                from,
                intent,
                payload,
                replyTo,
                next,
                nextResult == null ? result : nextResult,
                createdAt,
                now,
                expiresAt
        );
    }
}
