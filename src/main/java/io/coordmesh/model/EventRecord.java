package io.coordmesh.model;

import java.time.Instant;
import java.util.Map;

public record EventRecord(
        long eventId,
        Instant timestamp,
        String agentId,
        EventAction action,
        String resource,
        Map<String, Object> detail,
        String prevHash,
        String hash
) {
    public EventRecord {
        detail = detail == null ? Map.of() : detail;
        prevHash = prevHash == null ? "" : prevHash;
    }

    public EventRecord withHash(String value) {
        return new EventRecord(eventId, timestamp, agentId, action, resource, detail, prevHash, value);
    }
}
