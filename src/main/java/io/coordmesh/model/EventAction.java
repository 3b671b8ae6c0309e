package io.coordmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventAction {
    REGISTERED("registered"),
    HEARTBEAT("heartbeat"),
    LOCK_ACQUIRED("lock_acquired"),
    LOCK_DENIED("lock_denied"),
    LOCK_RELEASED("lock_released"),
    MESSAGE_SENT("message_sent"),
    MESSAGE_ACKED("message_acked");

    private final String wireName;

    EventAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("event action must not be blank");
        }
        for (EventAction value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown event action: " + raw);
    }
}
