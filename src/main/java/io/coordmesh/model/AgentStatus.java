package io.coordmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AgentStatus {
    ACTIVE("active"),
    BUSY("busy"),
    IDLE("idle"),
    // view-only: computed from last_heartbeat, never persisted
    STALE("stale");

    private final String wireName;

    AgentStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AgentStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ACTIVE;
        }
        for (AgentStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + raw);
    }

    /**
     * Parses a status reported by an agent itself; {@code stale} is not a status an agent can claim.
     */
    public static AgentStatus reported(String raw) {
        AgentStatus status = fromString(raw);
        if (status == STALE) {
            throw new IllegalArgumentException("status must be one of active|busy|idle");
        }
        return status;
    }
}
