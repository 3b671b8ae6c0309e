package io.coordmesh.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Explicit actor tag supplied at registration time.
 */
public enum AgentKind {
    AI("ai"),
    HUMAN("human"),
    CI("ci");

    private final String wireName;

    AgentKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AgentKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AI;
        }
        for (AgentKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown agent kind: " + raw);
    }
}
