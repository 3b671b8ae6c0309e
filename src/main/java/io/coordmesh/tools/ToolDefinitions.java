package io.coordmesh.tools;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Catalogue of the coordination tools and the grouped {@code coordinator} entry that routes
 * short action names onto them.
 */
public final class ToolDefinitions {
    public static final String REGISTER = "coord_register";
    public static final String HEARTBEAT = "coord_heartbeat";
    public static final String LOCK = "coord_lock";
    public static final String UNLOCK = "coord_unlock";
    public static final String STATUS = "coord_status";
    public static final String LOG = "coord_log";
    public static final String SEND = "coord_send";
    public static final String INBOX = "coord_inbox";
    public static final String ACK = "coord_ack";
    public static final String GROUPED = "coordinator";

    private static final String PROJECT_ID = "project_id";

    private static final List<ToolDefinition> TOOLS = List.of(
            new ToolDefinition(REGISTER,
                    "Register an agent and announce its capabilities. Idempotent.",
                    List.of("agent_id", "capabilities"), List.of("kind", PROJECT_ID)),
            new ToolDefinition(HEARTBEAT,
                    "Keep an agent alive, optionally update status/current task. Also releases locks of stale agents. Call every 60s.",
                    List.of("agent_id"), List.of("current_task", "status", PROJECT_ID)),
            new ToolDefinition(LOCK,
                    "Acquire or refresh an exclusive lease on a resource. Fails with LOCK_CONFLICT if another agent holds it.",
                    List.of("agent_id", "resource"), List.of("reason", PROJECT_ID)),
            new ToolDefinition(UNLOCK,
                    "Release a lease held by the calling agent.",
                    List.of("agent_id", "resource"), List.of(PROJECT_ID)),
            new ToolDefinition(STATUS,
                    "List agents (stale ones marked), active locks and stale agents.",
                    List.of(), List.of(PROJECT_ID)),
            new ToolDefinition(LOG,
                    "Query the coordination event log, newest first.",
                    List.of(), List.of("limit", "agent_id", "action", PROJECT_ID)),
            new ToolDefinition(SEND,
                    "Send a persistent message to another agent's inbox.",
                    List.of("to", "from", "intent", "payload"), List.of("reply_to", "ttl_ms", PROJECT_ID)),
            new ToolDefinition(INBOX,
                    "Read an agent's inbox, oldest first.",
                    List.of("agent_id"), List.of("status", "limit", PROJECT_ID)),
            new ToolDefinition(ACK,
                    "Acknowledge a message, or complete it by passing a result.",
                    List.of("message_id", "agent_id"), List.of("result", PROJECT_ID))
    );

    private static final Map<String, String> ACTIONS;

    static {
        Map<String, String> actions = new LinkedHashMap<>();
        for (ToolDefinition tool : TOOLS) {
            actions.put(tool.name().substring("coord_".length()), tool.name());
        }
        ACTIONS = Map.copyOf(actions);
    }

    private ToolDefinitions() {
    }

    public static List<ToolDefinition> all() {
        return TOOLS;
    }

    public static Optional<ToolDefinition> find(String name) {
        return TOOLS.stream().filter(tool -> tool.name().equals(name)).findFirst();
    }

    /**
     * Short action name ({@code lock}, {@code inbox}, ...) to tool name.
     */
    public static Optional<String> toolForAction(String action) {
        return Optional.ofNullable(action == null ? null : ACTIONS.get(action.trim()));
    }

    public static Map<String, Object> catalogue() {
        Map<String, Object> grouped = new LinkedHashMap<>();
        grouped.put("name", GROUPED);
        grouped.put("description", "Grouped entry: pass 'action' plus that tool's arguments.");
        grouped.put("actions", new TreeMap<>(ACTIONS));

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tools", TOOLS);
        out.put("grouped", grouped);
        return out;
    }
}
