package io.coordmesh.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.coordmesh.coord.CoordErrorCode;
import io.coordmesh.coord.CoordException;
import io.coordmesh.coord.Coordinator;
import io.coordmesh.coord.Coordinators;
import io.coordmesh.coord.LockManager;
import io.coordmesh.model.AgentKind;
import io.coordmesh.model.AgentStatus;
import io.coordmesh.model.EventAction;
import io.coordmesh.model.MessageStatus;
import io.coordmesh.storage.StoreException;
import io.coordmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON-in/JSON-out entry point for agents. Failures come back as {@link ToolResult} errors and
 * are never thrown to the caller.
 */
public final class CoordTools {
    private static final Logger log = LoggerFactory.getLogger(CoordTools.class);

    private final Coordinators coordinators;

    public CoordTools(Coordinators coordinators) {
        this.coordinators = coordinators;
    }

    public ToolResult call(String name, JsonNode rawArgs) {
        JsonNode args = rawArgs == null || rawArgs.isNull() ? Jsons.mapper().createObjectNode() : rawArgs;
        String tool = name == null ? "" : name.trim();
        try {
            if (ToolDefinitions.GROUPED.equals(tool)) {
                requireFields(args, "action");
                String action = args.path("action").asText();
                tool = ToolDefinitions.toolForAction(action).orElseThrow(() -> new CoordException(
                        CoordErrorCode.INVALID_ARGUMENT,
                        "Unknown coordinator action: " + action,
                        Map.of("action", action)
                ));
            }
            if (!args.isObject()) {
                throw new CoordException(CoordErrorCode.INVALID_ARGUMENT, "Tool arguments must be a JSON object");
            }
            return ToolResult.success(tool, dispatch(tool, args));
        } catch (CoordException e) {
            log.debug("Tool {} failed: {} {}", tool, e.code(), e.getMessage());
            return ToolResult.failure(tool, e.code(), e.getMessage(), e.details());
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(tool, CoordErrorCode.INVALID_ARGUMENT, e.getMessage(), Map.of());
        } catch (StoreException e) {
            log.error("Tool {} hit a storage failure", tool, e);
            return ToolResult.failure(tool, CoordErrorCode.STORE_FAILURE, e.getMessage(), Map.of());
        }
    }

    private Object dispatch(String tool, JsonNode args) {
        switch (tool) {
            case ToolDefinitions.REGISTER:
                return register(args);
            case ToolDefinitions.HEARTBEAT:
                requireFields(args, "agent_id");
                return project(args).heartbeat(
                        text(args, "agent_id"),
                        optText(args, "current_task"),
                        optText(args, "status") == null ? null : AgentStatus.reported(optText(args, "status"))
                );
            case ToolDefinitions.LOCK:
                return lock(args);
            case ToolDefinitions.UNLOCK:
                requireFields(args, "agent_id", "resource");
                return project(args).unlock(text(args, "agent_id"), text(args, "resource"));
            case ToolDefinitions.STATUS:
                return project(args).status();
            case ToolDefinitions.LOG:
                String action = optText(args, "action");
                return project(args).log(
                        optInt(args, "limit"),
                        optText(args, "agent_id"),
                        action == null ? null : EventAction.fromString(action)
                );
            case ToolDefinitions.SEND:
                requireFields(args, "to", "from", "intent", "payload");
                return project(args).send(
                        text(args, "to"),
                        text(args, "from"),
                        text(args, "intent"),
                        args.get("payload"),
                        optText(args, "reply_to"),
                        optLong(args, "ttl_ms")
                );
            case ToolDefinitions.INBOX:
                requireFields(args, "agent_id");
                String status = optText(args, "status");
                Map<String, Object> inbox = new LinkedHashMap<>();
                inbox.put("messages", project(args).inbox(
                        text(args, "agent_id"),
                        status == null ? null : MessageStatus.fromString(status),
                        optInt(args, "limit")
                ));
                return inbox;
            case ToolDefinitions.ACK:
                requireFields(args, "message_id", "agent_id");
                JsonNode result = args.get("result");
                return project(args).ack(
                        text(args, "message_id"),
                        text(args, "agent_id"),
                        result == null || result.isNull() ? null : result
                );
            default:
                throw new CoordException(CoordErrorCode.INVALID_ARGUMENT, "Unknown tool: " + tool, Map.of("tool", tool));
        }
    }

    private Object register(JsonNode args) {
        requireFields(args, "agent_id", "capabilities");
        JsonNode raw = args.get("capabilities");
        if (!raw.isArray()) {
            throw new CoordException(CoordErrorCode.INVALID_ARGUMENT, "capabilities must be an array of strings",
                    Map.of("field", "capabilities"));
        }
        Set<String> capabilities = new LinkedHashSet<>();
        for (JsonNode item : raw) {
            if (!item.isTextual()) {
                throw new CoordException(CoordErrorCode.INVALID_ARGUMENT, "capabilities must be an array of strings",
                        Map.of("field", "capabilities"));
            }
            capabilities.add(item.asText());
        }
        return project(args).register(
                text(args, "agent_id"),
                AgentKind.fromString(optText(args, "kind")),
                capabilities
        );
    }

    private Object lock(JsonNode args) {
        requireFields(args, "agent_id", "resource");
        String agentId = text(args, "agent_id");
        String resource = text(args, "resource");
        LockManager.LockOutcome outcome = project(args).lock(agentId, resource, optText(args, "reason"));
        if (!outcome.granted()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("resource", resource);
            details.put("holder", outcome.ownerAgentId());
            details.put("acquired_at", outcome.acquiredAt().toString());
            details.put("expires_at", outcome.expiresAt().toString());
            details.put("remaining_ms", outcome.remainingMs());
            throw new CoordException(
                    CoordErrorCode.LOCK_CONFLICT,
                    "Resource " + resource + " is locked by " + outcome.ownerAgentId()
                            + " (expires in " + Math.max(1L, (outcome.remainingMs() + 999L) / 1000L) + "s)",
                    details
            );
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("granted", true);
        data.put("resource", outcome.resource());
        data.put("owner_agent_id", outcome.ownerAgentId());
        data.put("acquired_at", outcome.acquiredAt());
        data.put("expires_at", outcome.expiresAt());
        data.put("refreshed", outcome.refreshed());
        return data;
    }

    private Coordinator project(JsonNode args) {
        return coordinators.forProject(optText(args, "project_id"));
    }

    static void requireFields(JsonNode args, String... fields) {
        List<String> missing = new ArrayList<>();
        for (String field : fields) {
            JsonNode value = args.get(field);
            if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw CoordException.missingFields(missing);
        }
    }

    private static String text(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (!value.isTextual()) {
            throw new CoordException(CoordErrorCode.INVALID_ARGUMENT, field + " must be a string", Map.of("field", field));
        }
        return value.asText().trim();
    }

    private static String optText(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
            return null;
        }
        return text(args, field);
    }

    private static Long optLong(JsonNode args, String field) {
        JsonNode value = args.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new CoordException(CoordErrorCode.INVALID_ARGUMENT, field + " must be an integer", Map.of("field", field));
        }
        return value.asLong();
    }

    private static Integer optInt(JsonNode args, String field) {
        Long value = optLong(args, field);
        if (value == null) {
            return null;
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }
}
