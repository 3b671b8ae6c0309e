package io.coordmesh.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.coordmesh.config.CoordMeshConfig;
import io.coordmesh.config.CoordSettings;
import io.coordmesh.coord.CoordErrorCode;
import io.coordmesh.coord.CoordException;
import io.coordmesh.coord.Coordinator;
import io.coordmesh.coord.Coordinators;
import io.coordmesh.coord.EventLog;
import io.coordmesh.project.DirectoryProjectResolver;
import io.coordmesh.project.ProjectHandle;
import io.coordmesh.storage.Database;
import io.coordmesh.storage.Stores;
import io.coordmesh.tools.CoordTools;
import io.coordmesh.tools.ToolDefinitions;
import io.coordmesh.tools.ToolResult;
import io.coordmesh.util.Jsons;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "coordmesh",
        mixinStandardHelpOptions = true,
        description = "Multi-agent coordination CLI: registry, leases, inboxes and event log",
        subcommands = {
                CoordMeshCommand.InitCommand.class,
                CoordMeshCommand.RegisterCommand.class,
                CoordMeshCommand.HeartbeatCommand.class,
                CoordMeshCommand.LockCommand.class,
                CoordMeshCommand.UnlockCommand.class,
                CoordMeshCommand.StatusCommand.class,
                CoordMeshCommand.LogCommand.class,
                CoordMeshCommand.SendCommand.class,
                CoordMeshCommand.InboxCommand.class,
                CoordMeshCommand.AckCommand.class,
                CoordMeshCommand.MessageCommand.class,
                CoordMeshCommand.ToolCommand.class,
                CoordMeshCommand.ToolsCommand.class,
                CoordMeshCommand.EventsVerifyCommand.class,
                CoordMeshCommand.SchemaMigrationsCommand.class,
                CoordMeshCommand.ServeCommand.class
        }
)
public final class CoordMeshCommand implements Runnable {
    static final int EXIT_TOOL_ERROR = 2;

    @Option(names = {"--root"}, description = "Coordination root directory", defaultValue = ".coordmesh")
    String root;

    @Option(names = {"--project"}, description = "Project id (default project when omitted)")
    String project;

    PrintStream out = System.out;

    @Override
    public void run() {
        out.println("Use subcommands: init | register | heartbeat | lock | unlock | status | log | send | inbox | ack | message | tool | tools | events-verify | schema-migrations | serve");
    }

    CoordMeshConfig config() {
        return CoordMeshConfig.fromRoot(root);
    }

    CoordSettings settings() {
        return CoordSettings.load(config().settingsFile());
    }

    CoordTools tools() {
        return new CoordTools(coordinators());
    }

    Coordinators coordinators() {
        return new Coordinators(new DirectoryProjectResolver(config()), settings(), Clock.systemUTC());
    }

    ObjectNode args() {
        ObjectNode node = Jsons.mapper().createObjectNode();
        if (project != null && !project.isBlank()) {
            node.put("project_id", project);
        }
        return node;
    }

    int emit(ToolResult result) {
        out.println(Jsons.toJson(result));
        return result.ok() ? 0 : EXIT_TOOL_ERROR;
    }

    static JsonNode parseJson(String raw, String field) {
        try {
            return Jsons.mapper().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new CoordException(CoordErrorCode.INVALID_ARGUMENT, field + " is not valid JSON: " + e.getOriginalMessage(),
                    Map.of("field", field));
        }
    }

    @Command(name = "init", description = "Create the project directory and its store")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Override
        public Integer call() {
            CoordMeshConfig config = parent.config();
            CoordSettings settings = parent.settings();
            DirectoryProjectResolver resolver = new DirectoryProjectResolver(config);
            ProjectHandle handle = resolver.create(parent.project == null ? config.defaultProject() : parent.project);
            String store = Stores.open(settings.storeBackend(), handle.rootPath()).describe();
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("project_id", handle.id());
            summary.put("root", handle.rootPath().toString());
            summary.put("store", store);
            summary.put("settings_file", config.settingsFile().toString());
            summary.put("settings", settings);
            parent.out.println(Jsons.toJson(summary));
            return 0;
        }
    }

    @Command(name = "register", description = "Register an agent")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--capability"}, description = "Capability (repeatable)")
        List<String> capabilities;

        @Option(names = {"--kind"}, description = "ai | human | ci")
        String kind;

        @Override
        public Integer call() {
            ObjectNode args = parent.args();
            args.put("agent_id", agent);
            var caps = args.putArray("capabilities");
            if (capabilities != null) {
                capabilities.forEach(caps::add);
            }
            if (kind != null) {
                args.put("kind", kind);
            }
            return parent.emit(parent.tools().call(ToolDefinitions.REGISTER, args));
        }
    }

    @Command(name = "heartbeat", description = "Send a heartbeat and sweep stale agents")
    static final class HeartbeatCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--task"}, description = "Current task")
        String task;

        @Option(names = {"--status"}, description = "active | busy | idle")
        String status;

        @Override
        public Integer call() {
            ObjectNode args = parent.args();
            args.put("agent_id", agent);
            if (task != null) {
                args.put("current_task", task);
            }
            if (status != null) {
                args.put("status", status);
            }
            return parent.emit(parent.tools().call(ToolDefinitions.HEARTBEAT, args));
        }
    }

    @Command(name = "lock", description = "Acquire or refresh a lease on a resource")
    static final class LockCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--resource"}, required = true, description = "Resource name (path, tool, domain)")
        String resource;

        @Option(names = {"--reason"}, description = "Why the lock is needed")
        String reason;

        @Override
        public Integer call() {
            ObjectNode args = parent.args();
            args.put("agent_id", agent);
            args.put("resource", resource);
            if (reason != null) {
                args.put("reason", reason);
            }
            return parent.emit(parent.tools().call(ToolDefinitions.LOCK, args));
        }
    }

    @Command(name = "unlock", description = "Release a lease")
    static final class UnlockCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--resource"}, required = true, description = "Resource name")
        String resource;

        @Override
        public Integer call() {
            ObjectNode args = parent.args();
            args.put("agent_id", agent);
            args.put("resource", resource);
            return parent.emit(parent.tools().call(ToolDefinitions.UNLOCK, args));
        }
    }

    @Command(name = "status", description = "Show agents, active locks and stale agents")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Override
        public Integer call() {
            return parent.emit(parent.tools().call(ToolDefinitions.STATUS, parent.args()));
        }
    }

    @Command(name = "log", description = "Query the event log, newest first")
    static final class LogCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--limit"}, description = "Max events to return")
        Integer limit;

        @Option(names = {"--agent"}, description = "Filter by agent id")
        String agent;

        @Option(names = {"--action"}, description = "Filter by action")
        String action;

        @Override
        public Integer call() {
            ObjectNode args = parent.args();
            if (limit != null) {
                args.put("limit", limit);
            }
            if (agent != null) {
                args.put("agent_id", agent);
            }
            if (action != null) {
                args.put("action", action);
            }
            return parent.emit(parent.tools().call(ToolDefinitions.LOG, args));
        }
    }

    @Command(name = "send", description = "Send a message to an agent's inbox")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--to"}, required = true, description = "Recipient agent id")
        String to;

        @Option(names = {"--from"}, required = true, description = "Sender agent id")
        String from;

        @Option(names = {"--intent"}, required = true, description = "Message intent")
        String intent;

        @Option(names = {"--payload"}, defaultValue = "{}", description = "JSON object payload")
        String payload;

        @Option(names = {"--reply-to"}, description = "Message id this replies to")
        String replyTo;

        @Option(names = {"--ttl-ms"}, description = "Time to live in milliseconds")
        Long ttlMs;

        @Override
        public Integer call() {
            ObjectNode args = parent.args();
            args.put("to", to);
            args.put("from", from);
            args.put("intent", intent);
            try {
                args.set("payload", parseJson(payload, "payload"));
            } catch (CoordException e) {
                return parent.emit(ToolResult.failure(ToolDefinitions.SEND, e.code(), e.getMessage(), e.details()));
            }
            if (replyTo != null) {
                args.put("reply_to", replyTo);
            }
            if (ttlMs != null) {
                args.put("ttl_ms", ttlMs);
            }
            return parent.emit(parent.tools().call(ToolDefinitions.SEND, args));
        }
    }

    @Command(name = "inbox", description = "Read an agent's inbox, oldest first")
    static final class InboxCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--status"}, description = "pending | acked | completed")
        String status;

        @Option(names = {"--limit"}, description = "Max messages to return")
        Integer limit;

        @Override
        public Integer call() {
            ObjectNode args = parent.args();
            args.put("agent_id", agent);
            if (status != null) {
                args.put("status", status);
            }
            if (limit != null) {
                args.put("limit", limit);
            }
            return parent.emit(parent.tools().call(ToolDefinitions.INBOX, args));
        }
    }

    @Command(name = "ack", description = "Acknowledge or complete a message")
    static final class AckCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--message"}, required = true, description = "Message id")
        String messageId;

        @Option(names = {"--agent"}, required = true, description = "Recipient agent id")
        String agent;

        @Option(names = {"--result"}, description = "JSON result; completes the message")
        String result;

        @Override
        public Integer call() {
            ObjectNode args = parent.args();
            args.put("message_id", messageId);
            args.put("agent_id", agent);
            if (result != null) {
                try {
                    args.set("result", parseJson(result, "result"));
                } catch (CoordException e) {
                    return parent.emit(ToolResult.failure(ToolDefinitions.ACK, e.code(), e.getMessage(), e.details()));
                }
            }
            return parent.emit(parent.tools().call(ToolDefinitions.ACK, args));
        }
    }

    @Command(name = "message", description = "Show one message, including expired ones")
    static final class MessageCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Parameters(index = "0", description = "Message id")
        String messageId;

        @Override
        public Integer call() {
            try {
                Coordinator coordinator = parent.coordinators().forProject(parent.project);
                parent.out.println(Jsons.toJson(coordinator.message(messageId)));
                return 0;
            } catch (CoordException e) {
                return parent.emit(ToolResult.failure("message", e.code(), e.getMessage(), e.details()));
            }
        }
    }

    @Command(name = "tool", description = "Invoke a tool by name with raw JSON arguments")
    static final class ToolCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Parameters(index = "0", description = "Tool name, e.g. coord_lock or coordinator")
        String name;

        @Parameters(index = "1", defaultValue = "{}", description = "JSON arguments")
        String json;

        @Override
        public Integer call() {
            JsonNode args;
            try {
                args = parseJson(json, "arguments");
            } catch (CoordException e) {
                return parent.emit(ToolResult.failure(name, e.code(), e.getMessage(), e.details()));
            }
            if (args.isObject() && parent.project != null && !args.has("project_id")) {
                ((ObjectNode) args).put("project_id", parent.project);
            }
            return parent.emit(parent.tools().call(name, args));
        }
    }

    @Command(name = "tools", description = "List tool definitions")
    static final class ToolsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Override
        public Integer call() {
            parent.out.println(Jsons.toJson(ToolDefinitions.catalogue()));
            return 0;
        }
    }

    @Command(name = "events-verify", description = "Verify the event log hash chain")
    static final class EventsVerifyCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Override
        public Integer call() {
            try {
                EventLog.ChainReport report = parent.coordinators().forProject(parent.project).verifyEvents();
                parent.out.println(Jsons.toJson(report));
                return report.ok() ? 0 : 1;
            } catch (CoordException e) {
                return parent.emit(ToolResult.failure("events-verify", e.code(), e.getMessage(), e.details()));
            }
        }
    }

    @Command(name = "schema-migrations", description = "Show applied schema migrations (sqlite backend)")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() {
            try {
                ProjectHandle handle = new DirectoryProjectResolver(parent.config()).resolve(parent.project);
                var dbFile = handle.rootPath().resolve(Stores.DB_FILE);
                if (!Files.exists(dbFile)) {
                    parent.out.println(Jsons.toJson(List.of()));
                    return 0;
                }
                Database database = new Database(dbFile);
                database.init();
                parent.out.println(Jsons.toJson(database.listSchemaMigrations(limit)));
                return 0;
            } catch (CoordException e) {
                return parent.emit(ToolResult.failure("schema-migrations", e.code(), e.getMessage(), e.details()));
            }
        }
    }

    @Command(name = "serve", description = "Expose the tools over HTTP: GET /tools, POST /tools/{name}")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        CoordMeshCommand parent;

        @Option(names = {"--port"}, defaultValue = "8787", description = "Bind port")
        int port;

        @Option(names = {"--bind"}, defaultValue = "127.0.0.1", description = "Bind address")
        String bind;

        @Override
        public Integer call() throws Exception {
            CoordTools tools = parent.tools();
            HttpServer server = HttpServer.create(new InetSocketAddress(bind, port), 0);
            server.createContext("/tools", exchange -> handleTools(exchange, tools));
            server.setExecutor(null);
            server.start();
            System.err.println("CoordMesh tool server listening on http://" + bind + ":" + server.getAddress().getPort() + "/tools");
            Thread.currentThread().join();
            return 0;
        }
    }

    static void handleTools(HttpExchange exchange, CoordTools tools) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String method = exchange.getRequestMethod();
        if ("/tools".equals(path) || "/tools/".equals(path)) {
            if (!"GET".equalsIgnoreCase(method)) {
                writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                return;
            }
            writeJson(exchange, ToolDefinitions.catalogue(), 200);
            return;
        }
        if (!"POST".equalsIgnoreCase(method)) {
            writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
            return;
        }
        String name = path.substring("/tools/".length());
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        ToolResult result;
        try {
            result = tools.call(name, body.isBlank() ? null : parseJson(body, "body"));
        } catch (CoordException e) {
            result = ToolResult.failure(name, e.code(), e.getMessage(), e.details());
        }
        writeJson(exchange, result, httpStatus(result));
    }

    static int httpStatus(ToolResult result) {
        if (result.ok()) {
            return 200;
        }
        switch (result.error().code()) {
            case PROJECT_NOT_FOUND:
            case MESSAGE_NOT_FOUND:
                return 404;
            case LOCK_CONFLICT:
                return 409;
            case UNLOCK_NOT_OWNER:
            case MESSAGE_WRONG_RECIPIENT:
                return 403;
            case STORE_FAILURE:
                return 500;
            default:
                return 400;
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
