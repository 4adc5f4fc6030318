package io.fleetgate.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.fleetgate.config.FleetGateConfig;
import io.fleetgate.error.AccessDeniedException;
import io.fleetgate.error.AlreadyDecidedException;
import io.fleetgate.error.CommandTimeoutException;
import io.fleetgate.error.ConflictException;
import io.fleetgate.error.ConnectivityException;
import io.fleetgate.error.FleetGateException;
import io.fleetgate.error.NotFoundException;
import io.fleetgate.error.ThrottledException;
import io.fleetgate.error.UnknownTargetException;
import io.fleetgate.model.CommandExecution;
import io.fleetgate.model.MinionIdentity;
import io.fleetgate.model.TrustState;
import io.fleetgate.runtime.FleetGateRuntime;
import io.fleetgate.security.OperatorAuth;
import io.fleetgate.security.OperatorPrincipal;
import io.fleetgate.security.OperatorRole;
import io.fleetgate.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * JSON HTTP API over {@link FleetGateRuntime}.
 *
 * <p>Handshakes are unauthenticated and throttled per remote address. Every other route except
 * {@code /health} needs a bearer token from {@code auth.json} unless the auth table is empty.
 */
public final class FleetApiServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FleetApiServer.class);
    private static final int MAX_BODY_BYTES = 256 * 1024;

    private final FleetGateRuntime runtime;
    private final OperatorAuth auth;
    private HttpServer server;
    private ExecutorService executor;

    public FleetApiServer(FleetGateRuntime runtime, OperatorAuth auth) {
        this.runtime = runtime;
        this.auth = auth;
    }

    /** Binds and starts the server. Returns the bound port, useful when {@code port} is 0. */
    public synchronized int start(String host, int port) throws IOException {
        if (server != null) {
            return server.getAddress().getPort();
        }
        HttpServer created = HttpServer.create(new InetSocketAddress(host, port), 0);
        created.createContext("/health", exchange -> handle(exchange, () -> {
            if (!allowMethods(exchange, "GET")) return;
            writeJson(exchange, runtime.health(), 200);
        }));
        created.createContext("/trust/handshake", exchange -> handle(exchange, () -> {
            if (!allowMethods(exchange, "POST")) return;
            JsonNode body = readJson(exchange);
            MinionIdentity identity = runtime.handshake(remoteKey(exchange), text(body, "id"), text(body, "fingerprint"));
            writeJson(exchange, stateBody(identity), 200);
        }));
        created.createContext("/trust/decision", exchange -> handle(exchange, () -> {
            if (!allowMethods(exchange, "POST")) return;
            OperatorPrincipal principal = authorize(exchange);
            if (principal == null) return;
            JsonNode body = readJson(exchange);
            MinionIdentity identity = runtime.decide(
                    principal,
                    remoteKey(exchange),
                    text(body, "id"),
                    text(body, "decision"),
                    text(body, "fingerprint")
            );
            writeJson(exchange, stateBody(identity), 200);
        }));
        created.createContext("/trust/minions", exchange -> handle(exchange, () -> {
            if (!allowMethods(exchange, "GET")) return;
            OperatorPrincipal principal = authorize(exchange);
            if (principal == null) return;
            String rest = pathRemainder(exchange, "/trust/minions");
            if (!rest.isEmpty()) {
                writeJson(exchange, runtime.minion(principal, rest), 200);
                return;
            }
            Map<String, String> q = parseQuery(exchange.getRequestURI().getRawQuery());
            TrustState state = parseState(q.get("state"));
            int limit = parseIntOrDefault(q.get("limit"), 100);
            writeJson(exchange, Map.of("minions", runtime.minions(principal, state, limit)), 200);
        }));
        created.createContext("/commands/dispatch", exchange -> handle(exchange, () -> {
            if (!allowMethods(exchange, "POST")) return;
            OperatorPrincipal principal = authorize(exchange);
            if (principal == null) return;
            JsonNode body = readJson(exchange);
            Duration timeout = timeoutSeconds(body.path("timeoutSeconds"));
            CommandExecution execution = runtime.dispatch(principal, text(body, "targetId"), text(body, "payload"), timeout);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("executionId", execution.id());
            out.put("state", execution.state().name());
            writeJson(exchange, out, 202);
        }));
        created.createContext("/commands/", exchange -> handle(exchange, () -> {
            if (!allowMethods(exchange, "GET")) return;
            OperatorPrincipal principal = authorize(exchange);
            if (principal == null) return;
            String executionId = pathRemainder(exchange, "/commands");
            if (executionId.isEmpty()) {
                writeJson(exchange, Map.of("error", "missing_execution_id"), 400);
                return;
            }
            writeJson(exchange, runtime.command(principal, executionId), 200);
        }));
        created.createContext("/backup/trigger", exchange -> handle(exchange, () -> {
            if (!allowMethods(exchange, "POST")) return;
            OperatorPrincipal principal = authorize(exchange);
            if (principal == null) return;
            runtime.triggerBackupAsync(principal);
            writeJson(exchange, Map.of("status", "accepted"), 202);
        }));
        created.createContext("/backup/last", exchange -> handle(exchange, () -> {
            if (!allowMethods(exchange, "GET")) return;
            OperatorPrincipal principal = authorize(exchange);
            if (principal == null) return;
            var last = runtime.lastBackupRun(principal);
            if (last.isEmpty()) {
                writeJson(exchange, Map.of("error", "not_found", "message", "No backup run recorded"), 404);
                return;
            }
            writeJson(exchange, last.get(), 200);
        }));
        created.createContext("/metrics", exchange -> handle(exchange, () -> {
            if (!allowMethods(exchange, "GET")) return;
            if (authorize(exchange) == null) return;
            byte[] bytes = runtime.metricsText().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }));
        executor = Executors.newFixedThreadPool(8, r -> {
            Thread thread = new Thread(r, "fleetgate-api");
            thread.setDaemon(true);
            return thread;
        });
        created.setExecutor(executor);
        created.start();
        server = created;
        log.info("FleetGate API listening on http://{}:{} (auth={})", host, created.getAddress().getPort(),
                auth.enabled() ? "tokens" : "disabled");
        return created.getAddress().getPort();
    }

    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        server.stop(0);
        executor.shutdownNow();
        server = null;
        executor = null;
    }

    private void handle(HttpExchange exchange, Route route) throws IOException {
        try {
            route.run();
        } catch (ThrottledException e) {
            exchange.getResponseHeaders().set("Retry-After", String.valueOf(e.retryAfterSeconds()));
            writeError(exchange, 429, e);
        } catch (AlreadyDecidedException | ConflictException e) {
            writeError(exchange, 409, e);
        } catch (NotFoundException e) {
            writeError(exchange, 404, e);
        } catch (UnknownTargetException e) {
            writeError(exchange, 422, e);
        } catch (ConnectivityException e) {
            writeError(exchange, 502, e);
        } catch (AccessDeniedException e) {
            writeError(exchange, 403, e);
        } catch (CommandTimeoutException e) {
            writeError(exchange, 504, e);
        } catch (FleetGateException e) {
            log.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
            writeError(exchange, 500, e);
        } catch (IllegalArgumentException e) {
            writeJson(exchange, Map.of("error", "invalid_request", "message", String.valueOf(e.getMessage())), 400);
        } catch (IllegalStateException e) {
            writeJson(exchange, Map.of("error", "invalid_state", "message", String.valueOf(e.getMessage())), 409);
        } catch (RuntimeException e) {
            log.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), e);
            writeJson(exchange, Map.of("error", "internal_error"), 500);
        } finally {
            exchange.close();
        }
    }

    private OperatorPrincipal authorize(HttpExchange exchange) throws IOException {
        if (!auth.enabled()) {
            return new OperatorPrincipal("anonymous", OperatorRole.ADMIN);
        }
        String token = bearerToken(exchange);
        if (token == null) {
            writeJson(exchange, Map.of("error", "missing_token"), 401);
            return null;
        }
        OperatorPrincipal principal = auth.resolve(token);
        if (principal == null) {
            writeJson(exchange, Map.of("error", "forbidden_token"), 403);
            return null;
        }
        return principal;
    }

    private static String bearerToken(HttpExchange exchange) {
        String authz = exchange.getRequestHeaders().getFirst("Authorization");
        if (authz != null && authz.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = authz.substring(7).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        return null;
    }

    private static String remoteKey(HttpExchange exchange) {
        InetSocketAddress remote = exchange.getRemoteAddress();
        if (remote == null || remote.getAddress() == null) {
            return "unknown";
        }
        return remote.getAddress().getHostAddress();
    }

    private static Map<String, Object> stateBody(MinionIdentity identity) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", identity.id());
        out.put("state", identity.state().name());
        return out;
    }

    private static JsonNode readJson(HttpExchange exchange) throws IOException {
        byte[] raw = exchange.getRequestBody().readNBytes(MAX_BODY_BYTES + 1);
        if (raw.length > MAX_BODY_BYTES) {
            throw new IllegalArgumentException("request body too large");
        }
        String body = new String(raw, StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            throw new IllegalArgumentException("request body must be a JSON object");
        }
        try {
            JsonNode node = Jsons.mapper().readTree(body);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("request body must be a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed JSON body", e);
        }
    }

    private static Duration timeoutSeconds(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        long max = FleetGateConfig.MAX_COMMAND_TIMEOUT_MS / 1000L;
        if (!node.canConvertToExactIntegral() || !node.canConvertToLong()
                || node.asLong() < 1L || node.asLong() > max) {
            throw new IllegalArgumentException("timeoutSeconds must be an integer between 1 and " + max);
        }
        return Duration.ofSeconds(node.asLong());
    }

    private static String text(JsonNode body, String field) {
        JsonNode value = body.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static String pathRemainder(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        if (path.length() <= prefix.length()) {
            return "";
        }
        String rest = path.substring(prefix.length());
        while (rest.startsWith("/")) {
            rest = rest.substring(1);
        }
        return rest;
    }

    private static TrustState parseState(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return TrustState.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown trust state: " + raw, e);
        }
    }

    private static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> out = new LinkedHashMap<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return out;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int idx = pair.indexOf('=');
            String key = idx < 0 ? pair : pair.substring(0, idx);
            String value = idx < 0 ? "" : pair.substring(idx + 1);
            out.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return out;
    }

    private static int parseIntOrDefault(String raw, int fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", String.valueOf(method)), 405);
        return false;
    }

    private static void writeError(HttpExchange exchange, int status, FleetGateException e) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.code());
        body.put("message", e.getMessage());
        if (e instanceof ThrottledException throttled) {
            body.put("retryAfterMs", throttled.retryAfter().toMillis());
        }
        writeJson(exchange, body, status);
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @FunctionalInterface
    private interface Route {
        void run() throws IOException;
    }
}
