package dev.schemaeval.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import dev.schemaeval.json.SchemaEvalJsonMapper;
import dev.schemaeval.persistence.PersistenceException;
import dev.schemaeval.run.ConfigException;
import dev.schemaeval.run.RunConfig;
import dev.schemaeval.run.RunManager;
import dev.schemaeval.run.RunSystemException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP boundary of the engine.
 *
 * <ul>
 *   <li>{@code GET /} health check
 *   <li>{@code POST /runs} start a run, 202 with the pending run
 *   <li>{@code GET /runs} all runs, newest first
 *   <li>{@code GET /runs/{id}} run metadata, results and progress
 *   <li>{@code GET /runs/{id}/summary} per-model statistics
 *   <li>{@code POST /runs/{id}/cancel} request cancellation
 * </ul>
 */
@Slf4j
public class EngineServer {
    private static final String RUNS = "/runs";

    private final RunManager runManager;
    private final ObjectMapper jsonMapper = SchemaEvalJsonMapper.get();

    @Getter
    @Accessors(fluent = true)
    private final String host;

    private final int requestedPort;
    private @Nullable HttpServer server;
    private @Nullable ExecutorService executor;

    private EngineServer(Builder builder) {
        this.runManager = Objects.requireNonNull(builder.runManager);
        this.host = builder.host;
        this.requestedPort = builder.port;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Start serving in the background. */
    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server is already running");
        }
        server = HttpServer.create(new InetSocketAddress(host, requestedPort), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);

        server.createContext("/", withErrorHandling(this::handleHealthCheck));
        server.createContext(RUNS, withErrorHandling(this::handleRuns));

        server.start();
        log.info("schema eval server started on http://{}:{}", host, port());
    }

    /** Stop serving. Runs already started keep executing. */
    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            executor.shutdownNow();
            executor = null;
            log.info("schema eval server stopped");
        }
    }

    /** The bound port. Differs from the configured one when it was 0. */
    public synchronized int port() {
        return server == null ? requestedPort : server.getAddress().getPort();
    }

    private void handleHealthCheck(HttpExchange exchange) throws IOException {
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            sendErrorResponse(exchange, 404, "Not Found");
            return;
        }
        if (!"GET".equals(exchange.getRequestMethod())) {
            sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
            return;
        }
        sendResponse(exchange, 200, "text/plain", "OK");
    }

    private void handleRuns(HttpExchange exchange) throws IOException {
        var method = exchange.getRequestMethod();
        var segments = pathSegments(exchange.getRequestURI().getPath());

        if (segments.length == 0) {
            if ("POST".equals(method)) {
                handleStartRun(exchange);
            } else if ("GET".equals(method)) {
                sendJson(exchange, 200, runManager.listRuns());
            } else {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
            }
            return;
        }

        UUID runId;
        try {
            runId = UUID.fromString(segments[0]);
        } catch (IllegalArgumentException e) {
            sendErrorResponse(exchange, 404, "Run not found: " + segments[0]);
            return;
        }

        if (segments.length == 1) {
            if (!"GET".equals(method)) {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
                return;
            }
            var view = runManager.getRun(runId);
            if (view.isEmpty()) {
                sendErrorResponse(exchange, 404, "Run not found: " + runId);
                return;
            }
            sendJson(exchange, 200, view.get());
        } else if (segments.length == 2 && "summary".equals(segments[1])) {
            if (!"GET".equals(method)) {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
                return;
            }
            var summary = runManager.getSummary(runId);
            if (summary.isEmpty()) {
                sendErrorResponse(exchange, 404, "Run not found: " + runId);
                return;
            }
            sendJson(exchange, 200, summary.get());
        } else if (segments.length == 2 && "cancel".equals(segments[1])) {
            if (!"POST".equals(method)) {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
                return;
            }
            if (runManager.getRun(runId).isEmpty()) {
                sendErrorResponse(exchange, 404, "Run not found: " + runId);
                return;
            }
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("run_id", runId);
            response.put("cancelled", runManager.cancelRun(runId));
            sendJson(exchange, 200, response);
        } else {
            sendErrorResponse(exchange, 404, "Not Found");
        }
    }

    private void handleStartRun(HttpExchange exchange) throws IOException {
        RunConfig config;
        try (InputStream requestBody = exchange.getRequestBody()) {
            var body = new String(requestBody.readAllBytes(), StandardCharsets.UTF_8);
            config = jsonMapper.readValue(body, RunConfig.class);
        } catch (JsonProcessingException e) {
            sendErrorResponse(exchange, 400, "Invalid request body: " + e.getOriginalMessage());
            return;
        }
        try {
            sendJson(exchange, 202, runManager.startRun(config));
        } catch (ConfigException e) {
            log.debug("rejected run config: {}", e.getMessage());
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", e.getMessage());
            error.put("reason", e.reason());
            sendJson(exchange, 400, error);
        }
    }

    private HttpHandler withErrorHandling(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (RunSystemException | PersistenceException e) {
                log.error(
                        "request {} {} failed",
                        exchange.getRequestMethod(),
                        exchange.getRequestURI(),
                        e);
                sendErrorResponse(exchange, 503, e.getMessage());
            } catch (RuntimeException e) {
                log.error(
                        "request {} {} failed",
                        exchange.getRequestMethod(),
                        exchange.getRequestURI(),
                        e);
                sendErrorResponse(exchange, 500, "Internal server error");
            } finally {
                exchange.close();
            }
        };
    }

    /** Segments after {@code /runs}, e.g. {@code /runs/abc/summary} → [abc, summary]. */
    private static String[] pathSegments(String path) {
        var rest = path.substring(RUNS.length());
        if (rest.startsWith("/")) {
            rest = rest.substring(1);
        }
        if (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        return rest.isEmpty() ? new String[0] : rest.split("/");
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        sendResponse(exchange, statusCode, "application/json", jsonMapper.writeValueAsString(body));
    }

    private void sendResponse(
            HttpExchange exchange, int statusCode, String contentType, String body)
            throws IOException {
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }

    private void sendErrorResponse(HttpExchange exchange, int statusCode, String message)
            throws IOException {
        sendJson(exchange, statusCode, Map.of("error", String.valueOf(message)));
    }

    public static class Builder {
        private @Nullable RunManager runManager = null;
        private String host = "localhost";
        private int port = 8300;

        public EngineServer build() {
            if (runManager == null) {
                throw new IllegalStateException("runManager is required");
            }
            return new EngineServer(this);
        }

        public Builder runManager(RunManager runManager) {
            this.runManager = runManager;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /** Port to bind. 0 picks a free port, see {@link EngineServer#port()}. */
        public Builder port(int port) {
            this.port = port;
            return this;
        }
    }
}
