package com.cycleforecast.service;

import com.cycleforecast.core.codec.ForecastCodec;
import com.cycleforecast.core.exception.CyclePredictionException;
import com.cycleforecast.core.model.EventLog;
import com.cycleforecast.core.model.PredictionRecord;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP front end for a {@link CycleTracker}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}, {@code GET /readiness} - {@code {"status":"UP"}}</li>
 * <li>{@code GET /api/prediction?owner=} - current prediction, 404 without logs</li>
 * <li>{@code GET /api/statistics?owner=} - summary plus interval statistics</li>
 * <li>{@code GET /api/logs?owner=} - logs, oldest first</li>
 * <li>{@code POST /api/logs?owner=&date=} - record a start date, 409 on duplicates</li>
 * <li>{@code DELETE /api/logs?owner=&id=} - remove a log</li>
 * </ul>
 *
 * <p>
 * Any prediction failure maps to {@code 503} with a generic body; parse and
 * provider details go to the log only.
 * </p>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no servlet container is
 * required.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastHttpServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    static final String PREDICTION_UNAVAILABLE = "prediction unavailable, try again";

    private final CycleTracker tracker;
    private final ForecastCodec codec;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private HttpServer server;
    private ExecutorService executor;

    public ForecastHttpServer(CycleTracker tracker, ForecastCodec codec) {
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; {@code 0} picks an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("HTTP port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            LOG.error("Failed to start HTTP server on port {}: {}", port, e.getMessage(), e);
            throw new UncheckedIOException("Cannot bind HTTP port " + port, e);
        }
        server.createContext("/health", ForecastHttpServer::handleHealthCheck);
        server.createContext("/readiness", ForecastHttpServer::handleHealthCheck);
        server.createContext("/api/prediction", guarded(this::handlePrediction));
        server.createContext("/api/statistics", guarded(this::handleStatistics));
        server.createContext("/api/logs", guarded(this::handleLogs));

        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newFixedThreadPool(4,
                r -> new Thread(r, "forecast-http-" + threadCount.incrementAndGet()));
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("HTTP server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("HTTP server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server has not been started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("HTTP server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, HEALTH_RESPONSE.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(HEALTH_RESPONSE);
        }
    }

    private void handlePrediction(HttpExchange exchange, Map<String, String> query) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        String owner = requireParam(exchange, query, "owner");
        if (owner == null) {
            return;
        }
        Optional<PredictionRecord> prediction = tracker.currentPrediction(owner);
        if (prediction.isEmpty()) {
            sendError(exchange, 404, "no logs for owner");
            return;
        }
        sendJson(exchange, 200, codec.toJson(prediction.get()));
    }

    private void handleStatistics(HttpExchange exchange, Map<String, String> query) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        String owner = requireParam(exchange, query, "owner");
        if (owner == null) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", tracker.summary(owner));
        body.put("statistics", tracker.statistics(owner).orElse(null));
        sendJson(exchange, 200, codec.toJson(body));
    }

    private void handleLogs(HttpExchange exchange, Map<String, String> query) throws IOException {
        String owner = requireParam(exchange, query, "owner");
        if (owner == null) {
            return;
        }
        switch (exchange.getRequestMethod()) {
            case "GET" -> sendJson(exchange, 200, codec.toJson(tracker.logsFor(owner)));
            case "POST" -> {
                String rawDate = requireParam(exchange, query, "date");
                if (rawDate == null) {
                    return;
                }
                LocalDate date;
                try {
                    date = LocalDate.parse(rawDate);
                } catch (DateTimeParseException e) {
                    sendError(exchange, 400, "date must be YYYY-MM-DD");
                    return;
                }
                try {
                    EventLog log = tracker.logEvent(owner, date);
                    sendJson(exchange, 201, codec.toJson(log));
                } catch (DuplicateLogException e) {
                    sendError(exchange, 409, e.getMessage());
                }
            }
            case "DELETE" -> {
                String id = requireParam(exchange, query, "id");
                if (id == null) {
                    return;
                }
                if (tracker.deleteLog(owner, id)) {
                    exchange.sendResponseHeaders(204, -1);
                    exchange.close();
                } else {
                    sendError(exchange, 404, "no such log");
                }
            }
            default -> sendError(exchange, 405, "method not allowed");
        }
    }

    // ---------------------------------------------------------------
    // Plumbing
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface ApiHandler {
        void handle(HttpExchange exchange, Map<String, String> query) throws IOException;
    }

    private HttpHandler guarded(ApiHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange, parseQuery(exchange.getRequestURI().getRawQuery()));
            } catch (CyclePredictionException e) {
                LOG.error("Prediction failed for {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                sendError(exchange, 503, PREDICTION_UNAVAILABLE);
            } catch (IllegalArgumentException e) {
                LOG.warn("Bad request {} {}: {}", exchange.getRequestMethod(), exchange.getRequestURI(),
                        e.getMessage());
                sendError(exchange, 400, e.getMessage());
            } catch (RuntimeException e) {
                LOG.error("Unhandled error for {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                sendError(exchange, 500, "internal error");
            }
        };
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equals(exchange.getRequestMethod())) {
            return true;
        }
        sendError(exchange, 405, "method not allowed");
        return false;
    }

    private String requireParam(HttpExchange exchange, Map<String, String> query, String name)
            throws IOException {
        String value = query.get(name);
        if (value == null || value.isBlank()) {
            sendError(exchange, 400, "missing query parameter '" + name + "'");
            return null;
        }
        return value;
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        sendJson(exchange, status, codec.toJson(Map.of("error", String.valueOf(message))));
    }

    private static void sendJson(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
