package com.aquawatch.service.api;

import com.aquawatch.core.error.ConfigurationException;
import com.aquawatch.core.error.PipelineException;
import com.aquawatch.core.events.AnomalyDetected;
import com.aquawatch.core.model.PredictionResult;
import com.aquawatch.core.util.JsonUtils;
import com.aquawatch.pipeline.AnomalyPipeline;
import com.aquawatch.pipeline.IngestReport;
import com.aquawatch.pipeline.SiteCheckOutcome;
import com.aquawatch.pipeline.config.AnomalyPolicy;
import com.aquawatch.service.alert.AnomalyAlertNotifier;
import com.aquawatch.service.store.EventCodec;
import com.aquawatch.service.store.EventQuery;
import com.aquawatch.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());

    private final int port;
    private final AnomalyPipeline pipeline;
    private final AnomalyAlertNotifier notifier;
    private final EventStore eventStore;
    private final AnomalyPolicy defaultPolicy;
    private final int maxSitesPerCheck;
    private final Clock clock;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            AnomalyPipeline pipeline,
            AnomalyAlertNotifier notifier,
            EventStore eventStore,
            AnomalyPolicy defaultPolicy,
            int maxSitesPerCheck,
            Clock clock
    ) {
        this.port = port;
        this.pipeline = pipeline;
        this.notifier = notifier;
        this.eventStore = eventStore;
        this.defaultPolicy = defaultPolicy;
        this.maxSitesPerCheck = maxSitesPerCheck;
        this.clock = clock;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(8);
            server.setExecutor(executor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/anomaly/check", this::handleAnomalyCheck);
            server.createContext("/api/ingest", this::handleIngest);
            server.createContext("/api/alerts", this::handleAlerts);
            server.createContext("/api/events", this::handleEvents);
            server.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleAnomalyCheck(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        AnomalyCheckRequest request;
        try {
            request = readBody(exchange, AnomalyCheckRequest.class);
        } catch (IOException invalidBody) {
            writeJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }
        List<String> sites = request.sites() == null ? List.of() : request.sites();
        if (sites.isEmpty()) {
            writeJson(exchange, 400, Map.of("error", "missing_sites"));
            return;
        }
        if (sites.size() > maxSitesPerCheck) {
            writeJson(exchange, 400, Map.of("error", "too_many_sites", "max", maxSitesPerCheck));
            return;
        }
        AnomalyPolicy policy = request.thresholdPercent() != null && request.thresholdPercent() > 0
                ? defaultPolicy.withThreshold(request.thresholdPercent())
                : defaultPolicy;

        String parameter = pipeline.parameterOrDefault(request.parameter());
        List<SiteCheckOutcome> outcomes = pipeline.checkSites(sites, parameter, policy);
        List<PredictionResult> results = new ArrayList<>();
        List<Map<String, Object>> items = new ArrayList<>();
        List<Map<String, Object>> failures = new ArrayList<>();
        for (SiteCheckOutcome outcome : outcomes) {
            if (outcome.success()) {
                results.add(outcome.result());
                items.add(toItem(outcome.result()));
            } else {
                failures.add(Map.of(
                        "site", outcome.siteId(),
                        "errorType", outcome.errorType(),
                        "message", outcome.errorMessage()
                ));
            }
        }
        int anomalies = notifier.notify(results, parameter);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("items", items);
        response.put("failures", failures);
        response.put("anomalies", anomalies);
        writeJson(exchange, 200, response);
    }

    private void handleIngest(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "POST")) {
            return;
        }
        IngestRequest request;
        try {
            request = readBody(exchange, IngestRequest.class);
        } catch (IOException invalidBody) {
            writeJson(exchange, 400, Map.of("error", "invalid_json"));
            return;
        }
        if (request.sites() == null || request.sites().isEmpty()
                || request.datasetKey() == null || request.datasetKey().isBlank()) {
            writeJson(exchange, 400, Map.of("error", "missing_fields"));
            return;
        }
        try {
            IngestReport report = pipeline.ingest(request.sites(), request.parameter(), request.datasetKey());
            writeJson(exchange, 200, report);
        } catch (ConfigurationException e) {
            writeJson(exchange, 400, Map.of("error", e.errorType(), "message", e.getMessage()));
        } catch (PipelineException e) {
            LOGGER.log(Level.WARNING, "Ingest failed for " + request.sites(), e);
            writeJson(exchange, 502, Map.of("error", e.errorType(), "message", e.getMessage()));
        } catch (IllegalArgumentException e) {
            writeJson(exchange, 400, Map.of("error", "invalid_request", "message", e.getMessage()));
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Ingest failed for " + request.sites(), e);
            writeJson(exchange, 500, Map.of("error", "internal"));
        }
    }

    private void handleAlerts(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        int minutes;
        try {
            String raw = queryParams(exchange.getRequestURI()).get("minutes");
            minutes = raw == null || raw.isBlank() ? 10 : Integer.parseInt(raw);
        } catch (NumberFormatException invalidParam) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        Instant since = clock.instant().minus(Duration.ofMinutes(Math.max(1, minutes)));
        List<AnomalyDetected> alerts = eventStore.recentAnomalies(since, EventQuery.DEFAULT_LIMIT);
        writeJson(exchange, 200, Map.of("items", alerts));
    }

    private void handleEvents(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        EventQuery eventQuery;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            eventQuery = EventQuery.since(query.containsKey("since") ? Instant.parse(query.get("since")) : null)
                    .forSite(query.get("site"))
                    .newest(query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : EventQuery.DEFAULT_LIMIT);
            String type = query.get("type");
            if (type != null && !type.isBlank()) {
                eventQuery = eventQuery.ofType(EventCodec.typeNamed(type)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown event type " + type)));
            }
        } catch (RuntimeException invalidParamError) {
            writeJson(exchange, 400, Map.of("error", "invalid_query_params"));
            return;
        }
        writeJson(exchange, 200, eventStore.query(eventQuery));
    }

    private static Map<String, Object> toItem(PredictionResult result) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("site", result.siteId());
        item.put("datasetKey", result.datasetKey());
        item.put("observedValue", result.observedValue());
        item.put("predictedValue", result.predictedValue());
        item.put("percentChange", result.percentChange());
        item.put("anomalous", result.anomalous());
        if (result.anomalous()) {
            item.put("anomalousReason", AnomalyAlertNotifier.ANOMALY_REASON);
        }
        item.put("sourceTier", result.sourceTier());
        item.put("placeholderData", result.placeholderData());
        return item;
    }

    private boolean ensureMethod(HttpExchange exchange, String method) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", method + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            writeJson(exchange, 405, Map.of("error", "method_not_allowed"));
            return false;
        }
        return true;
    }

    private static <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            T value = JsonUtils.objectMapper().readValue(in, type);
            if (value == null) {
                throw new IOException("Empty request body");
            }
            return value;
        }
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    private record AnomalyCheckRequest(List<String> sites, String parameter, Double thresholdPercent) {
    }

    private record IngestRequest(List<String> sites, String parameter, String datasetKey) {
    }
}
