package com.agropulse.service.api;

import com.agropulse.core.model.QuoteBoard;
import com.agropulse.core.model.Snapshot;
import com.agropulse.core.model.Timestamped;
import com.agropulse.core.model.TopicCatalog;
import com.agropulse.core.util.JsonUtils;
import com.agropulse.service.cache.DataUnavailableException;
import com.agropulse.service.cache.RefreshCoordinator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final DiagnosticsTracker EMPTY_DIAGNOSTICS = DiagnosticsTracker.empty();

    private final int port;
    private final RefreshCoordinator<Snapshot> news;
    private final RefreshCoordinator<QuoteBoard> quotes;
    private final TopicCatalog catalog;
    private final SseBroadcaster sseBroadcaster;
    private final DiagnosticsTracker diagnosticsTracker;
    private final ResponseViews views;

    private HttpServer server;
    private ExecutorService handlerExecutor;

    public ApiServer(
            int port,
            RefreshCoordinator<Snapshot> news,
            RefreshCoordinator<QuoteBoard> quotes,
            TopicCatalog catalog,
            SseBroadcaster sseBroadcaster,
            DiagnosticsTracker diagnosticsTracker,
            ZoneId displayZone
    ) {
        this.port = port;
        this.news = news;
        this.quotes = quotes;
        this.catalog = catalog;
        this.sseBroadcaster = sseBroadcaster;
        this.diagnosticsTracker = diagnosticsTracker;
        this.views = new ResponseViews(displayZone);
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            handlerExecutor = Executors.newCachedThreadPool();
            server.setExecutor(handlerExecutor);
            server.createContext("/api/health", this::handleHealth);
            server.createContext("/api/news", exchange -> handleCache(exchange, news, views::news));
            server.createContext("/api/quotes", exchange -> handleCache(exchange, quotes, views::quotes));
            server.createContext("/api/topics", this::handleTopics);
            server.createContext("/api/status", this::handleStatus);
            server.createContext("/api/stream", sseBroadcaster::handle);
            server.start();
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (handlerExecutor != null) {
            handlerExecutor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange, true)) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private <T extends Timestamped> void handleCache(
            HttpExchange exchange,
            RefreshCoordinator<T> coordinator,
            Function<T, Map<String, Object>> view
    ) throws IOException {
        if (!ensureGet(exchange, true)) {
            return;
        }
        boolean force = "true".equalsIgnoreCase(queryParams(exchange.getRequestURI()).get("refresh"));
        if (force) {
            coordinator.requestRefresh(true);
        }
        T snapshot;
        try {
            snapshot = coordinator.getSnapshot();
        } catch (DataUnavailableException e) {
            LOGGER.log(Level.INFO, e.getMessage());
            writeJson(exchange, 503, Map.of("error", "data_unavailable"));
            return;
        }
        writeJson(exchange, 200, view.apply(snapshot));
    }

    private void handleTopics(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange, true)) {
            return;
        }
        writeJson(exchange, 200, views.catalog(catalog));
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!ensureGet(exchange, true)) {
            return;
        }
        Map<String, Object> caches = new LinkedHashMap<>();
        caches.put(news.name(), news.status().toMap());
        caches.put(quotes.name(), quotes.status().toMap());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("caches", caches);
        body.put("metrics", diagnostics().metricsSnapshot());
        writeJson(exchange, 200, body);
    }

    private boolean ensureGet(HttpExchange exchange, boolean corsEnabled) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            if (corsEnabled) {
                exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
                exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
                exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            }
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
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

    private DiagnosticsTracker diagnostics() {
        return diagnosticsTracker != null ? diagnosticsTracker : EMPTY_DIAGNOSTICS;
    }
}
