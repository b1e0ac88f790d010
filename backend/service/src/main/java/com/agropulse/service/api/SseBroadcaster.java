package com.agropulse.service.api;

import com.agropulse.core.bus.EventBus;
import com.agropulse.core.events.Event;
import com.agropulse.core.events.RefreshCompleted;
import com.agropulse.core.events.SnapshotPublished;
import com.agropulse.core.util.JsonUtils;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

public class SseBroadcaster {
    private static final Logger LOGGER = Logger.getLogger(SseBroadcaster.class.getName());

    private final List<SseClient> clients = new CopyOnWriteArrayList<>();
    private final Duration keepAlive;

    public SseBroadcaster(EventBus eventBus) {
        this(eventBus, Duration.ofSeconds(15));
    }

    SseBroadcaster(EventBus eventBus, Duration keepAlive) {
        this.keepAlive = keepAlive;
        eventBus.subscribe(SnapshotPublished.class, this::broadcast);
        eventBus.subscribe(RefreshCompleted.class, this::broadcast);
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, 0);

        OutputStream out = exchange.getResponseBody();
        SseClient client = new SseClient(exchange, out);
        clients.add(client);

        try {
            writeRaw(client, ": connected\n\n");
            while (!Thread.currentThread().isInterrupted()) {
                Thread.sleep(keepAlive.toMillis());
                writeRaw(client, ": keepalive\n\n");
            }
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "SSE client disconnected: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            removeClient(client);
        }
    }

    public void broadcast(Event event) {
        String payload = "event: " + event.type() + "\n" +
                "data: " + new String(JsonUtils.toBytes(event), StandardCharsets.UTF_8) + "\n\n";

        for (SseClient client : clients) {
            try {
                writeRaw(client, payload);
            } catch (IOException e) {
                LOGGER.log(Level.FINE, "Dropping SSE client: " + e.getMessage());
                removeClient(client);
            }
        }
    }

    public int clientCount() {
        return clients.size();
    }

    private void writeRaw(SseClient client, String data) throws IOException {
        synchronized (client) {
            client.outputStream().write(data.getBytes(StandardCharsets.UTF_8));
            client.outputStream().flush();
        }
    }

    private void removeClient(SseClient client) {
        if (clients.remove(client)) {
            client.close();
        }
    }

    private record SseClient(HttpExchange exchange, OutputStream outputStream) {
        private void close() {
            try {
                outputStream.close();
            } catch (IOException e) {
                LOGGER.log(Level.FINE, "SSE stream already closed: " + e.getMessage());
            }
            exchange.close();
        }
    }
}
