package com.aquawatch.service.alert;

import com.aquawatch.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookAlertPublisherTest {
    private HttpServer server;
    private final AtomicReference<String> received = new AtomicReference<>();

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void postsSubjectAndTextAsJson() throws Exception {
        startServer(204);

        publisher().publish("AquaWatch Anomalies Detected (1)", "Site 03339000 anomalous\n");

        JsonNode body = JsonUtils.objectMapper().readTree(received.get());
        assertEquals("AquaWatch Anomalies Detected (1)", body.path("subject").asText());
        assertEquals("Site 03339000 anomalous\n", body.path("text").asText());
    }

    @Test
    void blankSubjectIsOmitted() throws Exception {
        startServer(200);

        publisher().publish(" ", "text only");

        JsonNode body = JsonUtils.objectMapper().readTree(received.get());
        assertFalse(body.has("subject"));
        assertEquals("text only", body.path("text").asText());
    }

    @Test
    void rejectedDeliveryIsReported() throws Exception {
        startServer(403);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> publisher().publish("s", "m"));
        assertTrue(ex.getMessage().contains("403"));
    }

    private WebhookAlertPublisher publisher() {
        return new WebhookAlertPublisher(
                HttpClient.newHttpClient(),
                URI.create("http://localhost:" + server.getAddress().getPort() + "/hooks/alerts"),
                Duration.ofSeconds(2)
        );
    }

    private void startServer(int status) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/hooks/alerts", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                received.set(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();
    }
}
