package com.aquawatch.service.inference;

import com.aquawatch.core.error.EndpointException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpModelInvokerTest {
    private HttpServer server;
    private final Map<String, String> captured = new ConcurrentHashMap<>();

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void postsCsvWithTargetModelHeader() throws Exception {
        startServer(200, "[66.5]");

        byte[] output = invoker().invoke("flow-endpoint", "1756052100,40.1,-87.5,75\n".getBytes(StandardCharsets.UTF_8),
                "model-03339000.tar.gz");

        assertEquals("[66.5]", new String(output, StandardCharsets.UTF_8));
        assertEquals("POST /endpoints/flow-endpoint/invocations", captured.get("request"));
        assertEquals("text/csv", captured.get("contentType"));
        assertEquals("model-03339000.tar.gz", captured.get("targetModel"));
        assertEquals("1756052100,40.1,-87.5,75\n", captured.get("body"));
    }

    @Test
    void blankTargetModelOmitsHeader() throws Exception {
        startServer(200, "1");

        invoker().invoke("flow-endpoint", new byte[0], " ");

        assertFalse(captured.containsKey("targetModel"));
    }

    @Test
    void errorStatusIsAnEndpointFailureWithResponseDetail() throws Exception {
        startServer(424, "model artifact missing");

        EndpointException ex = assertThrows(EndpointException.class,
                () -> invoker().invoke("flow-endpoint", new byte[0], "m"));
        assertTrue(ex.getMessage().contains("424"));
        assertTrue(ex.getMessage().contains("model artifact missing"));
    }

    @Test
    void unreachableEndpointIsAnEndpointFailure() {
        HttpModelInvoker invoker = new HttpModelInvoker(HttpClient.newHttpClient(), "http://localhost:1", Duration.ofSeconds(1));

        assertThrows(EndpointException.class, () -> invoker.invoke("flow-endpoint", new byte[0], "m"));
    }

    private HttpModelInvoker invoker() {
        return new HttpModelInvoker(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                "http://localhost:" + server.getAddress().getPort() + "/",
                Duration.ofSeconds(2)
        );
    }

    private void startServer(int status, String response) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/endpoints/", exchange -> {
            captured.put("request", exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
            captured.put("contentType", exchange.getRequestHeaders().getFirst("Content-Type"));
            String model = exchange.getRequestHeaders().getFirst(HttpModelInvoker.TARGET_MODEL_HEADER);
            if (model != null) {
                captured.put("targetModel", model);
            }
            try (InputStream in = exchange.getRequestBody()) {
                captured.put("body", new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            write(exchange, status, response);
        });
        server.start();
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }
}
