package com.aquawatch.service.usgs;

import com.aquawatch.core.error.ProviderFetchException;
import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.pipeline.api.Granularity;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UsgsWaterClientTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    private HttpServer server;
    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
        executor.shutdownNow();
    }

    @Test
    void dailyUriRequestsMeanOverTrailingThirtyDays() {
        UsgsWaterClient client = client("https://waterservices.usgs.gov/nwis/");

        URI uri = client.uriFor("03339000", "00060", Granularity.DAILY_30D);

        assertEquals("https://waterservices.usgs.gov/nwis/dv/?format=json&sites=03339000&parameterCd=00060"
                + "&statCd=00003&startDT=2026-01-30&endDT=2026-03-01", uri.toString());
    }

    @Test
    void instantaneousUriRequestsLatestValue() {
        UsgsWaterClient client = client(UsgsWaterClient.DEFAULT_BASE_URL);

        URI uri = client.uriFor("03339000", "00065", Granularity.INSTANTANEOUS);

        assertEquals("https://waterservices.usgs.gov/nwis/iv/?format=json&sites=03339000&parameterCd=00065", uri.toString());
    }

    @Test
    void fetchReturnsOneDocumentPerSiteInInputOrder() throws Exception {
        List<String> queries = new CopyOnWriteArrayList<>();
        startServer(exchange -> {
            String query = exchange.getRequestURI().getQuery();
            queries.add(query);
            String site = query.replaceAll(".*sites=([^&]+).*", "$1");
            if (site.equals("slow")) {
                sleep(150);
            }
            writeResponse(exchange, 200, "{\"site\":\"" + site + "\"}");
        });
        UsgsWaterClient client = client("http://localhost:" + server.getAddress().getPort());

        List<RawSeriesDocument> documents = client.fetch(List.of("slow", "01646500"), "00060", Granularity.INSTANTANEOUS);

        assertEquals(List.of("{\"site\":\"slow\"}", "{\"site\":\"01646500\"}"),
                documents.stream().map(RawSeriesDocument::body).toList());
        assertEquals(2, queries.size());
        assertTrue(queries.stream().allMatch(query -> query.contains("parameterCd=00060")));
    }

    @Test
    void anySiteFailureFailsTheWholeBatch() throws Exception {
        startServer(exchange -> {
            boolean broken = exchange.getRequestURI().getQuery().contains("sites=broken");
            writeResponse(exchange, broken ? 503 : 200, "{}");
        });
        UsgsWaterClient client = client("http://localhost:" + server.getAddress().getPort());

        ProviderFetchException ex = assertThrows(ProviderFetchException.class,
                () -> client.fetch(List.of("03339000", "broken"), "00060", Granularity.DAILY_30D));
        assertTrue(ex.getMessage().contains("503"));
    }

    @Test
    void unreachableHostIsAProviderFailure() {
        UsgsWaterClient client = client("http://localhost:1");

        assertThrows(ProviderFetchException.class,
                () -> client.fetch(List.of("03339000"), "00060", Granularity.INSTANTANEOUS));
    }

    private UsgsWaterClient client(String baseUrl) {
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build();
        return new UsgsWaterClient(httpClient, baseUrl, Duration.ofSeconds(2), CLOCK, executor);
    }

    private void startServer(ExchangeHandler handler) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/iv/", handler::handle);
        server.createContext("/dv/", handler::handle);
        server.start();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void writeResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    @FunctionalInterface
    private interface ExchangeHandler {
        void handle(HttpExchange exchange) throws IOException;
    }
}
