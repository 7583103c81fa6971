package com.aquawatch.service.inference;

import com.aquawatch.core.error.EndpointException;
import com.aquawatch.pipeline.api.ModelInvoker;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Invokes a hosted model over HTTP: {@code POST {baseUrl}/endpoints/{endpoint}/invocations} with a
 * {@code text/csv} body. Multi-model endpoints select the variant from the target-model header.
 */
public final class HttpModelInvoker implements ModelInvoker {
    public static final String TARGET_MODEL_HEADER = "X-Target-Model";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;

    public HttpModelInvoker(HttpClient httpClient, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
    }

    @Override
    public byte[] invoke(String endpoint, byte[] payload, String targetModel) {
        URI uri = URI.create(baseUrl + "/endpoints/" + URLEncoder.encode(endpoint, StandardCharsets.UTF_8) + "/invocations");
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                .timeout(timeout)
                .header("Content-Type", "text/csv")
                .header("Accept", "text/csv,application/json,text/plain");
        if (targetModel != null && !targetModel.isBlank()) {
            builder.header(TARGET_MODEL_HEADER, targetModel);
        }
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EndpointException("Invoke endpoint interrupted: " + endpoint, e);
        } catch (Exception e) {
            throw new EndpointException("Invoke endpoint failed: " + endpoint, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new EndpointException("Invoke endpoint " + endpoint + " returned status " + response.statusCode()
                    + ": " + new String(response.body(), StandardCharsets.UTF_8).strip());
        }
        return response.body();
    }
}
