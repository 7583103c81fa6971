package com.aquawatch.service.alert;

import com.aquawatch.core.util.JsonUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Posts {@code {"subject": ..., "text": ...}} to a webhook, a shape chat integrations accept directly.
 */
public final class WebhookAlertPublisher implements AlertPublisher {
    private static final Logger LOGGER = Logger.getLogger(WebhookAlertPublisher.class.getName());

    private final HttpClient httpClient;
    private final URI webhook;
    private final Duration timeout;

    public WebhookAlertPublisher(HttpClient httpClient, URI webhook, Duration timeout) {
        this.httpClient = httpClient;
        this.webhook = webhook;
        this.timeout = timeout;
    }

    @Override
    public void publish(String subject, String message) {
        String body = JsonUtils.toJson(new WebhookMessage(subject == null || subject.isBlank() ? null : subject, message));
        HttpRequest request = HttpRequest.newBuilder(webhook)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Alert webhook interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("Alert webhook request failed for " + webhook, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new IllegalStateException("Alert webhook returned status " + response.statusCode());
        }
        LOGGER.info("Published alert '" + subject + "' to webhook");
    }

    private record WebhookMessage(String subject, String text) {
    }
}
