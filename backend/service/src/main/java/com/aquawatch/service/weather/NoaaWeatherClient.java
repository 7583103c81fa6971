package com.aquawatch.service.weather;

import com.aquawatch.core.model.WeatherReading;
import com.aquawatch.core.util.JsonUtils;
import com.aquawatch.pipeline.api.WeatherLookup;
import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;

/**
 * Current conditions from api.weather.gov: resolve the point's forecast URL, then take the first period.
 */
public final class NoaaWeatherClient implements WeatherLookup {
    public static final String DEFAULT_BASE_URL = "https://api.weather.gov";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final String userAgent;

    public NoaaWeatherClient(HttpClient httpClient, String baseUrl, Duration timeout, String userAgent) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public WeatherReading currentFor(double latitude, double longitude) {
        try {
            JsonNode points = getJson(URI.create(baseUrl + "/points/"
                    + String.format(Locale.ROOT, "%.4f,%.4f", latitude, longitude)));
            String forecastUrl = points.path("properties").path("forecast").asText("");
            if (forecastUrl.isBlank()) {
                throw new IllegalStateException("NOAA points response missing forecast URL");
            }
            JsonNode periods = getJson(URI.create(forecastUrl)).path("properties").path("periods");
            if (!periods.isArray() || periods.isEmpty()) {
                throw new IllegalStateException("NOAA forecast response missing periods");
            }
            JsonNode period = periods.get(0);
            if (!period.path("temperature").isNumber()) {
                throw new IllegalStateException("NOAA forecast period missing temperature");
            }
            return new WeatherReading(
                    (int) Math.round(period.path("temperature").asDouble()),
                    period.path("temperatureUnit").asText(""),
                    period.path("windSpeed").asText(""),
                    period.path("windDirection").asText("")
            );
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("NOAA weather request interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException("NOAA weather request failed", e);
        }
    }

    private JsonNode getJson(URI uri) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/geo+json,application/json")
                .header("User-Agent", userAgent)
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IllegalStateException("NOAA request failed with status " + response.statusCode() + " for " + uri);
        }
        return JsonUtils.objectMapper().readTree(response.body());
    }
}
