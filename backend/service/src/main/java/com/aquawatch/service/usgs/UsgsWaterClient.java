package com.aquawatch.service.usgs;

import com.aquawatch.core.error.ProviderFetchException;
import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.pipeline.api.Granularity;
import com.aquawatch.pipeline.api.TimeSeriesProvider;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * USGS Water Services client. Daily values use the mean statistic over the trailing 30 days;
 * instantaneous values return the latest reading. Sites are requested concurrently, each with its
 * own timeout, and results keep input order.
 */
public final class UsgsWaterClient implements TimeSeriesProvider {
    private static final Logger LOGGER = Logger.getLogger(UsgsWaterClient.class.getName());
    public static final String DEFAULT_BASE_URL = "https://waterservices.usgs.gov/nwis";
    static final String MEAN_STATISTIC = "00003";
    static final int DAILY_WINDOW_DAYS = 30;

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final Clock clock;
    private final Executor executor;

    public UsgsWaterClient(HttpClient httpClient, String baseUrl, Duration timeout, Clock clock, Executor executor) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.clock = clock;
        this.executor = executor;
    }

    @Override
    public List<RawSeriesDocument> fetch(List<String> siteIds, String parameterCode, Granularity granularity) {
        List<CompletableFuture<RawSeriesDocument>> requests = siteIds.stream()
                .map(siteId -> CompletableFuture.supplyAsync(() -> fetchOne(siteId, parameterCode, granularity), executor)
                        .orTimeout(timeout.toMillis() * 2, TimeUnit.MILLISECONDS))
                .toList();
        try {
            CompletableFuture.allOf(requests.toArray(CompletableFuture[]::new)).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ProviderFetchException providerError) {
                throw providerError;
            }
            throw new ProviderFetchException("USGS " + granularity + " request failed: " + cause.getMessage(), cause);
        }
        return requests.stream().map(CompletableFuture::join).toList();
    }

    URI uriFor(String siteId, String parameterCode, Granularity granularity) {
        String site = URLEncoder.encode(siteId, StandardCharsets.UTF_8);
        String parameter = URLEncoder.encode(parameterCode, StandardCharsets.UTF_8);
        if (granularity == Granularity.DAILY_30D) {
            LocalDate end = LocalDate.now(clock.withZone(ZoneOffset.UTC));
            LocalDate start = end.minusDays(DAILY_WINDOW_DAYS);
            return URI.create(baseUrl + "/dv/?format=json&sites=" + site + "&parameterCd=" + parameter
                    + "&statCd=" + MEAN_STATISTIC + "&startDT=" + start + "&endDT=" + end);
        }
        return URI.create(baseUrl + "/iv/?format=json&sites=" + site + "&parameterCd=" + parameter);
    }

    private RawSeriesDocument fetchOne(String siteId, String parameterCode, Granularity granularity) {
        URI uri = uriFor(siteId, parameterCode, granularity);
        LOGGER.fine("Fetching " + granularity + " series for site " + siteId + " from " + uri);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFetchException("USGS request interrupted for " + siteId, e);
        } catch (Exception e) {
            throw new ProviderFetchException("USGS API request failed for " + siteId, e);
        }
        if (response.statusCode() != 200) {
            throw new ProviderFetchException("USGS API non-OK status for " + siteId + ": " + response.statusCode());
        }
        return new RawSeriesDocument(response.body());
    }
}
