package com.aquawatch.service.config;

import com.aquawatch.pipeline.config.AnomalyPolicy;
import com.aquawatch.pipeline.config.PipelineConfig;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record ServiceConfig(
        int port,
        String dataDir,
        int maxSitesPerCheck,
        ProviderSettings providers,
        InferenceSettings inference,
        AnomalyPolicy anomaly,
        String alertWebhookUrl,
        IngestSettings ingest
) {
    public ServiceConfig {
        port = port <= 0 ? 8080 : port;
        dataDir = dataDir == null || dataDir.isBlank() ? "data" : dataDir;
        maxSitesPerCheck = maxSitesPerCheck <= 0 ? 10 : maxSitesPerCheck;
        providers = Objects.requireNonNullElseGet(providers, () -> new ProviderSettings(null, null, null, null, 0));
        inference = Objects.requireNonNullElseGet(inference, () -> new InferenceSettings(null, null, null, null, null));
        anomaly = Objects.requireNonNullElse(anomaly, AnomalyPolicy.DEFAULT);
        ingest = Objects.requireNonNullElseGet(ingest, () -> new IngestSettings(false, null, List.of(), null, null));
    }

    public PipelineConfig pipelineConfig() {
        return new PipelineConfig(
                inference.endpoint(),
                inference.targetModel(),
                inference.defaultParameterCode(),
                PipelineConfig.DEFAULT_DATASET_PREFIX,
                anomaly
        );
    }

    public record ProviderSettings(
            String usgsBaseUrl,
            String noaaBaseUrl,
            String noaaUserAgent,
            Duration timeout,
            int fetchConcurrency
    ) {
        public ProviderSettings {
            usgsBaseUrl = usgsBaseUrl == null || usgsBaseUrl.isBlank() ? "https://waterservices.usgs.gov/nwis" : usgsBaseUrl;
            noaaBaseUrl = noaaBaseUrl == null || noaaBaseUrl.isBlank() ? "https://api.weather.gov" : noaaBaseUrl;
            noaaUserAgent = noaaUserAgent == null || noaaUserAgent.isBlank()
                    ? "aquawatch/1.0 (contact: dev@aquawatch)"
                    : noaaUserAgent;
            timeout = Objects.requireNonNullElse(timeout, Duration.ofSeconds(10));
            fetchConcurrency = fetchConcurrency <= 0 ? 4 : fetchConcurrency;
        }
    }

    public record InferenceSettings(
            String baseUrl,
            String endpoint,
            String targetModel,
            String defaultParameterCode,
            Duration timeout
    ) {
        public InferenceSettings {
            baseUrl = baseUrl == null ? "" : baseUrl;
            timeout = Objects.requireNonNullElse(timeout, Duration.ofSeconds(30));
        }
    }

    public record IngestSettings(
            boolean enabled,
            Duration interval,
            List<String> sites,
            String parameterCode,
            String datasetKey
    ) {
        public IngestSettings {
            interval = Objects.requireNonNullElse(interval, Duration.ofHours(6));
            sites = sites == null ? List.of() : List.copyOf(sites);
            datasetKey = datasetKey == null || datasetKey.isBlank() ? "processed/dataset.csv" : datasetKey;
        }
    }
}
