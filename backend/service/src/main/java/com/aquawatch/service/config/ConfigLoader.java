package com.aquawatch.service.config;

import com.aquawatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {
    public static final String SERVICE_CONFIG_FILE = "service.json";

    private ConfigLoader() {
    }

    public static ServiceConfig load(Path configDir, Map<String, String> environment) {
        return applyEnvironment(read(configDir.resolve(SERVICE_CONFIG_FILE)), environment);
    }

    static ServiceConfig read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ServiceConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    /**
     * Overlays deployment-specific values from the environment onto the file config.
     */
    static ServiceConfig applyEnvironment(ServiceConfig base, Map<String, String> env) {
        ServiceConfig.InferenceSettings inference = base.inference();
        ServiceConfig.ProviderSettings providers = base.providers();
        return new ServiceConfig(
                base.port(),
                env.getOrDefault("DATA_DIR", base.dataDir()),
                base.maxSitesPerCheck(),
                new ServiceConfig.ProviderSettings(
                        providers.usgsBaseUrl(),
                        providers.noaaBaseUrl(),
                        env.getOrDefault("NOAA_USER_AGENT", providers.noaaUserAgent()),
                        providers.timeout(),
                        providers.fetchConcurrency()
                ),
                new ServiceConfig.InferenceSettings(
                        env.getOrDefault("INFERENCE_BASE_URL", inference.baseUrl()),
                        env.getOrDefault("INFERENCE_ENDPOINT", inference.endpoint()),
                        env.getOrDefault("DEFAULT_MODEL", inference.targetModel()),
                        inference.defaultParameterCode(),
                        inference.timeout()
                ),
                base.anomaly(),
                env.getOrDefault("ALERT_WEBHOOK_URL", base.alertWebhookUrl()),
                base.ingest()
        );
    }
}
