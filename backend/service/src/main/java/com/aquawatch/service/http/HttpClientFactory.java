package com.aquawatch.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Shared client for USGS, NOAA, inference and webhook calls. {@code UPSTREAM_TRUSTSTORE_PATH} replaces the
 * JVM trust anchors, for deployments behind a TLS-inspecting proxy.
 */
public final class HttpClientFactory {
    static final String TRUSTSTORE_PATH = "UPSTREAM_TRUSTSTORE_PATH";
    static final String TRUSTSTORE_PASSWORD = "UPSTREAM_TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        upstreamTrust(environment).ifPresent(builder::sslContext);
        return builder.build();
    }

    static Optional<SSLContext> upstreamTrust(Map<String, String> environment) {
        String truststorePath = environment.get(TRUSTSTORE_PATH);
        if (truststorePath == null || truststorePath.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(TRUSTSTORE_PASSWORD);
        if (password == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        Path path = Path.of(truststorePath);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Upstream truststore does not exist: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            KeyStore anchors = KeyStore.getInstance(storeType(path));
            anchors.load(in, password.toCharArray());
            TrustManagerFactory trust = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trust.init(anchors);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trust.getTrustManagers(), new SecureRandom());
            return Optional.of(context);
        } catch (Exception e) {
            throw new IllegalStateException("Failed loading upstream truststore " + path, e);
        }
    }

    static String storeType(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jks") ? "JKS" : "PKCS12";
    }
}
