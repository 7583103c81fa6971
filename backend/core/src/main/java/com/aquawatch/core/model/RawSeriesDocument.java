package com.aquawatch.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Provider payload exactly as received. Interpretation is left to the encoder.
 */
public record RawSeriesDocument(String body) {
    public RawSeriesDocument {
        Objects.requireNonNull(body, "body is required");
    }

    public static RawSeriesDocument of(byte[] bytes) {
        return new RawSeriesDocument(new String(bytes, StandardCharsets.UTF_8));
    }

    public boolean isBlank() {
        return body.isBlank();
    }
}
