package com.aquawatch.pipeline.support;

import com.aquawatch.core.model.RawSeriesDocument;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class Fixtures {
    private Fixtures() {
    }

    public static RawSeriesDocument document(String relativePath) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(relativePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: " + relativePath);
            }
            return new RawSeriesDocument(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
