package com.aquawatch.pipeline.source;

import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.core.model.SourceTier;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Last rung of the ladder: a canned instantaneous-values document bundled with the application.
 * Only the first slot receives it so a batch does not multiply identical rows.
 */
public final class PlaceholderFetchStrategy implements FetchStrategy {
    public static final String DEFAULT_RESOURCE = "placeholder/usgs-iv-03339000.json";

    private final RawSeriesDocument placeholder;

    public PlaceholderFetchStrategy(RawSeriesDocument placeholder) {
        this.placeholder = placeholder;
    }

    public static PlaceholderFetchStrategy fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static PlaceholderFetchStrategy fromClasspath(String resource) {
        try (InputStream in = PlaceholderFetchStrategy.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Placeholder document not found on classpath: " + resource);
            }
            return new PlaceholderFetchStrategy(new RawSeriesDocument(new String(in.readAllBytes(), StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading placeholder document " + resource, e);
        }
    }

    @Override
    public SourceTier tier() {
        return SourceTier.PLACEHOLDER;
    }

    @Override
    public List<RawSeriesDocument> fetch(List<String> siteIds, String parameterCode) {
        List<RawSeriesDocument> documents = new ArrayList<>(Collections.nCopies(siteIds.size(), new RawSeriesDocument("")));
        if (!documents.isEmpty()) {
            documents.set(0, placeholder);
        }
        return documents;
    }
}
