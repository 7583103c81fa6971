package com.aquawatch.pipeline.source;

import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.core.model.SourceTier;

import java.util.List;
import java.util.Optional;

/**
 * Documents aligned index-for-index with the requested site ids. Blank ids map to empty slots.
 */
public record FetchResult(List<Optional<RawSeriesDocument>> documents, SourceTier tier) {
    public FetchResult {
        documents = List.copyOf(documents);
    }

    public Optional<RawSeriesDocument> first() {
        return documents.isEmpty() ? Optional.empty() : documents.get(0);
    }
}
