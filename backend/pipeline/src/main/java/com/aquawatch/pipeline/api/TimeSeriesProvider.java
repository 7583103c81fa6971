package com.aquawatch.pipeline.api;

import com.aquawatch.core.model.RawSeriesDocument;

import java.util.List;

/**
 * Remote source of raw time-series documents.
 */
public interface TimeSeriesProvider {
    /**
     * Returns one document per site id, in input order. Ids are already trimmed and non-blank.
     * Any single-site failure fails the whole call with a {@link com.aquawatch.core.error.ProviderFetchException}.
     */
    List<RawSeriesDocument> fetch(List<String> siteIds, String parameterCode, Granularity granularity);
}
