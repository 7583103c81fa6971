package com.aquawatch.pipeline.source;

import com.aquawatch.core.model.RawSeriesDocument;
import com.aquawatch.core.model.SourceTier;

import java.util.List;

/**
 * One rung of the fetch ladder. Receives trimmed, non-blank site ids and returns one document per id.
 */
public interface FetchStrategy {
    SourceTier tier();

    List<RawSeriesDocument> fetch(List<String> siteIds, String parameterCode);
}
