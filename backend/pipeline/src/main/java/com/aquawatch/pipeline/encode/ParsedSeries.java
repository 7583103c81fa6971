package com.aquawatch.pipeline.encode;

import com.aquawatch.core.model.Observation;

import java.util.List;

/**
 * One named series from a provider document, with the points that survived parsing.
 */
public record ParsedSeries(
        String siteId,
        String unit,
        double latitude,
        double longitude,
        List<Observation> observations,
        int skippedTimestamps,
        int zeroedValues
) {
    public ParsedSeries {
        observations = List.copyOf(observations);
    }
}
