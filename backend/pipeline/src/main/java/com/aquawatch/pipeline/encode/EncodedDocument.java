package com.aquawatch.pipeline.encode;

import com.aquawatch.core.model.FeatureRow;
import com.aquawatch.core.model.Observation;

import java.util.List;
import java.util.Optional;

/**
 * Result of a single parse pass: every feature row in document order plus the latest observation
 * of the first series that had any valid point.
 */
public record EncodedDocument(List<FeatureRow> rows, Optional<Observation> latestObservation) {
    public EncodedDocument {
        rows = List.copyOf(rows);
    }

    public String toCsv() {
        StringBuilder csv = new StringBuilder();
        for (FeatureRow row : rows) {
            csv.append(row.toCsvLine()).append('\n');
        }
        return csv.toString();
    }
}
