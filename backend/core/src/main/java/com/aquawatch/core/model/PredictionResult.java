package com.aquawatch.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Outcome of one fetch-encode-infer-decide run for a single site.
 * {@code observedValue} and {@code predictedValue} are rounded for presentation;
 * {@code percentChange} is computed from the unrounded values.
 */
public record PredictionResult(
        String siteId,
        double observedValue,
        double predictedValue,
        double percentChange,
        boolean anomalous,
        String datasetKey,
        SourceTier sourceTier
) {
    public static PredictionResult of(
            String siteId,
            double observed,
            double predicted,
            double percentChange,
            boolean anomalous,
            String datasetKey,
            SourceTier sourceTier
    ) {
        return new PredictionResult(
                siteId,
                roundTwoPlaces(observed),
                roundTwoPlaces(predicted),
                percentChange,
                anomalous,
                datasetKey,
                sourceTier
        );
    }

    public boolean placeholderData() {
        return sourceTier != null && sourceTier.isPlaceholder();
    }

    static double roundTwoPlaces(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
