package com.aquawatch.core.model;

import java.util.Locale;

/**
 * One training/inference record: the observed value as label followed by four features.
 * The text form is the stored dataset format and must stay byte-compatible with trained models.
 */
public record FeatureRow(
        double labelValue,
        long epochSeconds,
        double latitude,
        double longitude,
        int temperature
) {
    public static final int FIELD_COUNT = 5;

    public static FeatureRow from(Observation observation, int temperature) {
        return new FeatureRow(
                observation.value(),
                observation.timestamp().getEpochSecond(),
                observation.latitude(),
                observation.longitude(),
                temperature
        );
    }

    public String toCsvLine() {
        return String.format(Locale.ROOT, "%.6f,%d,%.6f,%.6f,%d",
                labelValue, epochSeconds, latitude, longitude, temperature);
    }
}
