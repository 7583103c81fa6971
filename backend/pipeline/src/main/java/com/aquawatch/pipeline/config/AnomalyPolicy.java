package com.aquawatch.pipeline.config;

/**
 * @param thresholdPercent percentage points the deviation must exceed
 * @param minimumFloor     absolute value the prediction must exceed before anything is flagged
 */
public record AnomalyPolicy(double thresholdPercent, double minimumFloor) {
    public static final AnomalyPolicy DEFAULT = new AnomalyPolicy(20, 15);

    public AnomalyPolicy withThreshold(double thresholdPercent) {
        return new AnomalyPolicy(thresholdPercent, minimumFloor);
    }
}
