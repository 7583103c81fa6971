package com.aquawatch.pipeline.detect;

import com.aquawatch.pipeline.config.AnomalyPolicy;

import java.util.Objects;

/**
 * Flags a prediction as anomalous when it deviates from the observation by more than the
 * threshold AND the prediction itself is above the minimum floor.
 */
public class AnomalyDecider {
    static final double EPSILON = 1e-9;

    private final AnomalyPolicy defaultPolicy;

    public AnomalyDecider(AnomalyPolicy defaultPolicy) {
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy is required");
    }

    public Decision decide(double observed, double predicted) {
        return decide(observed, predicted, defaultPolicy);
    }

    public Decision decide(double observed, double predicted, AnomalyPolicy policy) {
        double percentChange = percentChange(observed, predicted);
        boolean anomalous = percentChange > policy.thresholdPercent() && predicted > policy.minimumFloor();
        return new Decision(observed, predicted, percentChange, anomalous);
    }

    public AnomalyPolicy defaultPolicy() {
        return defaultPolicy;
    }

    /**
     * Deviation relative to the observed magnitude, in percent. The denominator is floored at
     * {@value #EPSILON} so an observed value of exactly zero does not divide by zero.
     */
    public static double percentChange(double observed, double predicted) {
        double denominator = Math.max(EPSILON, Math.abs(observed));
        return Math.abs(predicted - observed) / denominator * 100.0;
    }
}
