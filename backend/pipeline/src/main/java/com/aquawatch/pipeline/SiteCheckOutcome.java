package com.aquawatch.pipeline;

import com.aquawatch.core.model.PredictionResult;

import java.util.Optional;

public record SiteCheckOutcome(String siteId, PredictionResult result, String errorType, String errorMessage) {
    public static SiteCheckOutcome success(PredictionResult result) {
        return new SiteCheckOutcome(result.siteId(), result, null, null);
    }

    public static SiteCheckOutcome failure(String siteId, String errorType, String errorMessage) {
        return new SiteCheckOutcome(siteId, null, errorType, errorMessage);
    }

    public boolean success() {
        return result != null;
    }

    public Optional<PredictionResult> prediction() {
        return Optional.ofNullable(result);
    }
}
