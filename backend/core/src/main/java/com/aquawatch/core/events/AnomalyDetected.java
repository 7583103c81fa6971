package com.aquawatch.core.events;

import java.time.Instant;

public record AnomalyDetected(
        Instant timestamp,
        String siteId,
        String parameterCode,
        double observedValue,
        double predictedValue,
        double percentChange,
        String reason,
        String datasetKey
) implements Event {
    @Override
    public String type() {
        return "AnomalyDetected";
    }

    @Override
    public boolean concernsSite(String site) {
        return siteId.equals(site);
    }
}
