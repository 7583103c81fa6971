package com.aquawatch.core.model;

import java.time.Instant;

public record Observation(
        String siteId,
        Instant timestamp,
        double value,
        String unit,
        double latitude,
        double longitude
) {
}
