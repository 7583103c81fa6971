package com.aquawatch.core.events;

import java.time.Instant;

public record PointsSkipped(
        Instant timestamp,
        String siteId,
        int skippedTimestamps,
        int zeroedValues
) implements Event {
    @Override
    public String type() {
        return "PointsSkipped";
    }

    @Override
    public boolean concernsSite(String site) {
        return siteId.equals(site);
    }
}
