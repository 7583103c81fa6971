package com.aquawatch.core.events;

import com.aquawatch.core.model.SourceTier;

import java.time.Instant;
import java.util.List;

public record SeriesFetched(
        Instant timestamp,
        List<String> siteIds,
        String parameterCode,
        SourceTier tier,
        List<String> failedTiers
) implements Event {
    @Override
    public String type() {
        return "SeriesFetched";
    }

    @Override
    public boolean concernsSite(String site) {
        return siteIds.contains(site);
    }
}
