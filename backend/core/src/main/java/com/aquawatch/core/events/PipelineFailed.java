package com.aquawatch.core.events;

import java.time.Instant;
import java.util.Arrays;

public record PipelineFailed(
        Instant timestamp,
        String siteId,
        String errorType,
        String message
) implements Event {
    @Override
    public String type() {
        return "PipelineFailed";
    }

    /**
     * Scheduled ingest failures name every site of the batch, comma separated.
     */
    @Override
    public boolean concernsSite(String site) {
        return Arrays.asList(siteId.split(",")).contains(site);
    }
}
