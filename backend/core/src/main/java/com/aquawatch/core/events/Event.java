package com.aquawatch.core.events;

import java.time.Instant;

public interface Event {
    Instant timestamp();

    String type();

    boolean concernsSite(String siteId);
}
