package com.aquawatch.service.store;

import com.aquawatch.core.events.Event;

import java.time.Instant;

/**
 * Filter over the event history. A null {@code type} or {@code siteId} matches everything;
 * {@code limit} keeps only the newest matches.
 */
public record EventQuery(Instant since, Class<? extends Event> type, String siteId, int limit) {
    public static final int DEFAULT_LIMIT = 200;

    public EventQuery {
        since = since == null ? Instant.EPOCH : since;
        siteId = siteId == null || siteId.isBlank() ? null : siteId.trim();
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    public static EventQuery since(Instant since) {
        return new EventQuery(since, null, null, DEFAULT_LIMIT);
    }

    public EventQuery ofType(Class<? extends Event> eventType) {
        return new EventQuery(since, eventType, siteId, limit);
    }

    public EventQuery forSite(String site) {
        return new EventQuery(since, type, site, limit);
    }

    public EventQuery newest(int count) {
        return new EventQuery(since, type, siteId, count);
    }

    public boolean matches(Event event) {
        return !event.timestamp().isBefore(since)
                && (type == null || type.isInstance(event))
                && (siteId == null || event.concernsSite(siteId));
    }
}
