package com.aquawatch.service.store;

import com.aquawatch.core.events.AnomalyDetected;
import com.aquawatch.core.events.Event;

import java.time.Instant;
import java.util.List;

/**
 * History of alerts and pipeline failures, oldest first.
 */
public interface EventStore {
    void append(Event event);

    List<Event> query(EventQuery query);

    default List<AnomalyDetected> recentAnomalies(Instant since, int limit) {
        return query(EventQuery.since(since).ofType(AnomalyDetected.class).newest(limit)).stream()
                .map(AnomalyDetected.class::cast)
                .toList();
    }
}
