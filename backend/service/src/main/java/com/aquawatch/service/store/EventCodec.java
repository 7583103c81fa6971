package com.aquawatch.service.store;

import com.aquawatch.core.bus.EventBus;
import com.aquawatch.core.events.AnomalyDetected;
import com.aquawatch.core.events.Event;
import com.aquawatch.core.events.PipelineFailed;
import com.aquawatch.core.events.PointsSkipped;
import com.aquawatch.core.events.SeriesFetched;
import com.aquawatch.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "SeriesFetched", SeriesFetched.class,
            "PointsSkipped", PointsSkipped.class,
            "AnomalyDetected", AnomalyDetected.class,
            "PipelineFailed", PipelineFailed.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static Optional<Class<? extends Event>> typeNamed(String type) {
        return Optional.ofNullable(TYPES.get(type));
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    /**
     * Routes the given event types from the bus to {@code consumer}.
     */
    public static void subscribe(EventBus bus, List<Class<? extends Event>> types, Consumer<Event> consumer) {
        for (Class<? extends Event> type : types) {
            bus.subscribe(type, consumer::accept);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
