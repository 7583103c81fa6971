package com.aquawatch.core.bus;

import com.aquawatch.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process publisher for pipeline events. Handlers run on the publishing thread;
 * a failing handler is reported to {@code onHandlerError} and never reaches the publisher.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, CopyOnWriteArrayList<Consumer<? super Event>>> subscribers =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<? super Event>> wildcardSubscribers = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for type " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        subscribers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>())
                .add(event -> handler.accept(type.cast(event)));
    }

    public void subscribeAll(Consumer<Event> handler) {
        wildcardSubscribers.add(handler::accept);
    }

    public void publish(Event event) {
        List<Consumer<? super Event>> handlers = subscribers.getOrDefault(event.getClass(), new CopyOnWriteArrayList<>());
        for (Consumer<? super Event> handler : handlers) {
            invoke(handler, event);
        }
        for (Consumer<? super Event> handler : wildcardSubscribers) {
            invoke(handler, event);
        }
    }

    private void invoke(Consumer<? super Event> handler, Event event) {
        try {
            handler.accept(event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }
}
