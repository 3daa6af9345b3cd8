package org.walknav.navigation.event;

import lombok.extern.slf4j.Slf4j;
import org.walknav.navigation.Subscription;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous publish-subscribe bus for {@link SessionEvent}s.
 *
 * <p>Handlers run on the publishing thread in subscription order, global subscribers first.
 * A failing handler is logged and does not prevent delivery to the others.</p>
 */
@Slf4j
public final class SessionEventBus {
    private final Map<Class<? extends SessionEvent>, List<Consumer<? super SessionEvent>>> subscribers =
            new ConcurrentHashMap<>();
    private final List<Consumer<SessionEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Subscribes to events of exactly {@code eventType}.
     */
    @SuppressWarnings("unchecked")
    public <T extends SessionEvent> Subscription subscribe(Class<T> eventType, Consumer<T> handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        Consumer<? super SessionEvent> wrapped = event -> handler.accept((T) event);
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(wrapped);
        return () -> subscribers.getOrDefault(eventType, List.of()).remove(wrapped);
    }

    public Subscription subscribeAll(Consumer<SessionEvent> handler) {
        Objects.requireNonNull(handler, "handler");
        globalSubscribers.add(handler);
        return () -> globalSubscribers.remove(handler);
    }

    public void publish(SessionEvent event) {
        if (event == null) {
            return;
        }
        for (Consumer<SessionEvent> subscriber : globalSubscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException ex) {
                log.warn("Global subscriber failed on {}", event.eventType(), ex);
            }
        }
        List<Consumer<? super SessionEvent>> handlers = subscribers.get(event.getClass());
        if (handlers != null) {
            for (Consumer<? super SessionEvent> handler : handlers) {
                try {
                    handler.accept(event);
                } catch (RuntimeException ex) {
                    log.warn("Subscriber failed on {}", event.eventType(), ex);
                }
            }
        }
    }

    public int subscriberCount(Class<? extends SessionEvent> eventType) {
        return subscribers.getOrDefault(eventType, List.of()).size();
    }

    public int totalSubscriberCount() {
        int total = globalSubscribers.size();
        for (List<?> handlers : subscribers.values()) {
            total += handlers.size();
        }
        return total;
    }

    public void clear() {
        subscribers.clear();
        globalSubscribers.clear();
    }
}
