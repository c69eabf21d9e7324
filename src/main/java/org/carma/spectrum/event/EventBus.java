package org.carma.spectrum.event;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

/**
 * Event bus for publish-subscribe communication.
 *
 * Provides:
 * - Type-safe subscription
 * - Synchronous event dispatch
 * - Event history for audit trail
 */
public class EventBus {

    private final Map<Class<? extends Event>, List<Consumer<Event>>> subscribers;
    private final List<Event> eventHistory;
    private final boolean recordHistory;

    public EventBus() {
        this(true);
    }

    public EventBus(boolean recordHistory) {
        this.subscribers = new ConcurrentHashMap<>();
        this.eventHistory = Collections.synchronizedList(new ArrayList<>());
        this.recordHistory = recordHistory;
    }

    // ========================================================================
    // Subscription
    // ========================================================================

    /**
     * Subscribe to a specific event type.
     */
    @SuppressWarnings("unchecked")
    public <T extends Event> void subscribe(Class<T> eventType, Consumer<T> handler) {
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
            .add(event -> handler.accept((T) event));
    }

    /**
     * Subscribe to all events.
     */
    public void subscribeAll(Consumer<Event> handler) {
        subscribe(Event.CircuitEstablishedEvent.class, handler::accept);
        subscribe(Event.DemandBlockedEvent.class, handler::accept);
        subscribe(Event.LoadModeChangedEvent.class, handler::accept);
        subscribe(Event.BatchCompleteEvent.class, handler::accept);
    }

    // ========================================================================
    // Publishing
    // ========================================================================

    /**
     * Publish an event to all subscribers. A failing handler is reported and
     * does not stop delivery to the others.
     */
    public void publish(Event event) {
        if (recordHistory) {
            eventHistory.add(event);
        }

        List<Consumer<Event>> handlers = subscribers.get(event.getClass());
        if (handlers != null) {
            for (Consumer<Event> handler : handlers) {
                try {
                    handler.accept(event);
                } catch (Exception e) {
                    System.err.println("Error in " + event.eventType() + " handler: " + e.getMessage());
                }
            }
        }
    }

    // ========================================================================
    // History Management
    // ========================================================================

    public List<Event> getHistory() {
        return new ArrayList<>(eventHistory);
    }

    /**
     * Get events of a specific type.
     */
    public <T extends Event> List<T> getHistory(Class<T> eventType) {
        List<T> filtered = new ArrayList<>();
        synchronized (eventHistory) {
            for (Event event : eventHistory) {
                if (eventType.isInstance(event)) {
                    filtered.add(eventType.cast(event));
                }
            }
        }
        return filtered;
    }

    public int getEventCount() {
        return eventHistory.size();
    }

    public int getEventCount(Class<? extends Event> eventType) {
        return getHistory(eventType).size();
    }

    public void clearHistory() {
        eventHistory.clear();
    }

    /**
     * Drop history and subscribers.
     */
    public void reset() {
        clearHistory();
        subscribers.clear();
    }

    @Override
    public String toString() {
        return String.format("EventBus[subscribers=%d, history=%d events]",
            subscribers.values().stream().mapToInt(List::size).sum(),
            eventHistory.size());
    }
}
