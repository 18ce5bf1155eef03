package org.carma.feudal.event;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Synchronous publish/subscribe between tick systems and observers.
 *
 * Handlers run on the publishing thread, in subscription order, before
 * {@link #publish(Event)} returns. Subscribing to {@code Event.class} itself
 * receives every event. Every published event is also appended to a journal,
 * so a run can be audited after the fact.
 */
public class EventBus {

    private record Subscription(Class<? extends Event> type, Consumer<Event> handler) {}

    private final List<Subscription> subscriptions = new ArrayList<>();
    private final List<Event> journal = new ArrayList<>();

    /**
     * Subscribe to one event type, or to every event with {@code Event.class}.
     */
    public <T extends Event> void subscribe(Class<T> eventType, Consumer<? super T> handler) {
        subscriptions.add(new Subscription(eventType, event -> handler.accept(eventType.cast(event))));
    }

    /**
     * Journal the event, then deliver it. A failing handler is reported and does not
     * stop delivery to the others.
     */
    public void publish(Event event) {
        journal.add(event);
        for (Subscription s : List.copyOf(subscriptions)) {
            if (!s.type().isInstance(event)) continue;
            try {
                s.handler().accept(event);
            } catch (RuntimeException e) {
                System.err.println("Day " + event.day() + ": " + event.eventType()
                    + " handler failed: " + e.getMessage());
            }
        }
    }

    // ========================================================================
    // Journal
    // ========================================================================

    public <T extends Event> List<T> getHistory(Class<T> eventType) {
        List<T> matching = new ArrayList<>();
        for (Event event : journal) {
            if (eventType.isInstance(event)) matching.add(eventType.cast(event));
        }
        return matching;
    }

    public int getEventCount() {
        return journal.size();
    }

    public int getEventCount(Class<? extends Event> eventType) {
        int count = 0;
        for (Event event : journal) {
            if (eventType.isInstance(event)) count++;
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("EventBus[%d subscriptions, %d journaled]", subscriptions.size(), journal.size());
    }
}
