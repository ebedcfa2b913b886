package com.github.dimitryivaniuta.subscription.reliability.scope;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Poison marks collected during one handling call. Opened with {@link DeadLetterQueue#open(List)} and
 * closed at the end of the call whatever its outcome; closing restores the scope that was active before.
 */
public final class DeadLetterQueueScope implements AutoCloseable {

    // several events may carry the same instance (enum constants, cached values)
    private final Map<Object, List<Event>> eventsByPayload = new IdentityHashMap<>();
    private final Map<TopicPartitionOffset, Event> eventsByPosition = new LinkedHashMap<>();
    private final Map<TopicPartitionOffset, String> reasons = new LinkedHashMap<>();
    private final DeadLetterQueueScope previous;
    private boolean closed;

    DeadLetterQueueScope(List<Event> events, DeadLetterQueueScope previous) {
        for (Event event : events) {
            eventsByPosition.put(event.position(), event);
            if (event.payload() != null) {
                eventsByPayload.computeIfAbsent(event.payload(), __ -> new ArrayList<>(1)).add(event);
            }
        }
        this.previous = previous;
    }

    void mark(Object message, String reason) {
        if (closed) throw new IllegalStateException("Dead letter queue scope is closed.");

        Event event = message instanceof Event e
                ? eventsByPosition.get(e.position())
                : eventByPayload(message);
        if (event == null) {
            throw new IllegalArgumentException("Message is not part of the handled events: " + message);
        }
        reasons.put(event.position(), reason);
    }

    private Event eventByPayload(Object payload) {
        List<Event> events = eventsByPayload.get(payload);
        if (events == null) return null;
        if (events.size() > 1) {
            throw new IllegalArgumentException(
                    "Message is shared by " + events.size() + " handled events, mark the Event instead: " + payload);
        }
        return events.get(0);
    }

    /**
     * Marked events in the order they were first marked; the last reason given for an event wins.
     */
    public List<PoisonEvent> poisonEvents() {
        List<PoisonEvent> result = new ArrayList<>(reasons.size());
        reasons.forEach((position, reason) -> result.add(new PoisonEvent(eventsByPosition.get(position), reason)));
        return result;
    }

    public boolean isPoisoned(Event event) {
        return reasons.containsKey(event.position());
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        DeadLetterQueue.restore(this, previous);
    }
}
