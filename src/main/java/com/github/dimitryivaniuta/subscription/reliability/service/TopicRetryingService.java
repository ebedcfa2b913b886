package com.github.dimitryivaniuta.subscription.reliability.service;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.event.EventDeserializer;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import com.github.dimitryivaniuta.subscription.persistence.PoisonEventStore;
import com.github.dimitryivaniuta.subscription.reliability.exception.EventDeserializationException;
import com.github.dimitryivaniuta.subscription.reliability.model.OccuredFailure;
import com.github.dimitryivaniuta.subscription.reliability.model.Reasons;
import com.github.dimitryivaniuta.subscription.reliability.model.StoredPoisonEvent;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One replay pass over the quarantined events of a topic.
 * <p>
 * {@code handler} is the topic's ordering stage wrapping a {@link RetryingEventHandler}, so replay keeps
 * the grouping live consumption uses.
 */
@Slf4j
@RequiredArgsConstructor
public class TopicRetryingService {

    @Getter
    private final String topic;
    private final PoisonEventStore store;
    private final EventDeserializer deserializer;
    private final EventHandler handler;
    private final boolean batchProcessing;

    public void retry() {
        List<StoredPoisonEvent> stored = store.getEventsForRetrying(topic);
        if (stored.isEmpty()) return;

        log.info("[RETRY] topic={} quarantined={}", topic, stored.size());

        List<Event> events = new ArrayList<>(stored.size());
        for (StoredPoisonEvent storedEvent : stored) {
            Event event = deserialize(storedEvent);
            if (event == null) continue;

            if (event.payload() == null) {
                log.warn("[RETRY] no handler for message type, left in quarantine position={}", event.position());
                continue;
            }
            events.add(event);
        }
        if (events.isEmpty()) return;

        if (batchProcessing) {
            handler.handle(events);
            return;
        }
        for (Event event : events) {
            handler.handle(event);
        }
    }

    private Event deserialize(StoredPoisonEvent stored) {
        try {
            return deserializer.deserialize(
                    stored.position(), stored.timestamp(), stored.rawKey(), stored.rawValue(), stored.headers());
        } catch (EventDeserializationException e) {
            log.warn("[RETRY] cannot deserialize position={} ex={}", stored.position(), e.toString());
            store.addFailure(Instant.now(), new OccuredFailure(stored.position(), Reasons.of(e)));
            return null;
        }
    }
}
