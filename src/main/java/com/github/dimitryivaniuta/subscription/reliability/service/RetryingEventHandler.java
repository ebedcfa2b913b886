package com.github.dimitryivaniuta.subscription.reliability.service;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import com.github.dimitryivaniuta.subscription.persistence.PoisonEventStore;
import com.github.dimitryivaniuta.subscription.reliability.model.OccuredFailure;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Replays quarantined events. Events that pass are removed from the store, events that fail again get
 * the failure recorded on their existing row.
 * <p>
 * An exception thrown for a batch of several events propagates and leaves the store untouched.
 */
@Slf4j
@RequiredArgsConstructor
public class RetryingEventHandler implements EventHandler {

    private final EventHandler inner;
    private final PoisonEventStore store;

    @Override
    public void handle(Event event) {
        List<PoisonEvent> failures = FailureAttribution.handle(inner, event);

        if (failures.isEmpty()) {
            store.remove(event.position());
            log.info("[RETRY] recovered position={}", event.position());
            return;
        }

        // a single event has at most one mark
        PoisonEvent failure = failures.get(0);
        store.addFailure(Instant.now(), new OccuredFailure(event.position(), failure.reason()));
        log.warn("[RETRY] still failing position={}", event.position());
    }

    @Override
    public void handle(List<Event> events) {
        if (events.isEmpty()) return;

        List<PoisonEvent> failures = FailureAttribution.handle(inner, events);

        List<OccuredFailure> occuredFailures = new ArrayList<>(failures.size());
        Set<TopicPartitionOffset> failedPositions = new HashSet<>();
        for (PoisonEvent failure : failures) {
            occuredFailures.add(new OccuredFailure(failure.event().position(), failure.reason()));
            failedPositions.add(failure.event().position());
        }

        if (!occuredFailures.isEmpty()) {
            store.addFailures(Instant.now(), occuredFailures);
        }
        if (failedPositions.size() == events.size()) {
            log.warn("[RETRY] batch still failing size={}", events.size());
            return;
        }

        List<TopicPartitionOffset> recovered = new ArrayList<>(events.size() - failedPositions.size());
        for (Event event : events) {
            if (!failedPositions.contains(event.position())) {
                recovered.add(event.position());
            }
        }
        store.remove(recovered);
        log.info("[RETRY] batch size={} recovered={} failed={}", events.size(), recovered.size(), failedPositions.size());
    }
}
