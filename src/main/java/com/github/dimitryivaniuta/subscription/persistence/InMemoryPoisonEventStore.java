package com.github.dimitryivaniuta.subscription.persistence;

import com.github.dimitryivaniuta.subscription.event.StreamId;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;
import com.github.dimitryivaniuta.subscription.reliability.model.OccuredFailure;
import com.github.dimitryivaniuta.subscription.reliability.model.OpeningPoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.model.StoredPoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.model.Reasons;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local store. Fits a single instance deployment and tests; quarantine is lost on restart.
 */
public class InMemoryPoisonEventStore implements PoisonEventStore {

    private static final Comparator<StoredPoisonEvent> LOG_ORDER = Comparator
            .comparingInt((StoredPoisonEvent e) -> e.position().partition())
            .thenComparingLong(e -> e.position().offset());

    private final ConcurrentMap<TopicPartitionOffset, StoredPoisonEvent> events = new ConcurrentHashMap<>();

    @Override
    public void add(Instant timestamp, Collection<OpeningPoisonEvent> openingEvents) {
        for (OpeningPoisonEvent e : openingEvents) {
            var stored = new StoredPoisonEvent(
                    e.position(), e.key(), e.rawKey(), e.rawValue(), e.timestamp(), e.headers(),
                    timestamp, timestamp, Reasons.truncate(e.reason()), 1);
            events.merge(e.position(), stored, (existing, ignored) -> withFailure(existing, timestamp, e.reason()));
        }
    }

    @Override
    public void addFailure(Instant timestamp, OccuredFailure failure) {
        events.computeIfPresent(failure.position(), (position, existing) -> withFailure(existing, timestamp, failure.reason()));
    }

    @Override
    public void addFailures(Instant timestamp, Collection<OccuredFailure> failures) {
        for (OccuredFailure failure : failures) {
            addFailure(timestamp, failure);
        }
    }

    @Override
    public void remove(TopicPartitionOffset position) {
        events.remove(position);
    }

    @Override
    public void remove(Collection<TopicPartitionOffset> positions) {
        positions.forEach(events::remove);
    }

    @Override
    public long count(String topic) {
        return events.keySet().stream().filter(p -> p.topic().equals(topic)).count();
    }

    @Override
    public boolean isStreamStored(String topic, String key) {
        return events.values().stream()
                .anyMatch(e -> e.position().topic().equals(topic) && Objects.equals(e.key(), key));
    }

    @Override
    public List<StreamId> getStoredStreams(Collection<StreamId> streamIds) {
        Set<StreamId> stored = new LinkedHashSet<>();
        for (StoredPoisonEvent e : events.values()) {
            stored.add(new StreamId(e.position().topic(), e.key()));
        }

        Set<StreamId> result = new LinkedHashSet<>();
        for (StreamId streamId : streamIds) {
            if (stored.contains(streamId)) result.add(streamId);
        }
        return new ArrayList<>(result);
    }

    @Override
    public List<StoredPoisonEvent> getEventsForRetrying(String topic) {
        return events.values().stream()
                .filter(e -> e.position().topic().equals(topic))
                .sorted(LOG_ORDER)
                .toList();
    }

    private static StoredPoisonEvent withFailure(StoredPoisonEvent e, Instant timestamp, String reason) {
        return new StoredPoisonEvent(
                e.position(), e.key(), e.rawKey(), e.rawValue(), e.timestamp(), e.headers(),
                e.storedAt(), timestamp, Reasons.truncate(reason), e.totalFailureCount() + 1);
    }
}
