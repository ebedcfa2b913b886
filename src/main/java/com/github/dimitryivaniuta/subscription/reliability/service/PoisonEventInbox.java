package com.github.dimitryivaniuta.subscription.reliability.service;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.event.EventDeserializer;
import com.github.dimitryivaniuta.subscription.event.EventHeader;
import com.github.dimitryivaniuta.subscription.event.StreamId;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;
import com.github.dimitryivaniuta.subscription.persistence.PoisonEventStore;
import com.github.dimitryivaniuta.subscription.reliability.exception.EventHandlingException;
import com.github.dimitryivaniuta.subscription.reliability.exception.QuarantineCapacityExceededException;
import com.github.dimitryivaniuta.subscription.reliability.model.OpeningPoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point of the quarantine for live consumption.
 * <p>
 * The stored snapshot is always the record as it sits in the log: every poisoned event is fetched again
 * by its exact position with a dedicated consumer (own group, no auto commit, no offset reset) instead of
 * trusting whatever the handlers may have done to the in-memory event.
 */
@Slf4j
public class PoisonEventInbox implements AutoCloseable {

    private static final Duration MAX_POLL_STEP = Duration.ofMillis(500);

    private final PoisonEventStore store;
    private final Consumer<byte[], byte[]> fetchConsumer;
    private final int maxPoisonEventsPerTopic;
    private final Duration fetchTimeout;
    private final ReentrantLock fetchLock = new ReentrantLock();

    public PoisonEventInbox(PoisonEventStore store,
                            Consumer<byte[], byte[]> fetchConsumer,
                            int maxPoisonEventsPerTopic,
                            Duration fetchTimeout) {
        if (maxPoisonEventsPerTopic < 1) {
            throw new IllegalArgumentException("maxPoisonEventsPerTopic must be positive: " + maxPoisonEventsPerTopic);
        }
        this.store = store;
        this.fetchConsumer = fetchConsumer;
        this.maxPoisonEventsPerTopic = maxPoisonEventsPerTopic;
        this.fetchTimeout = fetchTimeout;
    }

    public void add(PoisonEvent event) {
        add(List.of(event));
    }

    /**
     * Quarantines the events: all or none of them.
     *
     * @throws QuarantineCapacityExceededException if a topic of the call is already full
     * @throws EventHandlingException              if a raw record cannot be fetched at its position
     */
    public void add(Collection<PoisonEvent> events) {
        if (events.isEmpty()) return;

        ensureCapacity(events);

        List<OpeningPoisonEvent> openingEvents = new ArrayList<>(events.size());
        for (PoisonEvent event : events) {
            openingEvents.add(toOpeningEvent(event));
        }

        store.add(Instant.now(), openingEvents);
        log.warn("[POISON] quarantined count={} positions={}", openingEvents.size(),
                openingEvents.stream().map(OpeningPoisonEvent::position).toList());
    }

    public boolean isPartOfPoisonStream(Event event) {
        return store.isStreamStored(event.topic(), event.key());
    }

    public boolean contains(String topic, String key) {
        return store.isStreamStored(topic, key);
    }

    /**
     * Keys among {@code keys} that have a quarantined event on the topic.
     */
    public Set<String> getContainedKeys(String topic, Collection<String> keys) {
        if (keys.isEmpty()) return Set.of();

        List<StreamId> streamIds = new ArrayList<>(keys.size());
        for (String key : keys) {
            streamIds.add(new StreamId(topic, key));
        }
        Set<String> result = new HashSet<>();
        for (StreamId stored : store.getStoredStreams(streamIds)) {
            result.add(stored.key());
        }
        return result;
    }

    /**
     * Streams of {@code events} that already have quarantined events. Empty when none is poisoned.
     */
    public Set<StreamId> getPoisonStreams(Collection<Event> events) {
        if (events.isEmpty()) return Set.of();

        Set<StreamId> streamIds = new LinkedHashSet<>();
        for (Event event : events) {
            streamIds.add(event.streamId());
        }
        return new HashSet<>(store.getStoredStreams(streamIds));
    }

    @Override
    public void close() {
        fetchLock.lock();
        try {
            fetchConsumer.close();
        } finally {
            fetchLock.unlock();
        }
    }

    private void ensureCapacity(Collection<PoisonEvent> events) {
        Set<String> topics = new LinkedHashSet<>();
        for (PoisonEvent event : events) {
            topics.add(event.event().topic());
        }
        for (String topic : topics) {
            long alreadyPoisoned = store.count(topic);
            if (alreadyPoisoned >= maxPoisonEventsPerTopic) {
                log.error("[POISON] quarantine full topic={} stored={} max={}", topic, alreadyPoisoned, maxPoisonEventsPerTopic);
                throw new QuarantineCapacityExceededException(topic, maxPoisonEventsPerTopic, alreadyPoisoned);
            }
        }
    }

    private OpeningPoisonEvent toOpeningEvent(PoisonEvent poisonEvent) {
        TopicPartitionOffset position = poisonEvent.event().position();
        ConsumerRecord<byte[], byte[]> record = fetch(position);

        List<EventHeader> headers = new ArrayList<>();
        for (Header header : record.headers()) {
            headers.add(new EventHeader(header.key(), header.value()));
        }
        return new OpeningPoisonEvent(
                position,
                EventDeserializer.decodeKey(record.key()),
                record.key(),
                record.value(),
                Instant.ofEpochMilli(record.timestamp()),
                headers,
                poisonEvent.reason());
    }

    private ConsumerRecord<byte[], byte[]> fetch(TopicPartitionOffset position) {
        fetchLock.lock();
        try {
            TopicPartition partition = position.topicPartition();
            fetchConsumer.assign(List.of(partition));
            fetchConsumer.seek(partition, position.offset());

            long deadline = System.nanoTime() + fetchTimeout.toNanos();
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new EventHandlingException(position.toString(),
                            "Message was not fetched within " + fetchTimeout + ".");
                }
                Duration step = Duration.ofNanos(Math.min(remaining, MAX_POLL_STEP.toNanos()));

                for (ConsumerRecord<byte[], byte[]> record : fetchConsumer.poll(step)) {
                    var fetched = new TopicPartitionOffset(record.topic(), record.partition(), record.offset());
                    if (!fetched.equals(position)) {
                        throw new EventHandlingException(position.toString(),
                                "Consumed message offset doesn't match requested one.");
                    }
                    return record;
                }
            }
        } finally {
            try {
                fetchConsumer.unsubscribe();
            } finally {
                fetchLock.unlock();
            }
        }
    }
}
