package com.github.dimitryivaniuta.subscription.persistence;

import com.github.dimitryivaniuta.subscription.event.StreamId;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;
import com.github.dimitryivaniuta.subscription.reliability.model.OccuredFailure;
import com.github.dimitryivaniuta.subscription.reliability.model.OpeningPoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.model.StoredPoisonEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Durable quarantine keyed by (topic, partition, offset). Shared by every instance of the service.
 */
public interface PoisonEventStore {

    /**
     * Stores newly quarantined records. A position that is already stored keeps its snapshot and gets
     * the failure recorded instead.
     */
    void add(Instant timestamp, Collection<OpeningPoisonEvent> events);

    /**
     * Records another failure of an already stored event.
     */
    void addFailure(Instant timestamp, OccuredFailure failure);

    void addFailures(Instant timestamp, Collection<OccuredFailure> failures);

    void remove(TopicPartitionOffset position);

    void remove(Collection<TopicPartitionOffset> positions);

    long count(String topic);

    boolean isStreamStored(String topic, String key);

    /**
     * The subset of {@code streamIds} that has at least one stored event.
     */
    List<StreamId> getStoredStreams(Collection<StreamId> streamIds);

    /**
     * Stored events of a topic in partition and offset order.
     */
    List<StoredPoisonEvent> getEventsForRetrying(String topic);
}
