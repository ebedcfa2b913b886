package com.github.dimitryivaniuta.subscription.consumer;

import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Processed positions waiting to be committed.
 * <p>
 * Handling may run off the poll thread (batch mode) while only the poll thread may talk to the Kafka
 * consumer; observers record positions here and the poll loop drains them into a commit.
 */
public class PendingOffsets {

    private final Map<TopicPartition, Long> processed = new HashMap<>();

    public synchronized void processed(TopicPartitionOffset position) {
        processed.merge(position.topicPartition(), position.offset(), Math::max);
    }

    /**
     * Offsets to commit for the given partitions: the next offset to read. Positions of other partitions
     * are dropped.
     */
    public synchronized Map<TopicPartition, OffsetAndMetadata> drain(Collection<TopicPartition> owned) {
        Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
        processed.forEach((partition, offset) -> {
            if (owned.contains(partition)) {
                offsets.put(partition, new OffsetAndMetadata(offset + 1));
            }
        });
        processed.clear();
        return offsets;
    }
}
