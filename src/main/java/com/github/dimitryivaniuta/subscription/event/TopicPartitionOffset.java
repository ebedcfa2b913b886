package com.github.dimitryivaniuta.subscription.event;

import org.apache.kafka.common.TopicPartition;

/**
 * Exact position of a record in the log. Primary key of quarantine records.
 */
public record TopicPartitionOffset(String topic, int partition, long offset) {

    public TopicPartition topicPartition() {
        return new TopicPartition(topic, partition);
    }

    @Override
    public String toString() {
        return topic + "[" + partition + "]@" + offset;
    }
}
