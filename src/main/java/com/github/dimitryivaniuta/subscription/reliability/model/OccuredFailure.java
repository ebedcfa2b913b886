package com.github.dimitryivaniuta.subscription.reliability.model;

import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;

/**
 * Failure of an event whose raw record is already in the store.
 */
public record OccuredFailure(TopicPartitionOffset position, String reason) {
}
