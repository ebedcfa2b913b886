package com.github.dimitryivaniuta.subscription.reliability.model;

import com.github.dimitryivaniuta.subscription.event.EventHeader;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;

import java.time.Instant;
import java.util.List;

/**
 * Quarantine record as read back from the store.
 */
public record StoredPoisonEvent(
        TopicPartitionOffset position,
        String key,
        byte[] rawKey,
        byte[] rawValue,
        Instant timestamp,
        List<EventHeader> headers,
        Instant storedAt,
        Instant lastFailureAt,
        String lastFailureReason,
        int totalFailureCount
) {
}
