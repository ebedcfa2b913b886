package com.github.dimitryivaniuta.subscription.reliability.model;

import com.github.dimitryivaniuta.subscription.event.EventHeader;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a record exactly as it was received, taken when the record enters quarantine.
 */
public record OpeningPoisonEvent(
        TopicPartitionOffset position,
        String key,
        byte[] rawKey,
        byte[] rawValue,
        Instant timestamp,
        List<EventHeader> headers,
        String reason
) {
}
