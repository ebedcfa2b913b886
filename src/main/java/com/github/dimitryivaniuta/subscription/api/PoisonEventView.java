package com.github.dimitryivaniuta.subscription.api;

import com.github.dimitryivaniuta.subscription.reliability.model.StoredPoisonEvent;

import java.time.Instant;

/**
 * Quarantined event as shown to operators. Raw record bytes are left out.
 */
public record PoisonEventView(
        String topic,
        int partition,
        long offset,
        String key,
        Instant timestamp,
        Instant storedAt,
        Instant lastFailureAt,
        String lastFailureReason,
        int totalFailureCount
) {

    static PoisonEventView of(StoredPoisonEvent e) {
        return new PoisonEventView(
                e.position().topic(),
                e.position().partition(),
                e.position().offset(),
                e.key(),
                e.timestamp(),
                e.storedAt(),
                e.lastFailureAt(),
                e.lastFailureReason(),
                e.totalFailureCount());
    }
}
