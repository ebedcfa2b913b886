package com.github.dimitryivaniuta.subscription.reliability.exception;

/**
 * The topic already holds the maximum number of quarantined events. Nothing of the intake call was stored.
 */
public class QuarantineCapacityExceededException extends EventHandlingException {

    private final long storedCount;

    public QuarantineCapacityExceededException(String topic, int maxPoisonEvents, long storedCount) {
        super(topic, "Dead letter queue exceeds " + maxPoisonEvents + " size.");
        this.storedCount = storedCount;
    }

    public long getStoredCount() {
        return storedCount;
    }
}
