package com.github.dimitryivaniuta.subscription.batch;

/**
 * Downstream of a {@link Buffer}. Returning from {@link #accept(Batch)} means the batch was accepted
 * and its events no longer count against the buffer capacity. May block.
 */
@FunctionalInterface
public interface BatchSink<T> {

    void accept(Batch<T> batch) throws InterruptedException;
}
