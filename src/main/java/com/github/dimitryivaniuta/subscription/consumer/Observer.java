package com.github.dimitryivaniuta.subscription.consumer;

import com.github.dimitryivaniuta.subscription.event.Event;

/**
 * Receives the events of one consumption loop in log order.
 */
public interface Observer extends AutoCloseable {

    /**
     * @param skipped the event takes part in offset accounting only and must not reach the handlers
     */
    void onEvent(Event event, boolean skipped) throws InterruptedException;

    /**
     * Hands over everything received so far and waits for it to be processed.
     */
    void complete() throws InterruptedException;

    /**
     * Drops whatever was not processed yet.
     */
    @Override
    void close();
}
