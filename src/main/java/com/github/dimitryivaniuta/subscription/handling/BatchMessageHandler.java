package com.github.dimitryivaniuta.subscription.handling;

import java.util.List;

/**
 * Application handler for a batch of messages of one type.
 * <p>
 * To quarantine some messages of the batch without failing the rest, call
 * {@link com.github.dimitryivaniuta.subscription.reliability.scope.DeadLetterQueue#add(Object, String)}
 * from inside {@link #handle(List)}. An exception thrown for a batch of more than one message is not
 * attributed to any message: the whole batch fails.
 */
@FunctionalInterface
public interface BatchMessageHandler<T> {

    void handle(List<T> messages);
}
