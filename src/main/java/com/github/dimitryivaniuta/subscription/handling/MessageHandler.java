package com.github.dimitryivaniuta.subscription.handling;

/**
 * Application handler for one message at a time.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    void handle(T message);
}
