package com.github.dimitryivaniuta.subscription.event;

/**
 * Ordered sub-stream of a topic: all events sharing one key.
 */
public record StreamId(String topic, String key) {
}
