package com.github.dimitryivaniuta.subscription.event;

import java.time.Instant;
import java.util.List;

/**
 * Immutable reference to one consumed record.
 * <p>
 * {@code payload} is the deserialized message; it is {@code null} when the message type is not known
 * to this application (such events travel through the pipeline as skipped).
 */
public record Event(
        String key,
        TopicPartitionOffset position,
        Instant timestamp,
        byte[] rawKey,
        byte[] rawValue,
        List<EventHeader> headers,
        Object payload
) {

    public Event {
        headers = headers == null ? List.of() : List.copyOf(headers);
    }

    public String topic() {
        return position.topic();
    }

    public int partition() {
        return position.partition();
    }

    public long offset() {
        return position.offset();
    }

    public StreamId streamId() {
        return new StreamId(position.topic(), key);
    }

    public Class<?> messageType() {
        return payload == null ? null : payload.getClass();
    }

    public Event withPayload(Object newPayload) {
        return new Event(key, position, timestamp, rawKey, rawValue, headers, newPayload);
    }
}
