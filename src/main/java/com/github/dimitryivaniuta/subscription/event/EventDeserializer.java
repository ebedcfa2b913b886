package com.github.dimitryivaniuta.subscription.event;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw record bytes into an {@link Event}. Used both for live records and for quarantined
 * records read back from the store.
 */
public interface EventDeserializer {

    /**
     * @throws com.github.dimitryivaniuta.subscription.reliability.exception.EventDeserializationException
     *         if the value cannot be read as the resolved message type
     */
    Event deserialize(TopicPartitionOffset position,
                      Instant timestamp,
                      byte[] rawKey,
                      byte[] rawValue,
                      List<EventHeader> headers);

    default Event deserialize(ConsumerRecord<byte[], byte[]> record) {
        List<EventHeader> headers = new ArrayList<>();
        for (Header header : record.headers()) {
            headers.add(new EventHeader(header.key(), header.value()));
        }
        return deserialize(
                new TopicPartitionOffset(record.topic(), record.partition(), record.offset()),
                Instant.ofEpochMilli(record.timestamp()),
                record.key(),
                record.value(),
                headers);
    }

    static String decodeKey(byte[] rawKey) {
        return rawKey == null ? null : new String(rawKey, StandardCharsets.UTF_8);
    }
}
