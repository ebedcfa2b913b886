package com.github.dimitryivaniuta.subscription.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.subscription.handling.MessageHandlersRegistry;
import com.github.dimitryivaniuta.subscription.reliability.exception.EventDeserializationException;
import lombok.RequiredArgsConstructor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

/**
 * JSON values, UTF-8 string keys.
 * <p>
 * The message type comes from the {@code x-message-type} header; records without it use the topic's
 * default type. A type the registry does not know yields an event without payload.
 */
@RequiredArgsConstructor
public class JsonEventDeserializer implements EventDeserializer {

    public static final String MESSAGE_TYPE_HEADER = "x-message-type";

    private final ObjectMapper mapper;
    private final MessageHandlersRegistry registry;
    private final String defaultMessageType;

    @Override
    public Event deserialize(TopicPartitionOffset position,
                             Instant timestamp,
                             byte[] rawKey,
                             byte[] rawValue,
                             List<EventHeader> headers) {
        var raw = new Event(EventDeserializer.decodeKey(rawKey), position, timestamp, rawKey, rawValue, headers, null);

        var type = registry.resolveType(messageTypeName(headers));
        if (type.isEmpty() || rawValue == null) {
            return raw;
        }

        try {
            return raw.withPayload(mapper.readValue(rawValue, type.get()));
        } catch (IOException e) {
            throw new EventDeserializationException(raw, "Cannot read " + type.get().getSimpleName() + " payload.", e);
        }
    }

    private String messageTypeName(List<EventHeader> headers) {
        // last header wins, same as Headers#lastHeader
        for (int i = headers.size() - 1; i >= 0; i--) {
            var header = headers.get(i);
            if (MESSAGE_TYPE_HEADER.equals(header.key()) && header.value() != null) {
                return new String(header.value(), StandardCharsets.UTF_8);
            }
        }
        return defaultMessageType;
    }
}
