package com.github.dimitryivaniuta.subscription.handling;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-message-type handlers registered by the application.
 * <p>
 * A type may have a single-message handler, a batch handler, or both. Types are resolvable by simple or
 * fully-qualified class name, which is what the {@code x-message-type} header carries.
 */
public class MessageHandlersRegistry {

    private final Map<Class<?>, MessageHandler<?>> handlers = new ConcurrentHashMap<>();
    private final Map<Class<?>, BatchMessageHandler<?>> batchHandlers = new ConcurrentHashMap<>();
    private final Map<String, Class<?>> typesByName = new ConcurrentHashMap<>();

    public <T> MessageHandlersRegistry register(Class<T> type, MessageHandler<? super T> handler) {
        handlers.put(type, handler);
        registerName(type);
        return this;
    }

    public <T> MessageHandlersRegistry registerBatch(Class<T> type, BatchMessageHandler<? super T> handler) {
        batchHandlers.put(type, handler);
        registerName(type);
        return this;
    }

    public boolean containsHandlersFor(Class<?> type) {
        return type != null && (handlers.containsKey(type) || batchHandlers.containsKey(type));
    }

    public Optional<Class<?>> resolveType(String typeName) {
        if (typeName == null || typeName.isBlank()) return Optional.empty();
        return Optional.ofNullable(typesByName.get(typeName));
    }

    @SuppressWarnings("unchecked")
    public Optional<MessageHandler<Object>> handlerFor(Class<?> type) {
        return Optional.ofNullable((MessageHandler<Object>) handlers.get(type));
    }

    @SuppressWarnings("unchecked")
    public Optional<BatchMessageHandler<Object>> batchHandlerFor(Class<?> type) {
        return Optional.ofNullable((BatchMessageHandler<Object>) batchHandlers.get(type));
    }

    private void registerName(Class<?> type) {
        typesByName.put(type.getName(), type);
        typesByName.putIfAbsent(type.getSimpleName(), type);
    }
}
