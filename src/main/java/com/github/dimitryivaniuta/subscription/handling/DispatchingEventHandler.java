package com.github.dimitryivaniuta.subscription.handling;

import com.github.dimitryivaniuta.subscription.event.Event;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Innermost stage: hands payloads to the application handlers registered for their type.
 * <p>
 * A batch holding several types is split into runs of consecutive same-type events so that the
 * batch order is kept. A run goes to the batch handler of its type if there is one, otherwise
 * message by message to the single-message handler.
 */
@RequiredArgsConstructor
public class DispatchingEventHandler implements EventHandler {

    private final MessageHandlersRegistry registry;

    @Override
    public void handle(Event event) {
        Class<?> type = requireType(event);
        var handler = registry.handlerFor(type);
        if (handler.isPresent()) {
            handler.get().handle(event.payload());
            return;
        }
        registry.batchHandlerFor(type)
                .orElseThrow(() -> noHandler(type))
                .handle(List.of(event.payload()));
    }

    @Override
    public void handle(List<Event> events) {
        if (events.isEmpty()) return;

        int runStart = 0;
        Class<?> runType = requireType(events.get(0));
        for (int i = 1; i < events.size(); i++) {
            Class<?> type = requireType(events.get(i));
            if (!Objects.equals(type, runType)) {
                dispatchRun(runType, events.subList(runStart, i));
                runStart = i;
                runType = type;
            }
        }
        dispatchRun(runType, events.subList(runStart, events.size()));
    }

    private void dispatchRun(Class<?> type, List<Event> run) {
        var batchHandler = registry.batchHandlerFor(type);
        if (batchHandler.isPresent()) {
            List<Object> payloads = new ArrayList<>(run.size());
            for (Event event : run) payloads.add(event.payload());
            batchHandler.get().handle(payloads);
            return;
        }
        var handler = registry.handlerFor(type).orElseThrow(() -> noHandler(type));
        for (Event event : run) {
            handler.handle(event.payload());
        }
    }

    private static Class<?> requireType(Event event) {
        Class<?> type = event.messageType();
        if (type == null) {
            throw new IllegalStateException("Event " + event.position() + " has no payload to dispatch.");
        }
        return type;
    }

    private static IllegalStateException noHandler(Class<?> type) {
        return new IllegalStateException("No handler registered for message type " + type.getName());
    }
}
