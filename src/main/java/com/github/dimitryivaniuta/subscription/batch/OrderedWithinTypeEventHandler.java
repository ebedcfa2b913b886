package com.github.dimitryivaniuta.subscription.batch;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers every message type's events as a separate unit, types in order of first appearance.
 */
@RequiredArgsConstructor
public class OrderedWithinTypeEventHandler implements EventHandler {

    private final EventHandler inner;

    @Override
    public void handle(Event event) {
        inner.handle(event);
    }

    @Override
    public void handle(List<Event> events) {
        Map<Class<?>, List<Event>> byType = new LinkedHashMap<>();
        for (Event event : events) {
            byType.computeIfAbsent(event.messageType(), __ -> new ArrayList<>()).add(event);
        }

        for (List<Event> typed : byType.values()) {
            inner.handle(typed);
        }
    }
}
