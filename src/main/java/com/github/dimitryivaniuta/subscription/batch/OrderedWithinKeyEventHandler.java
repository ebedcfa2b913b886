package com.github.dimitryivaniuta.subscription.batch;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delivers every key's events as a separate unit, keys in order of first appearance.
 * Units are independent of each other; within a unit the batch order is kept.
 */
@RequiredArgsConstructor
public class OrderedWithinKeyEventHandler implements EventHandler {

    private final EventHandler inner;

    @Override
    public void handle(Event event) {
        inner.handle(event);
    }

    @Override
    public void handle(List<Event> events) {
        Map<String, List<Event>> byKey = new LinkedHashMap<>();
        for (Event event : events) {
            byKey.computeIfAbsent(event.key(), __ -> new ArrayList<>()).add(event);
        }

        for (List<Event> stream : byKey.values()) {
            inner.handle(stream);
        }
    }
}
