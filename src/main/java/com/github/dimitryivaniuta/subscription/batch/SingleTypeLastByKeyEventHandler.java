package com.github.dimitryivaniuta.subscription.batch;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Values are snapshots of their key's state, so only the freshest one per key is worth handling.
 * Survivors keep their relative batch order.
 */
@RequiredArgsConstructor
public class SingleTypeLastByKeyEventHandler implements EventHandler {

    private final EventHandler inner;

    @Override
    public void handle(Event event) {
        inner.handle(event);
    }

    @Override
    public void handle(List<Event> events) {
        Map<String, Integer> lastIndexByKey = new HashMap<>();
        for (int i = 0; i < events.size(); i++) {
            lastIndexByKey.put(events.get(i).key(), i);
        }

        if (lastIndexByKey.size() == events.size()) {
            inner.handle(events);
            return;
        }

        List<Event> survivors = new ArrayList<>(lastIndexByKey.size());
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            if (lastIndexByKey.get(event.key()) == i) {
                survivors.add(event);
            }
        }
        inner.handle(survivors);
    }
}
