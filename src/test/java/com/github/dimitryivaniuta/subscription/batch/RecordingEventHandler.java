package com.github.dimitryivaniuta.subscription.batch;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;

import java.util.ArrayList;
import java.util.List;

class RecordingEventHandler implements EventHandler {

    final List<Event> singles = new ArrayList<>();
    final List<List<Event>> calls = new ArrayList<>();

    @Override
    public void handle(Event event) {
        singles.add(event);
    }

    @Override
    public void handle(List<Event> events) {
        calls.add(List.copyOf(events));
    }
}
