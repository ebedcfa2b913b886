package com.github.dimitryivaniuta.subscription.handling;

import com.github.dimitryivaniuta.subscription.event.Event;

import java.util.List;

/**
 * One stage of the handling pipeline. Ordering policies, the quarantine handlers and the final
 * dispatch to application handlers all implement it and wrap each other.
 */
public interface EventHandler {

    void handle(Event event);

    void handle(List<Event> events);
}
