package com.github.dimitryivaniuta.subscription.reliability.service;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.model.Reasons;
import com.github.dimitryivaniuta.subscription.reliability.scope.DeadLetterQueue;
import com.github.dimitryivaniuta.subscription.reliability.scope.DeadLetterQueueScope;

import java.util.List;

/**
 * Runs one handling call inside a dead letter queue scope and tells which events failed.
 * <p>
 * An exception is attributed only when the call carried a single event. For a larger batch the
 * exception leaves unchanged: nobody knows which event caused it.
 */
final class FailureAttribution {

    private FailureAttribution() {
    }

    static List<PoisonEvent> handle(EventHandler inner, Event event) {
        try (DeadLetterQueueScope scope = DeadLetterQueue.open(event)) {
            try {
                inner.handle(event);
            } catch (RuntimeException e) {
                return List.of(new PoisonEvent(event, Reasons.of(e)));
            }
            return scope.poisonEvents();
        }
    }

    static List<PoisonEvent> handle(EventHandler inner, List<Event> events) {
        try (DeadLetterQueueScope scope = DeadLetterQueue.open(events)) {
            try {
                inner.handle(events);
            } catch (RuntimeException e) {
                if (events.size() != 1) throw e;
                return List.of(new PoisonEvent(events.get(0), Reasons.of(e)));
            }
            return scope.poisonEvents();
        }
    }
}
