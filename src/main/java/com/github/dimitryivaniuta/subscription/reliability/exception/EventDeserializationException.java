package com.github.dimitryivaniuta.subscription.reliability.exception;

import com.github.dimitryivaniuta.subscription.event.Event;

/**
 * The payload of a record could not be read. Carries the raw event (without payload) so it can
 * still be quarantined and its offset accounted for.
 */
public class EventDeserializationException extends RuntimeException {

    private final transient Event rawEvent;

    public EventDeserializationException(Event rawEvent, String message, Throwable cause) {
        super(message + " Position: " + rawEvent.position(), cause);
        this.rawEvent = rawEvent;
    }

    public Event getRawEvent() {
        return rawEvent;
    }
}
