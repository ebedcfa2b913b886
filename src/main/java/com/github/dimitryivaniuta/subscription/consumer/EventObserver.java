package com.github.dimitryivaniuta.subscription.consumer;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventInbox;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles events one by one on the poll thread.
 * <p>
 * With a quarantine ({@code inbox} not null), an event whose stream already has quarantined events
 * joins them without being handled, so the stream keeps its order.
 */
@Slf4j
@RequiredArgsConstructor
public class EventObserver implements Observer {

    static final String POISONED_STREAM_REASON = "Stream is poisoned.";

    private final EventHandler handler;
    private final PoisonEventInbox inbox;
    private final PendingOffsets offsets;

    @Override
    public void onEvent(Event event, boolean skipped) {
        if (!skipped) {
            if (inbox != null && inbox.isPartOfPoisonStream(event)) {
                log.warn("[POISON] stream is poisoned, event joins quarantine position={} key={}", event.position(), event.key());
                inbox.add(new PoisonEvent(event, POISONED_STREAM_REASON));
            } else {
                handler.handle(event);
            }
        }
        offsets.processed(event.position());
    }

    @Override
    public void complete() {
    }

    @Override
    public void close() {
    }
}
