package com.github.dimitryivaniuta.subscription.reliability.service;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Live consumption: events that fail are put into quarantine through the {@link PoisonEventInbox} so
 * the partition can move on. Inbox errors (capacity, fetch mismatch) propagate.
 */
@Slf4j
@RequiredArgsConstructor
public class PoisonEventHandler implements EventHandler {

    private final EventHandler inner;
    private final PoisonEventInbox inbox;

    @Override
    public void handle(Event event) {
        quarantine(FailureAttribution.handle(inner, event));
    }

    @Override
    public void handle(List<Event> events) {
        if (events.isEmpty()) return;
        quarantine(FailureAttribution.handle(inner, events));
    }

    private void quarantine(List<PoisonEvent> failures) {
        if (failures.isEmpty()) return;

        for (PoisonEvent failure : failures) {
            log.error("[POISON] topic={} partition={} offset={} key={}",
                    failure.event().topic(), failure.event().partition(), failure.event().offset(), failure.event().key());
        }
        inbox.add(failures);
    }
}
