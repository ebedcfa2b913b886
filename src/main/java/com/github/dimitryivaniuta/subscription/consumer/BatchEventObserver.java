package com.github.dimitryivaniuta.subscription.consumer;

import com.github.dimitryivaniuta.subscription.batch.Batch;
import com.github.dimitryivaniuta.subscription.batch.Buffer;
import com.github.dimitryivaniuta.subscription.batch.BufferedEvent;
import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.event.StreamId;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventInbox;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects events into batches through a {@link Buffer} and handles each batch on the buffer's sender
 * thread. Offsets of a batch are released for commit once the whole batch is done.
 */
@Slf4j
public class BatchEventObserver implements Observer {

    private final EventHandler handler;
    private final PoisonEventInbox inbox;
    private final PendingOffsets offsets;
    private final Buffer<Event> buffer;

    public BatchEventObserver(EventHandler handler,
                              PoisonEventInbox inbox,
                              PendingOffsets offsets,
                              int maxBatchSize,
                              Duration batchTriggerTimeout,
                              int maxBufferSize) {
        this.handler = handler;
        this.inbox = inbox;
        this.offsets = offsets;
        this.buffer = new Buffer<>(maxBatchSize, batchTriggerTimeout, this::handleBatch, maxBufferSize);
    }

    @Override
    public void onEvent(Event event, boolean skipped) throws InterruptedException {
        buffer.add(event, skipped);
    }

    @Override
    public void complete() throws InterruptedException {
        buffer.complete();
    }

    @Override
    public void close() {
        buffer.close();
    }

    void handleBatch(Batch<Event> batch) {
        try (batch) {
            List<Event> events = batch.handleable();
            if (inbox != null && !events.isEmpty()) {
                events = quarantinePoisonedStreams(events);
            }
            if (!events.isEmpty()) {
                handler.handle(events);
            }
            for (BufferedEvent<Event> slot : batch.events()) {
                offsets.processed(slot.event().position());
            }
        }
    }

    private List<Event> quarantinePoisonedStreams(List<Event> events) {
        Set<StreamId> poisonStreams = inbox.getPoisonStreams(events);
        if (poisonStreams.isEmpty()) return events;

        List<Event> healthy = new ArrayList<>(events.size());
        List<PoisonEvent> poisoned = new ArrayList<>();
        for (Event event : events) {
            if (poisonStreams.contains(event.streamId())) {
                poisoned.add(new PoisonEvent(event, EventObserver.POISONED_STREAM_REASON));
            } else {
                healthy.add(event);
            }
        }

        log.warn("[POISON] {} events of poisoned streams join quarantine streams={}", poisoned.size(), poisonStreams);
        inbox.add(poisoned);
        return healthy;
    }
}
