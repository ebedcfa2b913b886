package com.github.dimitryivaniuta.subscription.consumer;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.event.StreamId;
import com.github.dimitryivaniuta.subscription.event.TestEvents.OrderPlaced;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventInbox;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.github.dimitryivaniuta.subscription.event.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchEventObserverTest {

    private static final TopicPartition PARTITION = new TopicPartition("orders", 0);

    private final List<List<Event>> handled = new CopyOnWriteArrayList<>();
    private final EventHandler handler = new EventHandler() {
        @Override
        public void handle(Event event) {
            handled.add(List.of(event));
        }

        @Override
        public void handle(List<Event> events) {
            handled.add(List.copyOf(events));
        }
    };
    private final PendingOffsets offsets = new PendingOffsets();

    @Test
    void handles_batches_and_releases_their_offsets() throws Exception {
        var observer = new BatchEventObserver(handler, null, offsets, 3, Duration.ZERO, 9);
        for (int i = 0; i < 7; i++) {
            observer.onEvent(event(i, "k" + i, new OrderPlaced("k" + i, i)), false);
        }
        observer.complete();

        assertThat(handled).extracting(List::size).containsExactly(3, 3, 1);
        assertThat(offsets.drain(Set.of(PARTITION))).isEqualTo(Map.of(PARTITION, new OffsetAndMetadata(7)));
    }

    @Test
    void skipped_events_are_committed_but_not_handled() throws Exception {
        var observer = new BatchEventObserver(handler, null, offsets, 3, Duration.ZERO, 9);
        observer.onEvent(event(0, "a", new OrderPlaced("a", 1)), false);
        observer.onEvent(event(1, "b", null), true);
        observer.onEvent(event(2, "c", null), true);
        observer.complete();

        assertThat(handled).singleElement().satisfies(batch -> assertThat(batch).extracting(Event::offset).containsExactly(0L));
        assertThat(offsets.drain(Set.of(PARTITION))).isEqualTo(Map.of(PARTITION, new OffsetAndMetadata(3)));
    }

    @Test
    void events_of_poisoned_streams_bypass_the_handler() throws Exception {
        PoisonEventInbox inbox = mock(PoisonEventInbox.class);
        when(inbox.getPoisonStreams(anyCollection())).thenReturn(Set.of(new StreamId("orders", "b")));
        var observer = new BatchEventObserver(handler, inbox, offsets, 3, Duration.ZERO, 9);

        Event a1 = event(0, "a", new OrderPlaced("a", 1));
        Event b1 = event(1, "b", new OrderPlaced("b", 1));
        Event a2 = event(2, "a", new OrderPlaced("a", 2));
        observer.onEvent(a1, false);
        observer.onEvent(b1, false);
        observer.onEvent(a2, false);
        observer.complete();

        assertThat(handled).containsExactly(List.of(a1, a2));
        verify(inbox).add((Collection<PoisonEvent>) List.of(new PoisonEvent(b1, "Stream is poisoned.")));
        assertThat(offsets.drain(Set.of(PARTITION))).isEqualTo(Map.of(PARTITION, new OffsetAndMetadata(3)));
    }

    @Test
    void failed_batch_keeps_its_offsets_and_stops_the_observer() throws Exception {
        EventHandler failing = new EventHandler() {
            @Override
            public void handle(Event event) {
                throw new IllegalStateException("ambiguous");
            }

            @Override
            public void handle(List<Event> events) {
                throw new IllegalStateException("ambiguous");
            }
        };
        var observer = new BatchEventObserver(failing, null, offsets, 2, Duration.ZERO, 6);
        observer.onEvent(event(0, "a", new OrderPlaced("a", 1)), false);
        observer.onEvent(event(1, "b", new OrderPlaced("b", 1)), false);

        assertThatThrownBy(observer::complete).isInstanceOf(IllegalStateException.class);
        assertThat(offsets.drain(Set.of(PARTITION))).isEmpty();
    }
}
