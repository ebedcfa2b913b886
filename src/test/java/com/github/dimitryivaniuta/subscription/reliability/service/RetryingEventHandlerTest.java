package com.github.dimitryivaniuta.subscription.reliability.service;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.event.TestEvents.OrderPlaced;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;
import com.github.dimitryivaniuta.subscription.persistence.PoisonEventStore;
import com.github.dimitryivaniuta.subscription.reliability.model.OccuredFailure;
import com.github.dimitryivaniuta.subscription.reliability.scope.DeadLetterQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import static com.github.dimitryivaniuta.subscription.event.TestEvents.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class RetryingEventHandlerTest {

    @Mock
    PoisonEventStore store;

    @Captor
    ArgumentCaptor<OccuredFailure> failure;

    @Captor
    ArgumentCaptor<Collection<OccuredFailure>> failures;

    @Captor
    ArgumentCaptor<Collection<TopicPartitionOffset>> removed;

    @Test
    void single_event_failure_is_recorded() {
        Event event = event(7, "a", new OrderPlaced("a", 1));
        var handler = new RetryingEventHandler(ScriptedEventHandler.failing("db down"), store);

        handler.handle(event);

        verify(store).addFailure(any(), failure.capture());
        assertThat(failure.getValue().position()).isEqualTo(event.position());
        assertThat(failure.getValue().reason()).contains("db down");
        verify(store, never()).remove(any(TopicPartitionOffset.class));
    }

    @Test
    void single_event_marked_poisoned_is_recorded() {
        Event event = event(7, "a", new OrderPlaced("a", 1));
        var handler = new RetryingEventHandler(
                new ScriptedEventHandler(events -> DeadLetterQueue.add(events.get(0).payload(), "still invalid")), store);

        handler.handle(event);

        verify(store).addFailure(any(), failure.capture());
        assertThat(failure.getValue()).isEqualTo(new OccuredFailure(event.position(), "still invalid"));
    }

    @Test
    void single_event_success_removes_it() {
        Event event = event(7, "a", new OrderPlaced("a", 1));

        new RetryingEventHandler(ScriptedEventHandler.succeeding(), store).handle(event);

        verify(store).remove(event.position());
        verify(store, never()).addFailure(any(), any());
    }

    @Test
    void batch_records_marked_events_and_removes_the_rest() {
        List<Event> batch = batchOf(5);
        Event marked = batch.get(2);
        var handler = new RetryingEventHandler(
                new ScriptedEventHandler(events -> DeadLetterQueue.add(marked.payload(), "bad one")), store);

        handler.handle(batch);

        verify(store).addFailures(any(), failures.capture());
        assertThat(failures.getValue()).containsExactly(new OccuredFailure(marked.position(), "bad one"));

        verify(store).remove(removed.capture());
        List<TopicPartitionOffset> expected = new ArrayList<>();
        for (Event e : batch) {
            if (e != marked) expected.add(e.position());
        }
        assertThat(removed.getValue()).containsExactlyElementsOf(expected);
    }

    @Test
    void batch_exception_is_not_attributed_and_store_is_untouched() {
        List<Event> batch = batchOf(5);
        var handler = new RetryingEventHandler(ScriptedEventHandler.failing("which one?"), store);

        assertThatThrownBy(() -> handler.handle(batch))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("which one?");

        verifyNoInteractions(store);
    }

    @Test
    void batch_of_one_exception_is_attributed() {
        List<Event> batch = batchOf(1);
        var handler = new RetryingEventHandler(ScriptedEventHandler.failing("this one"), store);

        handler.handle(batch);

        verify(store).addFailures(any(), failures.capture());
        assertThat(failures.getValue()).singleElement()
                .satisfies(f -> assertThat(f.position()).isEqualTo(batch.get(0).position()));
        verify(store, never()).remove(any(Collection.class));
    }

    @Test
    void batch_where_every_event_is_marked_removes_nothing() {
        List<Event> batch = batchOf(3);
        var handler = new RetryingEventHandler(
                new ScriptedEventHandler(events -> events.forEach(e -> DeadLetterQueue.add(e, "all bad"))), store);

        handler.handle(batch);

        verify(store).addFailures(any(), failures.capture());
        assertThat(failures.getValue()).hasSize(3);
        verify(store, never()).remove(any(Collection.class));
    }

    @Test
    void clean_batch_removes_everything() {
        List<Event> batch = batchOf(4);

        new RetryingEventHandler(ScriptedEventHandler.succeeding(), store).handle(batch);

        verify(store, never()).addFailures(any(), any());
        verify(store).remove(removed.capture());
        assertThat(removed.getValue()).hasSize(4);
    }

    static List<Event> batchOf(int size) {
        List<Event> events = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            events.add(event(100 + i, "key-" + i, new OrderPlaced("key-" + i, i)));
        }
        return events;
    }
}
