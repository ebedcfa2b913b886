package com.github.dimitryivaniuta.subscription.reliability.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.subscription.batch.BatchHandlingStrategy;
import com.github.dimitryivaniuta.subscription.event.EventHeader;
import com.github.dimitryivaniuta.subscription.event.JsonEventDeserializer;
import com.github.dimitryivaniuta.subscription.event.TestEvents.OrderPlaced;
import com.github.dimitryivaniuta.subscription.event.TopicPartitionOffset;
import com.github.dimitryivaniuta.subscription.handling.DispatchingEventHandler;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import com.github.dimitryivaniuta.subscription.handling.MessageHandlersRegistry;
import com.github.dimitryivaniuta.subscription.persistence.InMemoryPoisonEventStore;
import com.github.dimitryivaniuta.subscription.reliability.model.OpeningPoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.model.StoredPoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.scope.DeadLetterQueue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TopicRetryingServiceTest {

    private final InMemoryPoisonEventStore store = new InMemoryPoisonEventStore();
    private final MessageHandlersRegistry registry = new MessageHandlersRegistry();
    private final List<List<OrderPlaced>> handledBatches = new ArrayList<>();
    private final List<OrderPlaced> handled = new ArrayList<>();

    @Test
    void single_mode_removes_recovered_events_and_records_new_failures() {
        registry.register(OrderPlaced.class, order -> {
            if (order.seq() == 2) throw new IllegalStateException("still broken");
            handled.add(order);
        });
        quarantine(0, "a", order("a", 1), "OrderPlaced");
        quarantine(1, "b", order("b", 2), "OrderPlaced");

        service(false, null).retry();

        assertThat(handled).containsExactly(new OrderPlaced("a", 1));
        assertThat(store.getEventsForRetrying("orders")).singleElement().satisfies(e -> {
            assertThat(e.position().offset()).isEqualTo(1);
            assertThat(e.totalFailureCount()).isEqualTo(2);
            assertThat(e.lastFailureReason()).contains("still broken");
        });
    }

    @Test
    void batch_mode_replays_through_the_ordering_strategy() {
        registry.registerBatch(OrderPlaced.class, orders -> {
            handledBatches.add(List.copyOf(orders));
            for (OrderPlaced order : orders) {
                if (order.seq() == 99) DeadLetterQueue.add(order, "rejected again");
            }
        });
        quarantine(0, "a", order("a", 1), "OrderPlaced");
        quarantine(1, "b", order("b", 99), "OrderPlaced");
        quarantine(2, "a", order("a", 2), "OrderPlaced");

        service(true, BatchHandlingStrategy.ORDERED_WITHIN_KEY).retry();

        assertThat(handledBatches).containsExactly(
                List.of(new OrderPlaced("a", 1), new OrderPlaced("a", 2)),
                List.of(new OrderPlaced("b", 99)));
        assertThat(store.getEventsForRetrying("orders"))
                .extracting(e -> e.position().offset())
                .containsExactly(1L);
    }

    @Test
    void undeserializable_record_gets_failure_recorded() {
        registry.register(OrderPlaced.class, handled::add);
        quarantine(0, "a", "{not json", "OrderPlaced");
        quarantine(1, "b", order("b", 1), "OrderPlaced");

        service(false, null).retry();

        assertThat(handled).containsExactly(new OrderPlaced("b", 1));
        assertThat(store.getEventsForRetrying("orders")).singleElement().satisfies(e -> {
            assertThat(e.position().offset()).isZero();
            assertThat(e.totalFailureCount()).isEqualTo(2);
        });
    }

    @Test
    void record_without_handler_is_left_untouched() {
        registry.register(OrderPlaced.class, handled::add);
        quarantine(0, "a", "{}", "InvoiceIssued");

        service(false, null).retry();

        assertThat(handled).isEmpty();
        assertThat(store.getEventsForRetrying("orders")).singleElement()
                .extracting(StoredPoisonEvent::totalFailureCount)
                .isEqualTo(1);
    }

    private TopicRetryingService service(boolean batch, BatchHandlingStrategy strategy) {
        EventHandler handler = new RetryingEventHandler(new DispatchingEventHandler(registry), store);
        if (batch) {
            handler = strategy.decorate(handler);
        }
        return new TopicRetryingService("orders", store,
                new JsonEventDeserializer(new ObjectMapper(), registry, null), handler, batch);
    }

    private void quarantine(long offset, String key, String json, String type) {
        store.add(Instant.now(), List.of(new OpeningPoisonEvent(
                new TopicPartitionOffset("orders", 0, offset),
                key,
                key.getBytes(StandardCharsets.UTF_8),
                json.getBytes(StandardCharsets.UTF_8),
                Instant.now(),
                List.of(new EventHeader("x-message-type", type.getBytes(StandardCharsets.UTF_8))),
                "first failure")));
    }

    private static String order(String id, int seq) {
        return "{\"orderId\":\"" + id + "\",\"seq\":" + seq + "}";
    }
}
