package com.github.dimitryivaniuta.subscription.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.subscription.event.JsonEventDeserializer;
import com.github.dimitryivaniuta.subscription.event.TestEvents.OrderPlaced;
import com.github.dimitryivaniuta.subscription.handling.DispatchingEventHandler;
import com.github.dimitryivaniuta.subscription.handling.MessageHandlersRegistry;
import com.github.dimitryivaniuta.subscription.persistence.InMemoryPoisonEventStore;
import com.github.dimitryivaniuta.subscription.reliability.exception.EventDeserializationException;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.scope.DeadLetterQueue;
import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventHandler;
import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventInbox;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TopicConsumerTest {

    private static final TopicPartition PARTITION = new TopicPartition("orders", 0);

    private final MockConsumer<byte[], byte[]> kafka = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    private final List<OrderPlaced> handled = new CopyOnWriteArrayList<>();
    private final MessageHandlersRegistry registry = new MessageHandlersRegistry().register(OrderPlaced.class, handled::add);

    @Test
    void handles_records_and_commits_processed_offsets() throws Exception {
        publish("{\"orderId\":\"a\",\"seq\":1}", "{\"orderId\":\"b\",\"seq\":2}", "{\"orderId\":\"c\",\"seq\":3}");
        var offsets = new PendingOffsets();
        var consumer = topicConsumer(new EventObserver(new DispatchingEventHandler(registry), null, offsets), offsets, null);

        Thread loop = start(consumer);
        waitUntil(() -> assertThat(committed()).isEqualTo(3L), 5_000);
        stop(loop);

        assertThat(handled).extracting(OrderPlaced::orderId).containsExactly("a", "b", "c");
        assertThat(kafka.closed()).isTrue();
    }

    @Test
    void undeserializable_record_is_quarantined_and_skipped() throws Exception {
        publish("{broken", "{\"orderId\":\"b\",\"seq\":2}");
        PoisonEventInbox inbox = mock(PoisonEventInbox.class);
        var offsets = new PendingOffsets();
        var consumer = topicConsumer(new EventObserver(new DispatchingEventHandler(registry), inbox, offsets), offsets, inbox);

        Thread loop = start(consumer);
        waitUntil(() -> assertThat(committed()).isEqualTo(2L), 5_000);
        stop(loop);

        ArgumentCaptor<PoisonEvent> poisoned = ArgumentCaptor.forClass(PoisonEvent.class);
        verify(inbox).add(poisoned.capture());
        assertThat(poisoned.getValue().event().offset()).isZero();
        assertThat(poisoned.getValue().reason()).contains("Cannot read OrderPlaced payload.");
        assertThat(handled).extracting(OrderPlaced::orderId).containsExactly("b");
    }

    @Test
    void undeserializable_record_stops_the_loop_without_quarantine() {
        publish("{broken");
        var offsets = new PendingOffsets();
        var consumer = topicConsumer(new EventObserver(new DispatchingEventHandler(registry), null, offsets), offsets, null);

        assertThatThrownBy(consumer::run).isInstanceOf(EventDeserializationException.class);
        assertThat(kafka.closed()).isTrue();
    }

    @Test
    void batch_spanning_two_topics_quarantines_through_one_inbox() throws Exception {
        var payments = new TopicPartition("payments", 0);
        Map<TopicPartition, List<ConsumerRecord<byte[], byte[]>>> published = Map.of(
                PARTITION, List.of(record(PARTITION, 0, "ok-1"), record(PARTITION, 1, "bad-1")),
                payments, List.of(record(payments, 0, "bad-2"), record(payments, 1, "ok-2")));
        kafka.updateBeginningOffsets(Map.of(PARTITION, 0L, payments, 0L));
        kafka.schedulePollTask(() -> {
            kafka.rebalance(List.of(PARTITION, payments));
            published.values().forEach(records -> records.forEach(kafka::addRecord));
        });

        var fetchConsumer = new MockConsumer<byte[], byte[]>(OffsetResetStrategy.NONE);
        for (int i = 0; i < 2; i++) {
            fetchConsumer.schedulePollTask(() -> {
                TopicPartition assigned = fetchConsumer.assignment().iterator().next();
                fetchConsumer.addRecord(published.get(assigned).get((int) fetchConsumer.position(assigned)));
            });
        }
        var store = new InMemoryPoisonEventStore();
        var inbox = new PoisonEventInbox(store, fetchConsumer, 1000, Duration.ofSeconds(5));

        var batchRegistry = new MessageHandlersRegistry().registerBatch(OrderPlaced.class, orders -> {
            for (OrderPlaced order : orders) {
                if (order.orderId().startsWith("bad")) {
                    DeadLetterQueue.add(order, "rejected");
                } else {
                    handled.add(order);
                }
            }
        });
        var offsets = new PendingOffsets();
        var observer = new BatchEventObserver(
                new PoisonEventHandler(new DispatchingEventHandler(batchRegistry), inbox), inbox, offsets, 4, Duration.ZERO, 8);
        var deserializer = new JsonEventDeserializer(new ObjectMapper(), batchRegistry, "OrderPlaced");
        var consumer = new TopicConsumer(List.of("orders", "payments"), kafka, deserializer, observer, offsets, inbox,
                Duration.ofMillis(10));

        Thread loop = start(consumer);
        waitUntil(() -> assertThat(kafka.committed(Set.of(PARTITION, payments)))
                .containsEntry(PARTITION, new OffsetAndMetadata(2))
                .containsEntry(payments, new OffsetAndMetadata(2)), 5_000);
        assertThat(kafka.subscription()).containsExactlyInAnyOrder("orders", "payments");
        stop(loop);

        assertThat(handled).extracting(OrderPlaced::orderId).containsExactlyInAnyOrder("ok-1", "ok-2");
        assertThat(store.getEventsForRetrying("orders")).singleElement()
                .satisfies(e -> assertThat(e.position().offset()).isEqualTo(1));
        assertThat(store.getEventsForRetrying("payments")).singleElement()
                .satisfies(e -> assertThat(e.position().offset()).isZero());
    }

    private static ConsumerRecord<byte[], byte[]> record(TopicPartition partition, long offset, String orderId) {
        return new ConsumerRecord<>(partition.topic(), partition.partition(), offset,
                orderId.getBytes(StandardCharsets.UTF_8),
                ("{\"orderId\":\"" + orderId + "\",\"seq\":" + offset + "}").getBytes(StandardCharsets.UTF_8));
    }

    private TopicConsumer topicConsumer(Observer observer, PendingOffsets offsets, PoisonEventInbox inbox) {
        var deserializer = new JsonEventDeserializer(new ObjectMapper(), registry, "OrderPlaced");
        return new TopicConsumer(List.of("orders"), kafka, deserializer, observer, offsets, inbox, Duration.ofMillis(10));
    }

    private void publish(String... values) {
        kafka.updateBeginningOffsets(Map.of(PARTITION, 0L));
        kafka.schedulePollTask(() -> {
            kafka.rebalance(List.of(PARTITION));
            for (int offset = 0; offset < values.length; offset++) {
                kafka.addRecord(new ConsumerRecord<>("orders", 0, offset,
                        ("k" + offset).getBytes(StandardCharsets.UTF_8),
                        values[offset].getBytes(StandardCharsets.UTF_8)));
            }
        });
    }

    private Long committed() {
        OffsetAndMetadata offset = kafka.committed(Set.of(PARTITION)).get(PARTITION);
        return offset == null ? null : offset.offset();
    }

    private static Thread start(TopicConsumer consumer) {
        Thread loop = new Thread(() -> {
            try {
                consumer.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        loop.start();
        return loop;
    }

    private static void stop(Thread loop) throws InterruptedException {
        loop.interrupt();
        loop.join(5_000);
    }

    private static void waitUntil(Runnable assertion, long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        AssertionError last = null;
        while (System.currentTimeMillis() < deadline) {
            try {
                assertion.run();
                return;
            } catch (AssertionError e) {
                last = e;
                Thread.sleep(20);
            }
        }
        if (last != null) throw last;
    }
}
