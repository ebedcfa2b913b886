package com.github.dimitryivaniuta.subscription.consumer;

import com.github.dimitryivaniuta.subscription.event.Event;
import com.github.dimitryivaniuta.subscription.event.EventDeserializer;
import com.github.dimitryivaniuta.subscription.reliability.exception.EventDeserializationException;
import com.github.dimitryivaniuta.subscription.reliability.model.PoisonEvent;
import com.github.dimitryivaniuta.subscription.reliability.model.Reasons;
import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventInbox;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One consumption loop of a subscription: poll its topics, deserialize, feed the observer, commit.
 * <p>
 * Records of all topics go to the same observer, so a batch may span topics. The loop owns the Kafka
 * consumer and the observer; both are closed when {@link #run()} returns.
 * Offsets are committed only for events the observer reported as processed, so a restart
 * redelivers everything after the last fully handled batch.
 */
@Slf4j
public class TopicConsumer {

    @Getter
    private final List<String> topics;
    private final Consumer<byte[], byte[]> consumer;
    private final EventDeserializer deserializer;
    private final Observer observer;
    private final PendingOffsets offsets;
    private final PoisonEventInbox inbox;
    private final Duration pollTimeout;

    public TopicConsumer(List<String> topics,
                         Consumer<byte[], byte[]> consumer,
                         EventDeserializer deserializer,
                         Observer observer,
                         PendingOffsets offsets,
                         PoisonEventInbox inbox,
                         Duration pollTimeout) {
        if (topics.isEmpty()) throw new IllegalArgumentException("At least one topic is required.");
        this.topics = List.copyOf(topics);
        this.consumer = consumer;
        this.deserializer = deserializer;
        this.observer = observer;
        this.offsets = offsets;
        this.inbox = inbox;
        this.pollTimeout = pollTimeout;
    }

    /**
     * Consumes until the thread is interrupted or an error stops the loop.
     *
     * @throws InterruptedException when stopped by interruption
     */
    public void run() throws InterruptedException {
        try {
            consumer.subscribe(topics, new CommitOnRevoke());
            log.info("[SUBSCRIPTION] consuming topics={}", topics);

            while (!Thread.currentThread().isInterrupted()) {
                for (ConsumerRecord<byte[], byte[]> record : consumer.poll(pollTimeout)) {
                    accept(record);
                }
                commitProcessed();
            }
            throw new InterruptedException("Consumption of " + topics + " interrupted.");
        } catch (InterruptException e) {
            InterruptedException interrupted = new InterruptedException("Consumption of " + topics + " interrupted.");
            interrupted.initCause(e);
            throw interrupted;
        } finally {
            // KafkaConsumer#close fails on an interrupted thread
            boolean interrupted = Thread.interrupted();
            try {
                observer.close();
                consumer.close();
            } finally {
                if (interrupted) Thread.currentThread().interrupt();
            }
        }
    }

    private void accept(ConsumerRecord<byte[], byte[]> record) throws InterruptedException {
        Event event;
        try {
            event = deserializer.deserialize(record);
        } catch (EventDeserializationException e) {
            if (inbox == null) throw e;

            log.error("[POISON] undeserializable record topic={} partition={} offset={}",
                    record.topic(), record.partition(), record.offset(), e);
            inbox.add(new PoisonEvent(e.getRawEvent(), Reasons.of(e)));
            observer.onEvent(e.getRawEvent(), true);
            return;
        }
        observer.onEvent(event, event.payload() == null);
    }

    private void commitProcessed() {
        Map<TopicPartition, OffsetAndMetadata> toCommit = offsets.drain(consumer.assignment());
        if (toCommit.isEmpty()) return;

        consumer.commitSync(toCommit);
        log.debug("[SUBSCRIPTION] committed topics={} offsets={}", topics, toCommit);
    }

    private class CommitOnRevoke implements ConsumerRebalanceListener {

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            commitProcessed();
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("[SUBSCRIPTION] assigned topics={} partitions={}", topics, partitions);
        }
    }
}
