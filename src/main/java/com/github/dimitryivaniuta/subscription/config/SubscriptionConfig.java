package com.github.dimitryivaniuta.subscription.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.subscription.consumer.BatchEventObserver;
import com.github.dimitryivaniuta.subscription.consumer.EventObserver;
import com.github.dimitryivaniuta.subscription.consumer.Observer;
import com.github.dimitryivaniuta.subscription.consumer.PendingOffsets;
import com.github.dimitryivaniuta.subscription.consumer.SubscriptionHost;
import com.github.dimitryivaniuta.subscription.consumer.TopicConsumer;
import com.github.dimitryivaniuta.subscription.event.EventDeserializer;
import com.github.dimitryivaniuta.subscription.event.JsonEventDeserializer;
import com.github.dimitryivaniuta.subscription.handling.DispatchingEventHandler;
import com.github.dimitryivaniuta.subscription.handling.EventHandler;
import com.github.dimitryivaniuta.subscription.handling.MessageHandlersRegistry;
import com.github.dimitryivaniuta.subscription.persistence.PoisonEventStore;
import com.github.dimitryivaniuta.subscription.reliability.lock.DistributedLock;
import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventHandler;
import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventInbox;
import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventRetryingHost;
import com.github.dimitryivaniuta.subscription.reliability.service.RetryingEventHandler;
import com.github.dimitryivaniuta.subscription.reliability.service.TopicRetryingService;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * Wires the live pipeline of every configured subscription and the replay pipeline of each of its topics.
 * <p>
 * Live: ordering strategy -> {@link PoisonEventHandler} -> dispatch.
 * Replay: ordering strategy -> {@link RetryingEventHandler} -> dispatch.
 * <p>
 * Application handlers are registered on the {@link MessageHandlersRegistry} bean during context
 * initialization; consumption starts once the context is refreshed.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({SubscriptionProperties.class, DeadLetterProperties.class})
public class SubscriptionConfig {

    @Bean
    public MessageHandlersRegistry messageHandlersRegistry() {
        return new MessageHandlersRegistry();
    }

    @Bean
    public ConsumerFactory<byte[], byte[]> subscriptionConsumerFactory(KafkaProperties kafkaProperties,
                                                                       ObjectProvider<SslBundles> sslBundles) {
        Map<String, Object> config = kafkaProperties.buildConsumerProperties(sslBundles.getIfAvailable());
        config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        return new DefaultKafkaConsumerFactory<>(config);
    }

    @Bean
    public SubscriptionHost subscriptionHost(SubscriptionProperties subscriptions,
                                             KafkaProperties kafkaProperties,
                                             ConsumerFactory<byte[], byte[]> subscriptionConsumerFactory,
                                             MessageHandlersRegistry registry,
                                             ObjectMapper objectMapper,
                                             DeadLetterProperties deadLetter,
                                             PoisonEventStore store) {
        List<Supplier<TopicConsumer>> consumers = new ArrayList<>();
        List<PoisonEventInbox> inboxes = new ArrayList<>();

        for (SubscriptionProperties.Subscription subscription : subscriptions.getSubscriptions()) {
            String groupId = groupId(subscription, kafkaProperties);
            List<String> topics = List.copyOf(subscription.getTopics());

            // one inbox per subscription, shared by its consumer instances
            PoisonEventInbox inbox = null;
            if (subscription.isDeadLetterEnabled()) {
                Consumer<byte[], byte[]> fetchConsumer = subscriptionConsumerFactory.createConsumer(
                        groupId + deadLetter.getInboxGroupSuffix(), null, "-poison-inbox", inboxConsumerOverrides());
                inbox = new PoisonEventInbox(
                        store, fetchConsumer, deadLetter.getMaxPoisonEventsPerTopic(), deadLetter.getFetchTimeout());
                inboxes.add(inbox);
            }
            PoisonEventInbox subscriptionInbox = inbox;

            EventDeserializer deserializer = new JsonEventDeserializer(objectMapper, registry, subscription.getMessageType());
            EventHandler handler = livePipeline(subscription, registry, subscriptionInbox);

            for (int i = 0; i < subscription.getConsumerInstances(); i++) {
                String clientIdSuffix = "-" + String.join("-", topics) + "-" + i;
                consumers.add(() -> {
                    Consumer<byte[], byte[]> consumer = subscriptionConsumerFactory.createConsumer(groupId, clientIdSuffix);
                    PendingOffsets offsets = new PendingOffsets();
                    return new TopicConsumer(topics, consumer, deserializer,
                            observer(subscription, handler, subscriptionInbox, offsets), offsets, subscriptionInbox,
                            subscriptions.getPollTimeout());
                });
            }
            log.info("[SUBSCRIPTION] topics={} group={} instances={} batch={} deadLetter={}",
                    topics, groupId, subscription.getConsumerInstances(), subscription.isBatchProcessing(),
                    subscriptionInbox != null);
        }
        return new SubscriptionHost(consumers, inboxes, subscriptions.getRestartDelay());
    }

    @Bean
    public PoisonEventRetryingHost poisonEventRetryingHost(SubscriptionProperties subscriptions,
                                                           DeadLetterProperties deadLetter,
                                                           MessageHandlersRegistry registry,
                                                           ObjectMapper objectMapper,
                                                           PoisonEventStore store,
                                                           DistributedLock lock) {
        List<TopicRetryingService> services = new ArrayList<>();
        for (SubscriptionProperties.Subscription subscription : subscriptions.getSubscriptions()) {
            if (!subscription.isDeadLetterEnabled()) continue;

            EventHandler handler = new RetryingEventHandler(new DispatchingEventHandler(registry), store);
            if (subscription.isBatchProcessing()) {
                handler = subscription.getBatch().getHandlingStrategy().decorate(handler);
            }
            var deserializer = new JsonEventDeserializer(objectMapper, registry, subscription.getMessageType());
            for (String topic : subscription.getTopics()) {
                services.add(new TopicRetryingService(
                        topic, store, deserializer, handler, subscription.isBatchProcessing()));
            }
        }
        return new PoisonEventRetryingHost(services, lock, deadLetter.getRetryInterval());
    }

    private static EventHandler livePipeline(SubscriptionProperties.Subscription subscription,
                                             MessageHandlersRegistry registry,
                                             PoisonEventInbox inbox) {
        EventHandler handler = new DispatchingEventHandler(registry);
        if (inbox != null) {
            handler = new PoisonEventHandler(handler, inbox);
        }
        if (subscription.isBatchProcessing()) {
            handler = subscription.getBatch().getHandlingStrategy().decorate(handler);
        }
        return handler;
    }

    private static Observer observer(SubscriptionProperties.Subscription subscription,
                                     EventHandler handler,
                                     PoisonEventInbox inbox,
                                     PendingOffsets offsets) {
        if (!subscription.isBatchProcessing()) {
            return new EventObserver(handler, inbox, offsets);
        }
        SubscriptionProperties.Batch batch = subscription.getBatch();
        return new BatchEventObserver(handler, inbox, offsets,
                batch.getMaxBatchSize(), batch.getBatchTriggerTimeout(), batch.effectiveMaxBufferSize());
    }

    private static String groupId(SubscriptionProperties.Subscription subscription, KafkaProperties kafkaProperties) {
        String groupId = StringUtils.hasText(subscription.getGroupId())
                ? subscription.getGroupId()
                : kafkaProperties.getConsumer().getGroupId();
        if (!StringUtils.hasText(groupId)) {
            throw new IllegalStateException("Group id is not specified for topics " + subscription.getTopics());
        }
        return groupId;
    }

    private static Properties inboxConsumerOverrides() {
        Properties overrides = new Properties();
        overrides.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        overrides.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "none");
        overrides.put(ConsumerConfig.ALLOW_AUTO_CREATE_TOPICS_CONFIG, "false");
        overrides.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "1");
        return overrides;
    }
}
