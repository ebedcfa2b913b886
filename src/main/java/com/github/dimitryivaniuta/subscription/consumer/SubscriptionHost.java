package com.github.dimitryivaniuta.subscription.consumer;

import com.github.dimitryivaniuta.subscription.reliability.service.PoisonEventInbox;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs every consumption loop on its own thread. A loop that fails is rebuilt from its factory after
 * {@code restartDelay} and resumes from the committed offsets.
 */
@Slf4j
public class SubscriptionHost implements SmartLifecycle {

    private final List<Supplier<TopicConsumer>> consumers;
    private final List<PoisonEventInbox> inboxes;
    private final Duration restartDelay;

    private ExecutorService executor;
    private volatile boolean running;

    public SubscriptionHost(List<Supplier<TopicConsumer>> consumers,
                            List<PoisonEventInbox> inboxes,
                            Duration restartDelay) {
        this.consumers = List.copyOf(consumers);
        this.inboxes = List.copyOf(inboxes);
        this.restartDelay = restartDelay;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        running = true;
        if (consumers.isEmpty()) return;

        executor = Executors.newFixedThreadPool(consumers.size(), new CustomizableThreadFactory("subscription-"));
        for (Supplier<TopicConsumer> factory : consumers) {
            executor.execute(() -> supervise(factory));
        }
        log.info("[SUBSCRIPTION] started consumers={}", consumers.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;

        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("[SUBSCRIPTION] consumers did not stop within 30s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
        for (PoisonEventInbox inbox : inboxes) {
            inbox.close();
        }
        log.info("[SUBSCRIPTION] stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void supervise(Supplier<TopicConsumer> factory) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                List<String> topics = null;
                try {
                    TopicConsumer consumer = factory.get();
                    topics = consumer.getTopics();
                    consumer.run();
                } catch (RuntimeException e) {
                    log.error("[SUBSCRIPTION] consumer failed topics={}, restarting in {}", topics, restartDelay, e);
                }
                Thread.sleep(restartDelay.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
