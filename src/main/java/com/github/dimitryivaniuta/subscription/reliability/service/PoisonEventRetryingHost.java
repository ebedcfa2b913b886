package com.github.dimitryivaniuta.subscription.reliability.service;

import com.github.dimitryivaniuta.subscription.reliability.lock.DistributedLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Background replay of quarantined events.
 * <p>
 * Every {@code retryInterval} one instance of the whole deployment takes the retry lock and runs the pass
 * of every dead letter enabled topic. The pass of one topic failing does not stop the others.
 */
@Slf4j
public class PoisonEventRetryingHost implements SmartLifecycle {

    public static final long RETRY_LOCK_ID = 1;

    private final List<TopicRetryingService> services;
    private final DistributedLock lock;
    private final Duration retryInterval;

    private ThreadPoolTaskScheduler scheduler;
    private ScheduledFuture<?> passes;
    private volatile boolean running;

    public PoisonEventRetryingHost(List<TopicRetryingService> services, DistributedLock lock, Duration retryInterval) {
        this.services = List.copyOf(services);
        this.lock = lock;
        this.retryInterval = retryInterval;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        running = true;

        if (services.isEmpty()) {
            log.info("[RETRY] no dead letter enabled topics, retry host idle");
            return;
        }

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("poison-retry-");
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        passes = scheduler.scheduleWithFixedDelay(this::runPass, retryInterval);
        log.info("[RETRY] retry host started topics={} interval={}",
                services.stream().map(TopicRetryingService::getTopic).toList(), retryInterval);
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        running = false;

        if (scheduler == null) return;
        // interrupts a pass waiting for the lock
        passes.cancel(true);
        scheduler.shutdown();
        scheduler = null;
        passes = null;
        log.info("[RETRY] retry host stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one pass under the retry lock, blocking until the lock is taken.
     *
     * @return {@code false} when the lock could not be used and the pass was skipped
     */
    public boolean retryOnce() throws InterruptedException {
        if (services.isEmpty()) return true;

        try {
            lock.tryEnter(RETRY_LOCK_ID);
        } catch (RuntimeException e) {
            log.error("[RETRY] cannot take retry lock, pass skipped", e);
            return false;
        }

        try {
            for (TopicRetryingService service : services) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Retry pass interrupted.");
                }
                try {
                    service.retry();
                } catch (RuntimeException e) {
                    log.error("[RETRY] Dead letter queue retrying failed. topic={}", service.getTopic(), e);
                }
            }
        } finally {
            try {
                lock.exit(RETRY_LOCK_ID);
            } catch (RuntimeException e) {
                log.error("[RETRY] cannot release retry lock", e);
            }
        }
        return true;
    }

    private void runPass() {
        try {
            retryOnce();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
