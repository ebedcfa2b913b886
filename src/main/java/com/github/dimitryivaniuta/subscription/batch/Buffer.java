package com.github.dimitryivaniuta.subscription.batch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates events from a single producer into batches closed by size or by time, and hands them to a
 * {@link BatchSink} in the order they were closed.
 * <p>
 * Close triggers, first one wins:
 * - the batch reaches {@code maxBatchSize}
 * - {@code batchTriggerTimeout} elapses since the batch's first event (a fresh window for every batch;
 *   a non-positive timeout disables it)
 * <p>
 * Backpressure: at most {@code maxBufferSize} events may be held, counting the open batch and closed
 * batches the sink has not accepted yet. {@link #add} blocks beyond that until the sink accepts a batch
 * or the calling thread is interrupted.
 * <p>
 * The open batch is only touched under {@link #lock}: the timer fires on its own thread.
 */
@Slf4j
public final class Buffer<T> implements AutoCloseable {

    private final int maxBatchSize;
    private final long batchTriggerTimeoutNanos;
    private final BatchSink<T> sink;
    private final Semaphore capacity;

    private final ReentrantLock lock = new ReentrantLock();
    private final ScheduledExecutorService timer;
    private final ExecutorService sender;
    private final AtomicReference<Throwable> deliveryFailure = new AtomicReference<>();

    // guarded by lock
    private List<BufferedEvent<T>> current;
    private long generation;
    private ScheduledFuture<?> pendingTimeout;
    private boolean completed;

    public Buffer(int maxBatchSize, Duration batchTriggerTimeout, BatchSink<T> sink, int maxBufferSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be positive: " + maxBatchSize);
        }
        if (maxBufferSize < maxBatchSize) {
            throw new IllegalArgumentException(
                    "maxBufferSize (" + maxBufferSize + ") must not be less than maxBatchSize (" + maxBatchSize + ")");
        }

        this.maxBatchSize = maxBatchSize;
        this.batchTriggerTimeoutNanos = batchTriggerTimeout == null ? 0 : batchTriggerTimeout.toNanos();
        this.sink = sink;
        this.capacity = new Semaphore(maxBufferSize);
        this.current = new ArrayList<>(maxBatchSize);

        this.timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("buffer-timer-"));
        this.sender = Executors.newSingleThreadExecutor(daemonThreads("buffer-sender-"));
    }

    /**
     * Adds one event to the open batch.
     *
     * @throws InterruptedException  if interrupted while waiting for capacity
     * @throws IllegalStateException if the buffer is completed or a previous batch could not be delivered
     */
    public void add(T event, boolean skipped) throws InterruptedException {
        ensureUsable();

        capacity.acquire();
        lock.lock();
        try {
            if (completed) {
                capacity.release();
                throw new IllegalStateException("Buffer is completed.");
            }

            if (current.isEmpty()) {
                scheduleTimeout();
            }
            current.add(new BufferedEvent<>(event, skipped));

            if (current.size() >= maxBatchSize) {
                closeBatch();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flushes the open batch and waits until the sink has accepted everything. Later {@link #add} calls fail.
     */
    public void complete() throws InterruptedException {
        lock.lock();
        try {
            if (!completed) {
                completed = true;
                if (!current.isEmpty()) {
                    closeBatch();
                }
            }
        } finally {
            lock.unlock();
        }

        timer.shutdownNow();
        sender.shutdown();
        sender.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);

        Throwable failure = deliveryFailure.get();
        if (failure != null) {
            throw new IllegalStateException("Batch delivery failed.", failure);
        }
    }

    /**
     * Stops the buffer without flushing. Undelivered batches are dropped.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            completed = true;
            cancelTimeout();
        } finally {
            lock.unlock();
        }
        timer.shutdownNow();
        sender.shutdownNow();
    }

    private void ensureUsable() {
        Throwable failure = deliveryFailure.get();
        if (failure != null) {
            throw new IllegalStateException("Batch delivery failed.", failure);
        }
        lock.lock();
        try {
            if (completed) throw new IllegalStateException("Buffer is completed.");
        } finally {
            lock.unlock();
        }
    }

    private void scheduleTimeout() {
        if (batchTriggerTimeoutNanos <= 0) return;

        long batchGeneration = generation;
        pendingTimeout = timer.schedule(() -> onTimeout(batchGeneration), batchTriggerTimeoutNanos, TimeUnit.NANOSECONDS);
    }

    private void onTimeout(long batchGeneration) {
        lock.lock();
        try {
            // the batch may have been closed by size in the meantime
            if (completed || generation != batchGeneration || current.isEmpty()) return;
            pendingTimeout = null;
            closeBatch();
        } finally {
            lock.unlock();
        }
    }

    private void cancelTimeout() {
        if (pendingTimeout != null) {
            pendingTimeout.cancel(false);
            pendingTimeout = null;
        }
    }

    private void closeBatch() {
        cancelTimeout();

        Batch<T> batch = new Batch<>(current);
        current = new ArrayList<>(maxBatchSize);
        generation++;

        try {
            sender.execute(() -> deliver(batch));
        } catch (RejectedExecutionException e) {
            capacity.release(batch.size());
            throw new IllegalStateException("Buffer is closed.", e);
        }
    }

    private void deliver(Batch<T> batch) {
        try {
            if (deliveryFailure.get() != null) {
                log.warn("[BUFFER] dropping batch of {} events after earlier delivery failure", batch.size());
                return;
            }
            sink.accept(batch);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deliveryFailure.compareAndSet(null, e);
        } catch (RuntimeException e) {
            log.error("[BUFFER] batch delivery failed, size={}", batch.size(), e);
            deliveryFailure.compareAndSet(null, e);
        } finally {
            capacity.release(batch.size());
        }
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        var factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
