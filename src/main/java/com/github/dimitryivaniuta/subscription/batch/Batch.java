package com.github.dimitryivaniuta.subscription.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered group of events closed by a {@link Buffer}.
 * <p>
 * The receiver owns the batch and releases it with {@link #close()} after processing; a released
 * batch cannot be read anymore.
 */
public final class Batch<T> implements AutoCloseable {

    private final List<BufferedEvent<T>> events;
    private volatile boolean released;

    Batch(List<BufferedEvent<T>> events) {
        this.events = Collections.unmodifiableList(events);
    }

    /**
     * All slots, skipped ones included, in the order they were added.
     */
    public List<BufferedEvent<T>> events() {
        ensureNotReleased();
        return events;
    }

    /**
     * Events that should reach the handlers, in batch order.
     */
    public List<T> handleable() {
        ensureNotReleased();
        List<T> result = new ArrayList<>(events.size());
        for (BufferedEvent<T> e : events) {
            if (!e.skipped()) result.add(e.event());
        }
        return result;
    }

    public int size() {
        return events.size();
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        released = true;
    }

    private void ensureNotReleased() {
        if (released) throw new IllegalStateException("Batch is already released.");
    }
}
