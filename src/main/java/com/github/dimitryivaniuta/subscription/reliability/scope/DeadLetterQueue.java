package com.github.dimitryivaniuta.subscription.reliability.scope;

import com.github.dimitryivaniuta.subscription.event.Event;

import java.util.List;

/**
 * Lets application handlers quarantine particular messages without throwing:
 * <pre>{@code
 * public void handle(List<Order> orders) {
 *     for (Order order : orders) {
 *         if (!order.isValid()) {
 *             DeadLetterQueue.add(order, "invalid order");
 *             continue;
 *         }
 *         process(order);
 *     }
 * }
 * }</pre>
 * Marks are bound to the handling thread; they must be made on the thread that called the handler.
 */
public final class DeadLetterQueue {

    private static final ThreadLocal<DeadLetterQueueScope> CURRENT = new ThreadLocal<>();

    private DeadLetterQueue() {
    }

    /**
     * Marks a message (payload object or {@link Event}) of the current handling call as poisoned.
     *
     * @throws IllegalStateException    when called outside a handling call
     * @throws IllegalArgumentException when the message was not handed to the current call
     */
    public static void add(Object message, String reason) {
        DeadLetterQueueScope scope = CURRENT.get();
        if (scope == null) {
            throw new IllegalStateException("No dead letter queue scope is open on this thread.");
        }
        scope.mark(message, reason);
    }

    public static DeadLetterQueueScope open(Event event) {
        return open(List.of(event));
    }

    public static DeadLetterQueueScope open(List<Event> events) {
        var scope = new DeadLetterQueueScope(events, CURRENT.get());
        CURRENT.set(scope);
        return scope;
    }

    static void restore(DeadLetterQueueScope closing, DeadLetterQueueScope previous) {
        if (CURRENT.get() != closing) return;
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }
}
