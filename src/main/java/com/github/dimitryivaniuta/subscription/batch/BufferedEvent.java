package com.github.dimitryivaniuta.subscription.batch;

/**
 * Event slot in a batch. A skipped event keeps its place for offset accounting but is not dispatched.
 */
public record BufferedEvent<T>(T event, boolean skipped) {
}
