package com.github.dimitryivaniuta.subscription.reliability.lock;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lock shared through a single JVM only: fits one instance deployments and tests.
 */
public class InMemoryDistributedLock implements DistributedLock {

    private final ConcurrentMap<Long, Slot> slots = new ConcurrentHashMap<>();

    @Override
    public void tryEnter(long lockId) throws InterruptedException {
        Slot slot = slot(lockId);
        slot.permit.acquire();
        slot.held.set(true);
    }

    @Override
    public void exit(long lockId) {
        Slot slot = slot(lockId);
        if (slot.held.compareAndSet(true, false)) {
            slot.permit.release();
        }
    }

    public boolean isHeld(long lockId) {
        return slot(lockId).held.get();
    }

    private Slot slot(long lockId) {
        return slots.computeIfAbsent(lockId, __ -> new Slot());
    }

    private static final class Slot {
        private final Semaphore permit = new Semaphore(1);
        private final AtomicBoolean held = new AtomicBoolean();
    }
}
