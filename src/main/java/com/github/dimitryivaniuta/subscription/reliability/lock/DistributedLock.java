package com.github.dimitryivaniuta.subscription.reliability.lock;

/**
 * Named mutual exclusion across all instances of the service.
 */
public interface DistributedLock {

    /**
     * Blocks until the lock is held by the caller.
     *
     * @throws InterruptedException if interrupted while waiting; the lock is then not held
     */
    void tryEnter(long lockId) throws InterruptedException;

    /**
     * Releases the lock. Releasing a lock that is not held does nothing.
     */
    void exit(long lockId);
}
