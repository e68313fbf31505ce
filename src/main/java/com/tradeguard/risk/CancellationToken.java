package com.tradeguard.risk;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Passed through every execution call so a kill-switch trip is honored at each fill.
 *
 * <p>{@link #runUnlessCancelled} holds the shared lock while its action runs, and
 * {@link #cancel} takes the exclusive lock. Once {@code cancel} returns, no guarded action is
 * running and none will start again. A token is never un-cancelled; re-arming the kill
 * switch issues a new one.
 */
public final class CancellationToken {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean cancelled;
    private volatile String reason;

    public void cancel(String reason) {
        lock.writeLock().lock();
        try {
            if (!cancelled) {
                this.reason = reason;
                this.cancelled = true;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }

    /**
     * Runs {@code action} unless the token is cancelled. Empty means the action did not run.
     * The action must not call back into anything that may cancel this token.
     */
    public <T> Optional<T> runUnlessCancelled(Supplier<T> action) {
        lock.readLock().lock();
        try {
            if (cancelled) {
                return Optional.empty();
            }
            return Optional.ofNullable(action.get());
        } finally {
            lock.readLock().unlock();
        }
    }
}
