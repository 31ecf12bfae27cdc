package com.palmid.common.concurrent;

import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Thread-safe utilities for concurrent operations
 */
public final class ConcurrencyUtils {

    private ConcurrencyUtils() {
    }

    /**
     * Executes an action with a lock
     */
    public static <T> T withLock(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Executes an action with a lock (void return)
     */
    public static void withLockVoid(Lock lock, Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
