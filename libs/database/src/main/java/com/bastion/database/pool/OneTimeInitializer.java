package com.bastion.database.pool;

import java.util.function.Supplier;

/**
 * Lazily computes a value exactly once, even under concurrent first use.
 *
 * <p>Check-lock-check over a volatile field: the fast path is a single volatile read, and the
 * factory runs under the lock at most once per successful initialization. If the factory throws,
 * nothing is cached and the next caller tries again.
 *
 * <p>This replaces a process-wide global: the owner (the process start-up routine) holds the
 * initializer and passes the resulting object by reference.
 *
 * @param <T> type of the lazily created value
 */
public final class OneTimeInitializer<T> {

    private final Object lock = new Object();
    private final Supplier<? extends T> factory;
    private volatile T value;

    public OneTimeInitializer(Supplier<? extends T> factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        this.factory = factory;
    }

    /** Returns the value, creating it on first call. */
    public T get() {
        T result = value;
        if (result == null) {
            synchronized (lock) {
                result = value;
                if (result == null) {
                    result = factory.get();
                    if (result == null) {
                        throw new IllegalStateException("factory returned null");
                    }
                    value = result;
                }
            }
        }
        return result;
    }

    /** Whether the value has been created. Never triggers creation. */
    public boolean isInitialized() {
        return value != null;
    }

    /** Returns the value if already created, otherwise null. Never triggers creation. */
    public T getIfInitialized() {
        return value;
    }
}
