package com.bastion.database;

import java.time.Duration;
import java.util.Optional;

/**
 * The backing store cannot serve the call right now.
 *
 * <p>This is the "service unavailable" condition: it aborts the calling operation and is never
 * swallowed. Whether to retry is up to the caller; {@link #retryAfter()} carries a hint when one is
 * known (the remaining circuit-breaker cooldown).
 */
public class StoreUnavailableException extends RuntimeException {

    /** Why the store is unavailable. */
    public enum Reason {
        /** The circuit breaker is open, or a half-open probe is already in flight. */
        CIRCUIT_OPEN,
        /** No pooled connection became free within the checkout timeout. */
        POOL_EXHAUSTED,
        /** The store itself failed: unreachable, connection lost, transaction could not start. */
        STORE_FAILURE
    }

    private final Reason reason;
    private final Duration retryAfter;

    public StoreUnavailableException(Reason reason, String message, Throwable cause) {
        this(reason, message, cause, null);
    }

    public StoreUnavailableException(
            Reason reason, String message, Throwable cause, Duration retryAfter) {
        super(message, cause);
        this.reason = reason;
        this.retryAfter = retryAfter;
    }

    public Reason reason() {
        return reason;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
