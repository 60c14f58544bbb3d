package com.bastion.database.pool;

import java.time.Duration;

/**
 * Connection pool sizing and lifecycle.
 *
 * <p>The pool keeps {@code baseSize} connections warm and may grow by up to {@code maxOverflow}
 * more under load. A checkout waits at most {@code checkoutTimeout}; connections older than {@code
 * maxAge} are retired; a connection idle for a while is pinged (bounded by {@code
 * validationTimeout}) before it is handed out.
 *
 * @param jdbcUrl JDBC URL of the backing store
 * @param username database user
 * @param password database password (may be null)
 * @param baseSize connections kept open when idle
 * @param maxOverflow extra connections allowed under load
 * @param checkoutTimeout longest wait for a free connection
 * @param maxAge connection lifetime before recycling
 * @param validationTimeout longest liveness ping
 */
public record PoolSettings(
        String jdbcUrl,
        String username,
        String password,
        int baseSize,
        int maxOverflow,
        Duration checkoutTimeout,
        Duration maxAge,
        Duration validationTimeout) {

    public static final int DEFAULT_BASE_SIZE = 10;
    public static final int DEFAULT_MAX_OVERFLOW = 20;
    public static final Duration DEFAULT_CHECKOUT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_MAX_AGE = Duration.ofSeconds(300);
    public static final Duration DEFAULT_VALIDATION_TIMEOUT = Duration.ofSeconds(5);

    /** Smallest timeout HikariCP honours. */
    static final Duration MIN_TIMEOUT = Duration.ofMillis(250);

    /** Smallest connection lifetime HikariCP honours. */
    static final Duration MIN_MAX_AGE = Duration.ofSeconds(30);

    public PoolSettings {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl must not be blank");
        }
        if (baseSize < 1) {
            throw new IllegalArgumentException("baseSize must be at least 1");
        }
        if (maxOverflow < 0) {
            throw new IllegalArgumentException("maxOverflow must not be negative");
        }
        if (checkoutTimeout == null) {
            checkoutTimeout = DEFAULT_CHECKOUT_TIMEOUT;
        }
        if (maxAge == null) {
            maxAge = DEFAULT_MAX_AGE;
        }
        if (validationTimeout == null) {
            validationTimeout = DEFAULT_VALIDATION_TIMEOUT;
        }
        if (checkoutTimeout.compareTo(MIN_TIMEOUT) < 0
                || validationTimeout.compareTo(MIN_TIMEOUT) < 0) {
            throw new IllegalArgumentException("timeouts must be at least " + MIN_TIMEOUT);
        }
        if (maxAge.compareTo(MIN_MAX_AGE) < 0) {
            throw new IllegalArgumentException("maxAge must be at least " + MIN_MAX_AGE);
        }
    }

    /** Settings for {@code jdbcUrl} with default sizing. */
    public static PoolSettings defaults(String jdbcUrl, String username, String password) {
        return new PoolSettings(
                jdbcUrl,
                username,
                password,
                DEFAULT_BASE_SIZE,
                DEFAULT_MAX_OVERFLOW,
                null,
                null,
                null);
    }

    /** Hard upper bound on open connections. */
    public int maxSize() {
        return baseSize + maxOverflow;
    }

    @Override
    public String toString() {
        return "PoolSettings[jdbcUrl=%s, username=%s, baseSize=%d, maxOverflow=%d, checkoutTimeout=%s, maxAge=%s]"
                .formatted(jdbcUrl, username, baseSize, maxOverflow, checkoutTimeout, maxAge);
    }
}
