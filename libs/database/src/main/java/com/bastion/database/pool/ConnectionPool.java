package com.bastion.database.pool;

import com.bastion.observability.ComponentHealth;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, validated connection pool for the backing store, backed by HikariCP.
 *
 * <p>One instance per process, created by the start-up routine and passed to whoever needs it.
 * The underlying {@link HikariDataSource} is built on first use through a {@link
 * OneTimeInitializer}, so concurrent first callers share one pool instead of racing to build two.
 *
 * <p>Mapping onto HikariCP: {@code baseSize} is {@code minimumIdle}, {@code baseSize +
 * maxOverflow} is {@code maximumPoolSize}, {@code checkoutTimeout} is {@code connectionTimeout},
 * {@code maxAge} is {@code maxLifetime}. HikariCP pings a connection that has been idle before
 * handing it out and throws {@link java.sql.SQLTransientConnectionException} when a checkout times
 * out.
 */
public final class ConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

    private final String name;
    private final PoolSettings settings;
    private final OneTimeInitializer<HikariDataSource> dataSource;
    private volatile boolean closed;

    public ConnectionPool(String name, PoolSettings settings) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.name = name;
        this.settings = settings;
        this.dataSource = new OneTimeInitializer<>(this::createDataSource);
    }

    /**
     * Returns the pooled data source, creating the pool on first call.
     *
     * @throws IllegalStateException if the pool has been closed
     */
    public DataSource dataSource() {
        if (closed) {
            throw new IllegalStateException("Connection pool '" + name + "' is closed");
        }
        return dataSource.get();
    }

    /** Whether the pool has been created. */
    public boolean isStarted() {
        return dataSource.isInitialized();
    }

    public PoolSettings settings() {
        return settings;
    }

    public String name() {
        return name;
    }

    /** Current occupancy; all zeros before first use. */
    public PoolStats stats() {
        HikariDataSource ds = dataSource.getIfInitialized();
        if (ds == null || ds.isClosed()) {
            return PoolStats.notStarted();
        }
        HikariPoolMXBean mx = ds.getHikariPoolMXBean();
        if (mx == null) {
            return PoolStats.notStarted();
        }
        return new PoolStats(
                mx.getActiveConnections(),
                mx.getIdleConnections(),
                mx.getTotalConnections(),
                mx.getThreadsAwaitingConnection());
    }

    /**
     * Checks out a connection and pings it. Never throws.
     *
     * @return the store's health as seen through this pool
     */
    public ComponentHealth ping() {
        long start = System.nanoTime();
        try (Connection connection = dataSource().getConnection()) {
            int timeoutSeconds = (int) Math.max(1, settings.validationTimeout().toSeconds());
            boolean valid = connection.isValid(timeoutSeconds);
            long elapsed = elapsedMs(start);
            return valid
                    ? ComponentHealth.healthy("store", elapsed)
                    : ComponentHealth.unhealthy("store", "connection failed validation", elapsed);
        } catch (SQLException | RuntimeException e) {
            log.debug("Store ping failed for pool '{}'", name, e);
            return ComponentHealth.unhealthy("store", e.getMessage(), elapsedMs(start));
        }
    }

    @Override
    public void close() {
        closed = true;
        HikariDataSource ds = dataSource.getIfInitialized();
        if (ds != null && !ds.isClosed()) {
            log.info("Closing connection pool '{}'", name);
            ds.close();
        }
    }

    private HikariDataSource createDataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName(name);
        config.setJdbcUrl(settings.jdbcUrl());
        config.setUsername(settings.username());
        config.setPassword(settings.password());
        config.setMinimumIdle(settings.baseSize());
        config.setMaximumPoolSize(settings.maxSize());
        config.setConnectionTimeout(settings.checkoutTimeout().toMillis());
        config.setMaxLifetime(settings.maxAge().toMillis());
        config.setValidationTimeout(settings.validationTimeout().toMillis());
        config.setAutoCommit(true);
        // start even when the store is down; checkouts fail until it comes back
        config.setInitializationFailTimeout(-1);
        config.setTransactionIsolation("TRANSACTION_READ_COMMITTED");

        log.info("Creating connection pool '{}' with {}", name, settings);
        return new HikariDataSource(config);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
