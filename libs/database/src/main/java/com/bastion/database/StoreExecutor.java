package com.bastion.database;

import com.bastion.database.pool.ConnectionPool;
import com.bastion.database.pool.OneTimeInitializer;
import com.bastion.database.resilience.CircuitBreakerSettings;
import com.bastion.database.resilience.StoreCircuitBreaker;
import com.bastion.observability.SpanHelper;
import java.sql.SQLTransientConnectionException;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs units of work against the store: circuit breaker, then a pooled connection, then a Spring
 * transaction at READ_COMMITTED. Each unit of work is traced as a {@code bastion.store.write} or
 * {@code bastion.store.read} span.
 *
 * <p>Exception contract:
 *
 * <ul>
 *   <li>breaker open: {@link StoreUnavailableException} with {@code CIRCUIT_OPEN}, store untouched
 *   <li>checkout timed out on a saturated pool: {@code POOL_EXHAUSTED}; not counted against the
 *       store
 *   <li>store unreachable, connection lost, transaction could not begin or commit: {@code
 *       STORE_FAILURE}; counted as a breaker failure
 *   <li>integrity violations ({@link org.springframework.dao.DuplicateKeyException} and friends)
 *       and application exceptions: rethrown unchanged after rollback; the store answered, so they
 *       count as a success
 * </ul>
 */
public final class StoreExecutor {

    private static final Logger log = LoggerFactory.getLogger(StoreExecutor.class);

    private record Plumbing(JdbcTemplate jdbc, TransactionTemplate writes, TransactionTemplate reads) {}

    private static final Map<String, String> WRITE_ATTRIBUTES = Map.of("store.tx", "read-write");
    private static final Map<String, String> READ_ATTRIBUTES = Map.of("store.tx", "read-only");

    private final ConnectionPool pool;
    private final StoreCircuitBreaker breaker;
    private final SpanHelper spans;
    private final OneTimeInitializer<Plumbing> plumbing;

    public StoreExecutor(ConnectionPool pool, StoreCircuitBreaker breaker) {
        this(pool, breaker, SpanHelper.noop());
    }

    public StoreExecutor(ConnectionPool pool, StoreCircuitBreaker breaker, SpanHelper spans) {
        if (pool == null || breaker == null || spans == null) {
            throw new IllegalArgumentException("pool, breaker and spans must not be null");
        }
        this.pool = pool;
        this.breaker = breaker;
        this.spans = spans;
        this.plumbing = new OneTimeInitializer<>(this::createPlumbing);
    }

    /**
     * Builds a store breaker that counts {@code STORE_FAILURE} against the store and ignores local
     * rejections ({@code POOL_EXHAUSTED}, {@code CIRCUIT_OPEN}).
     */
    public static StoreCircuitBreaker circuitBreaker(String name, CircuitBreakerSettings settings) {
        return new StoreCircuitBreaker(
                name, settings, StoreExecutor::countsAsFailure, StoreExecutor::isLocalRejection);
    }

    /** Runs {@code work} in a read-write transaction; any exception rolls it back. */
    public <T> T inTransaction(Function<JdbcTemplate, T> work) {
        return spans.inSpan("bastion.store.write", WRITE_ATTRIBUTES, () -> run(false, work));
    }

    /** Runs {@code work} in a read-only transaction. */
    public <T> T readOnly(Function<JdbcTemplate, T> work) {
        return spans.inSpan("bastion.store.read", READ_ATTRIBUTES, () -> run(true, work));
    }

    public StoreCircuitBreaker breaker() {
        return breaker;
    }

    public ConnectionPool pool() {
        return pool;
    }

    private <T> T run(boolean readOnly, Function<JdbcTemplate, T> work) {
        Plumbing p = plumbing.get();
        TransactionTemplate transaction = readOnly ? p.reads() : p.writes();
        try {
            return breaker.execute(() -> transaction.execute(status -> work.apply(p.jdbc())));
        } catch (RuntimeException e) {
            RuntimeException translated = translate(e);
            if (translated != e) {
                log.warn("Store call failed: {}", translated.getMessage());
            }
            throw translated;
        }
    }

    static boolean countsAsFailure(Throwable t) {
        return reasonOf(t) == StoreUnavailableException.Reason.STORE_FAILURE;
    }

    static boolean isLocalRejection(Throwable t) {
        StoreUnavailableException.Reason reason = reasonOf(t);
        return reason == StoreUnavailableException.Reason.POOL_EXHAUSTED
                || reason == StoreUnavailableException.Reason.CIRCUIT_OPEN;
    }

    private static StoreUnavailableException.Reason reasonOf(Throwable t) {
        if (t instanceof RuntimeException e
                && translate(e) instanceof StoreUnavailableException unavailable) {
            return unavailable.reason();
        }
        return null;
    }

    /**
     * Maps an exception raised while running a unit of work onto the store-unavailable taxonomy.
     * Returns {@code e} itself when it is not an infrastructure failure.
     */
    static RuntimeException translate(RuntimeException e) {
        if (e instanceof StoreUnavailableException) {
            return e;
        }
        SQLTransientConnectionException checkout = findCause(e, SQLTransientConnectionException.class);
        if (checkout != null) {
            // HikariCP attaches the last connection failure as cause; none means plain saturation
            return checkout.getCause() == null
                    ? new StoreUnavailableException(
                            StoreUnavailableException.Reason.POOL_EXHAUSTED,
                            "No store connection available: " + checkout.getMessage(),
                            e)
                    : new StoreUnavailableException(
                            StoreUnavailableException.Reason.STORE_FAILURE,
                            "Store unreachable: " + checkout.getCause().getMessage(),
                            e);
        }
        if (e instanceof DataIntegrityViolationException) {
            return e;
        }
        if (e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessException
                || e instanceof CannotCreateTransactionException
                || e instanceof TransactionSystemException) {
            return new StoreUnavailableException(
                    StoreUnavailableException.Reason.STORE_FAILURE,
                    "Store failure: " + e.getMessage(),
                    e);
        }
        return e;
    }

    private static <X extends Throwable> X findCause(Throwable t, Class<X> type) {
        Throwable current = t;
        while (current != null) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    private Plumbing createPlumbing() {
        var dataSource = pool.dataSource();
        var transactionManager = new DataSourceTransactionManager(dataSource);

        var writes = new TransactionTemplate(transactionManager);
        writes.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);

        var reads = new TransactionTemplate(transactionManager);
        reads.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        reads.setReadOnly(true);

        return new Plumbing(new JdbcTemplate(dataSource), writes, reads);
    }
}
