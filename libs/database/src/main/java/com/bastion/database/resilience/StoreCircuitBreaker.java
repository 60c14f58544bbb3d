package com.bastion.database.resilience;

import com.bastion.database.StoreUnavailableException;
import com.bastion.observability.ComponentHealth;
import com.bastion.observability.MetricFactory;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resilience4j circuit breaker in front of the backing store.
 *
 * <p>The breaker counts over a window of the last {@code failureThreshold} calls and opens when
 * all of them failed, so {@code failureThreshold} consecutive failures open it. After the cooldown
 * the next call is admitted as the single half-open probe; its outcome closes or re-opens the
 * breaker.
 *
 * <p>Rejected calls surface as {@link StoreUnavailableException} with {@link
 * StoreUnavailableException.Reason#CIRCUIT_OPEN} and the remaining cooldown as retry-after.
 */
public final class StoreCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(StoreCircuitBreaker.class);

    private final CircuitBreaker delegate;
    private final CircuitBreakerSettings settings;
    private volatile Instant openedAt;

    /**
     * @param countsAsFailure exceptions that count against the store
     * @param ignored exceptions that neither count nor reset, such as a local pool rejection;
     *     everything else means the store answered
     */
    public StoreCircuitBreaker(
            String name,
            CircuitBreakerSettings settings,
            Predicate<Throwable> countsAsFailure,
            Predicate<Throwable> ignored) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (settings == null || countsAsFailure == null || ignored == null) {
            throw new IllegalArgumentException("settings and predicates must not be null");
        }
        this.settings = settings;
        this.delegate = CircuitBreaker.of(name, toConfig(settings, countsAsFailure, ignored));
        this.delegate.getEventPublisher().onStateTransition(event -> {
            CircuitBreaker.State from = event.getStateTransition().getFromState();
            CircuitBreaker.State to = event.getStateTransition().getToState();
            if (to == CircuitBreaker.State.OPEN) {
                openedAt = Instant.now();
                log.warn(
                        "Circuit breaker '{}' {} -> OPEN; failing fast for {}",
                        name,
                        from,
                        settings.cooldown());
            } else {
                log.info("Circuit breaker '{}' {} -> {}", name, from, to);
            }
        });
    }

    static CircuitBreakerConfig toConfig(
            CircuitBreakerSettings settings,
            Predicate<Throwable> countsAsFailure,
            Predicate<Throwable> ignored) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.failureThreshold())
                .minimumNumberOfCalls(settings.failureThreshold())
                .failureRateThreshold(100)
                .waitDurationInOpenState(settings.cooldown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordException(countsAsFailure)
                .ignoreException(ignored)
                .build();
    }

    /**
     * Runs {@code call} through the breaker.
     *
     * @throws StoreUnavailableException if the breaker rejects the call
     */
    public <T> T execute(Supplier<T> call) {
        try {
            return delegate.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            throw rejected(e);
        }
    }

    public CircuitBreaker.State state() {
        return delegate.getState();
    }

    /** Failed calls in the current window. */
    public int failureCount() {
        return delegate.getMetrics().getNumberOfFailedCalls();
    }

    /** When the breaker last opened, or {@code null} if it never has. */
    public Instant openedAt() {
        return openedAt;
    }

    public CircuitBreakerSettings settings() {
        return settings;
    }

    public String name() {
        return delegate.getName();
    }

    /** The underlying Resilience4j breaker. */
    public CircuitBreaker delegate() {
        return delegate;
    }

    /** Health view: CLOSED is healthy, HALF_OPEN degraded, OPEN unhealthy. */
    public ComponentHealth health() {
        CircuitBreaker.State state = state();
        String message = "%s (%d/%d failures)"
                .formatted(state, failureCount(), settings.failureThreshold());
        return switch (stateCode(state)) {
            case 0 -> ComponentHealth.healthy("circuit-breaker", 0);
            case 1 -> ComponentHealth.degraded("circuit-breaker", message, 0);
            default -> ComponentHealth.unhealthy("circuit-breaker", message, 0);
        };
    }

    /**
     * Publishes the state as a gauge {@code bastion.store.breaker.state} (0 closed, 1 half-open,
     * 2 open).
     */
    public void bindTo(MetricFactory metrics) {
        metrics.gauge(
                "bastion.store.breaker.state",
                "Circuit breaker state: 0 closed, 1 half-open, 2 open",
                () -> stateCode(state()),
                "breaker",
                name());
    }

    private static int stateCode(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED, DISABLED, METRICS_ONLY -> 0;
            case HALF_OPEN -> 1;
            case OPEN, FORCED_OPEN -> 2;
        };
    }

    private StoreUnavailableException rejected(CallNotPermittedException cause) {
        CircuitBreaker.State state = state();
        return new StoreUnavailableException(
                StoreUnavailableException.Reason.CIRCUIT_OPEN,
                "Circuit breaker '%s' is %s; store calls are failing fast".formatted(name(), state),
                cause,
                state == CircuitBreaker.State.HALF_OPEN ? Duration.ZERO : remainingCooldown());
    }

    private Duration remainingCooldown() {
        Instant opened = openedAt;
        if (opened == null) {
            return settings.cooldown();
        }
        Duration remaining = settings.cooldown().minus(Duration.between(opened, Instant.now()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
