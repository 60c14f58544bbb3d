package com.bastion.observability;

/**
 * Health of one dependency, or of the service as a whole.
 */
public enum HealthStatus {

    /** Serving normally. */
    HEALTHY,

    /** Serving, but recovering (e.g. a circuit breaker probing in half-open state). */
    DEGRADED,

    /** Not serving: calls fail fast or time out. */
    UNHEALTHY;

    /** Returns the worse of this status and {@code other}. */
    public HealthStatus worst(HealthStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
