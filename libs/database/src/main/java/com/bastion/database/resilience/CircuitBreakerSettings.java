package com.bastion.database.resilience;

import java.time.Duration;

/**
 * @param failureThreshold consecutive failures that open the breaker
 * @param cooldown time spent open before a probe is allowed
 */
public record CircuitBreakerSettings(int failureThreshold, Duration cooldown) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(30);

    public CircuitBreakerSettings {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        if (cooldown == null) {
            cooldown = DEFAULT_COOLDOWN;
        }
        if (cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive");
        }
    }

    public static CircuitBreakerSettings defaults() {
        return new CircuitBreakerSettings(DEFAULT_FAILURE_THRESHOLD, DEFAULT_COOLDOWN);
    }
}
