package com.bastion.rbacservice.config;

import com.bastion.database.resilience.CircuitBreakerSettings;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Store circuit breaker, bound from {@code bastion.breaker.*}.
 *
 * @param failureThreshold consecutive failures that open the breaker (default 3)
 * @param cooldown time spent open before a probe is allowed (default 30s)
 */
@ConfigurationProperties(prefix = "bastion.breaker")
@Validated
public record BreakerProperties(@Min(1) Integer failureThreshold, Duration cooldown) {

    public BreakerProperties {
        if (failureThreshold == null) {
            failureThreshold = CircuitBreakerSettings.DEFAULT_FAILURE_THRESHOLD;
        }
        if (cooldown == null) {
            cooldown = CircuitBreakerSettings.DEFAULT_COOLDOWN;
        }
    }

    public CircuitBreakerSettings toSettings() {
        return new CircuitBreakerSettings(failureThreshold, cooldown);
    }
}
