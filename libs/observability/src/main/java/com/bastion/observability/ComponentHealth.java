package com.bastion.observability;

/**
 * Health of a single component.
 *
 * @param name      component name (e.g. "store", "circuit-breaker")
 * @param status    component status
 * @param message   optional detail, e.g. the breaker state or the ping error
 * @param latencyMs time taken by the probe in milliseconds
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public static ComponentHealth healthy(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, latencyMs);
    }

    public static ComponentHealth degraded(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, latencyMs);
    }

    public static ComponentHealth unhealthy(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, latencyMs);
    }
}
