package com.bastion.observability;

/**
 * A cheap, synchronous probe of one dependency.
 * <p>
 * Implementations must not throw; failures are reported as
 * {@link HealthStatus#UNHEALTHY} results.
 */
@FunctionalInterface
public interface HealthCheck {

    ComponentHealth check();
}
