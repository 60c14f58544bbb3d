package com.bastion.rbacservice.infrastructure.health;

import com.bastion.observability.ComponentHealth;
import com.bastion.observability.HealthCheckRegistry;
import com.bastion.observability.HealthReport;
import com.bastion.observability.HealthStatus;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Publishes the {@link HealthCheckRegistry} (store ping, circuit breaker) under {@code
 * /actuator/health/store}.
 *
 * <p>HEALTHY maps to UP, DEGRADED (half-open breaker) to UP with details, UNHEALTHY to DOWN.
 */
@Component("store")
public class StoreHealthIndicator implements HealthIndicator {

    private final HealthCheckRegistry registry;

    public StoreHealthIndicator(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        HealthReport report = registry.checkAll();
        Status status = report.status() == HealthStatus.UNHEALTHY ? Status.DOWN : Status.UP;
        Health.Builder builder = new Health.Builder(status);
        builder.withDetail("status", report.status().name());
        for (Map.Entry<String, ComponentHealth> entry : report.components().entrySet()) {
            ComponentHealth component = entry.getValue();
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("status", component.status().name());
            detail.put("latencyMs", component.latencyMs());
            if (component.message() != null) {
                detail.put("message", component.message());
            }
            builder.withDetail(entry.getKey(), detail);
        }
        return builder.build();
    }
}
