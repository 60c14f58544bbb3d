package com.bastion.observability;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate of all registered health checks.
 *
 * @param status     worst component status
 * @param components component results keyed by name, in registration order
 * @param checkedAt  when the checks ran
 */
public record HealthReport(HealthStatus status, Map<String, ComponentHealth> components, Instant checkedAt) {

    public HealthReport {
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
    }
}
