package com.bastion.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named collection of {@link HealthCheck}s evaluated together.
 * <p>
 * Checks run sequentially on the calling thread; each one is expected to bound its own
 * latency (the store probe uses the pool's validation timeout). A check that throws
 * despite the contract is reported as unhealthy.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();

    /**
     * Registers {@code check} under {@code name}, replacing any previous check of that name.
     */
    public synchronized void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /** Removes the check registered under {@code name}. */
    public synchronized boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /** Runs every check and returns the aggregate; HEALTHY when nothing is registered. */
    public HealthReport checkAll() {
        Map<String, HealthCheck> snapshot;
        synchronized (this) {
            snapshot = new LinkedHashMap<>(checks);
        }
        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, HealthCheck> entry : snapshot.entrySet()) {
            ComponentHealth result;
            try {
                result = entry.getValue().check();
            } catch (RuntimeException e) {
                log.warn("Health check '{}' threw instead of reporting", entry.getKey(), e);
                result = ComponentHealth.unhealthy(entry.getKey(), e.getMessage(), 0);
            }
            results.put(entry.getKey(), result);
            overall = overall.worst(result.status());
        }
        return new HealthReport(overall, results, Instant.now());
    }

    public synchronized int size() {
        return checks.size();
    }
}
