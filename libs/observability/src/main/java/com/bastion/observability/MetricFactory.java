package com.bastion.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;

/**
 * Creates Micrometer meters that all carry a {@code service} tag.
 * <p>
 * Tenant keys are never used as tags: they are unbounded and would explode cardinality.
 */
public final class MetricFactory {

    /** Tag key for the service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns (creating on first use) the counter {@code name} with the given extra tags.
     *
     * @param tags additional key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(tags(tags)).register(registry);
    }

    /** Returns (creating on first use) the timer {@code name}. */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(tags(tags)).register(registry);
    }

    /** Registers a gauge that samples {@code value} on every scrape. */
    public void gauge(String name, String description, Supplier<Number> value, String... tags) {
        Gauge.builder(name, value).description(description).tags(tags(tags)).register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String... extra) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        return extra.length > 0 ? tags.and(extra) : tags;
    }
}
