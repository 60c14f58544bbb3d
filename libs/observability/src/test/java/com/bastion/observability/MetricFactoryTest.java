package com.bastion.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricFactory metrics = new MetricFactory(registry, "bastion-rbac");

    @Test
    @DisplayName("counters carry the service tag and extra tags")
    void counterTags() {
        metrics.counter("bastion.rbac.mutations", "mutations", "action", "CREATE_ROLE").increment();

        var counter = registry.get("bastion.rbac.mutations")
                .tag(MetricFactory.TAG_SERVICE, "bastion-rbac")
                .tag("action", "CREATE_ROLE")
                .counter();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("the same name and tags return the same counter")
    void countersAreShared() {
        metrics.counter("c", "d", "k", "v").increment();
        metrics.counter("c", "d", "k", "v").increment();
        assertThat(registry.get("c").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("gauges sample their supplier")
    void gaugeSamples() {
        AtomicInteger state = new AtomicInteger(0);
        metrics.gauge("bastion.store.breaker.state", "state", state::get);
        state.set(2);
        assertThat(registry.get("bastion.store.breaker.state").gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("rejects a null registry or blank service name")
    void rejectsInvalid() {
        assertThatThrownBy(() -> new MetricFactory(null, "s")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MetricFactory(registry, " ")).isInstanceOf(IllegalArgumentException.class);
    }
}
