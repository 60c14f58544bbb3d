package com.bastion.rbacservice.config;

import com.bastion.database.StoreExecutor;
import com.bastion.database.migration.SchemaMigrator;
import com.bastion.database.pool.ConnectionPool;
import com.bastion.database.resilience.StoreCircuitBreaker;
import com.bastion.observability.HealthCheckRegistry;
import com.bastion.observability.MetricFactory;
import com.bastion.observability.SensitiveDataRedactor;
import com.bastion.observability.SpanHelper;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the backing-store stack: one connection pool per process, the circuit breaker in front
 * of it, the transactional executor, and the schema migration that must finish before anything
 * else touches the store.
 */
@Configuration(proxyBeanMethods = false)
public class StoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StoreConfiguration.class);

    /** Flyway location of the RBAC schema. */
    public static final String MIGRATION_LOCATION = "classpath:db/migration/bastion";

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SpanHelper spanHelper(ServiceProperties service) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(service.name()));
    }

    @Bean(destroyMethod = "close")
    public ConnectionPool connectionPool(DatasourceProperties datasource) {
        Map<String, Object> shown = new LinkedHashMap<>();
        shown.put("url", datasource.url());
        shown.put("username", datasource.username());
        shown.put("password", datasource.password());
        shown.put("baseSize", datasource.baseSize());
        shown.put("maxOverflow", datasource.maxOverflow());
        log.info("Store connection settings: {}", new SensitiveDataRedactor().redact(shown));
        return new ConnectionPool("bastion-store", datasource.toPoolSettings());
    }

    @Bean
    public StoreCircuitBreaker storeCircuitBreaker(BreakerProperties breaker, MetricFactory metrics) {
        StoreCircuitBreaker circuitBreaker = StoreExecutor.circuitBreaker("store", breaker.toSettings());
        circuitBreaker.bindTo(metrics);
        return circuitBreaker;
    }

    @Bean
    public SchemaMigrator schemaMigrator(ConnectionPool pool) {
        SchemaMigrator migrator = new SchemaMigrator(pool.dataSource(), MIGRATION_LOCATION);
        migrator.migrate();
        return migrator;
    }

    @Bean
    public StoreExecutor storeExecutor(
            ConnectionPool pool,
            StoreCircuitBreaker breaker,
            SpanHelper spans,
            SchemaMigrator schemaMigrator) {
        // schemaMigrator is a parameter so the schema is current before the first unit of work
        return new StoreExecutor(pool, breaker, spans);
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(ConnectionPool pool, StoreCircuitBreaker breaker) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register("store", pool::ping);
        registry.register("circuit-breaker", breaker::health);
        return registry;
    }
}
