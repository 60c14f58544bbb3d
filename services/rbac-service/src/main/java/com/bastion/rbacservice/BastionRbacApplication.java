package com.bastion.rbacservice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Bastion RBAC service.
 *
 * <p>Serves the tenant-scoped role graph over HTTP under {@code /api/v1/tenants/{tenant}}. The
 * store stack (pool, circuit breaker, migrations, encryption guard) is built by {@link
 * com.bastion.rbacservice.config.StoreConfiguration} rather than by Spring Boot's data-source and
 * Flyway auto-configuration, which are excluded.
 *
 * <p>Start-up fails when:
 *
 * <ul>
 *   <li>configuration does not validate (e.g. encryption enabled without a secret)
 *   <li>the schema cannot be migrated
 *   <li>the store was written under a different encryption mode or key
 * </ul>
 */
@SpringBootApplication(
        exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@ConfigurationPropertiesScan
public class BastionRbacApplication {

    private static final Logger log = LoggerFactory.getLogger(BastionRbacApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BastionRbacApplication.class, args);
        log.info("Bastion RBAC service started");
    }
}
