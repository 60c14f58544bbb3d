package com.bastion.rbacservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code bastion.service.*}.
 *
 * @param name service name used for logging and the metrics {@code service} tag. Required.
 * @param environment deployment environment (development, staging, production)
 */
@ConfigurationProperties(prefix = "bastion.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
