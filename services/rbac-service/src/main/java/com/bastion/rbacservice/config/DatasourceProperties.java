package com.bastion.rbacservice.config;

import com.bastion.database.pool.PoolSettings;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Backing-store connection and pool sizing, bound from {@code bastion.datasource.*}.
 *
 * @param url JDBC URL. Required.
 * @param username database user
 * @param password database password
 * @param baseSize connections kept open when idle (default 10)
 * @param maxOverflow extra connections allowed under load (default 20)
 * @param checkoutTimeout longest wait for a free connection (default 30s)
 * @param maxAge connection lifetime before recycling (default 300s)
 * @param validationTimeout longest liveness ping (default 5s)
 */
@ConfigurationProperties(prefix = "bastion.datasource")
@Validated
public record DatasourceProperties(
        @NotBlank String url,
        String username,
        String password,
        @Min(1) Integer baseSize,
        @Min(0) Integer maxOverflow,
        Duration checkoutTimeout,
        Duration maxAge,
        Duration validationTimeout) {

    public DatasourceProperties {
        if (baseSize == null) {
            baseSize = PoolSettings.DEFAULT_BASE_SIZE;
        }
        if (maxOverflow == null) {
            maxOverflow = PoolSettings.DEFAULT_MAX_OVERFLOW;
        }
    }

    public PoolSettings toPoolSettings() {
        return new PoolSettings(
                url,
                username,
                password,
                baseSize,
                maxOverflow,
                checkoutTimeout,
                maxAge,
                validationTimeout);
    }

    @Override
    public String toString() {
        return "DatasourceProperties[url=%s, username=%s, baseSize=%d, maxOverflow=%d]"
                .formatted(url, username, baseSize, maxOverflow);
    }
}
