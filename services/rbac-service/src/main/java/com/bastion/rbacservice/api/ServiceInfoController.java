package com.bastion.rbacservice.api;

import com.bastion.crypto.EncryptedFieldCodec;
import com.bastion.database.migration.SchemaMigrator;
import com.bastion.database.migration.SchemaMigrator.SchemaStatus;
import com.bastion.database.pool.ConnectionPool;
import com.bastion.database.pool.PoolStats;
import com.bastion.database.resilience.StoreCircuitBreaker;
import com.bastion.rbacservice.config.ServiceProperties;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and runtime information.
 *
 * <p>{@code /ping} touches nothing but the JVM. {@code /info} reports the store breaker, pool
 * occupancy and schema version, which is what an operator asks first when the RBAC endpoints answer 503.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ServiceProperties properties;
    private final EncryptedFieldCodec codec;
    private final StoreCircuitBreaker breaker;
    private final ConnectionPool pool;
    private final SchemaMigrator migrator;

    public ServiceInfoController(
            ServiceProperties properties,
            EncryptedFieldCodec codec,
            StoreCircuitBreaker breaker,
            ConnectionPool pool,
            SchemaMigrator migrator) {
        this.properties = properties;
        this.codec = codec;
        this.breaker = breaker;
        this.pool = pool;
        this.migrator = migrator;
    }

    @GetMapping("/ping")
    public Map<String, String> ping() {
        return Map.of("status", "ok", "timestamp", Instant.now().toString());
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("encryption", codec.isEnabled() ? "enabled" : "disabled");
        info.put("breaker", breaker.state().name());
        info.put("breakerFailures", breaker.failureCount());
        info.put("pool", poolInfo(pool.stats()));
        info.put("schemaVersion", schemaVersion());
        info.put("timestamp", Instant.now().toString());
        return info;
    }

    private static Map<String, Integer> poolInfo(PoolStats stats) {
        Map<String, Integer> shown = new LinkedHashMap<>();
        shown.put("active", stats.active());
        shown.put("idle", stats.idle());
        shown.put("total", stats.total());
        shown.put("waiting", stats.waiting());
        return shown;
    }

    private String schemaVersion() {
        SchemaStatus status = migrator.status();
        return status.currentVersion() != null ? status.currentVersion() : "none";
    }
}
