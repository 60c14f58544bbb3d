package com.bastion.rbac.audit;

import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.TenantKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.RowMapper;

/**
 * Appends audit entries for mutating role-graph calls.
 *
 * <p>{@link #record} writes through the {@link JdbcOperations} of the caller's unit of work, so
 * the entry commits or rolls back together with the mutation it documents. A failing insert
 * propagates and aborts the mutation.
 *
 * <p>Each entry is also written as one JSON line to the {@code bastion.audit} logger at the moment
 * it is recorded.
 */
public final class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);
    private static final Logger auditLog = LoggerFactory.getLogger("bastion.audit");

    private static final String INSERT_SQL =
            "INSERT INTO rbac_audit_log"
                    + " (tenant, action, entity_type, entity_id, details, correlation_id, created_at)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final String RECENT_SQL =
            "SELECT id, tenant, action, entity_type, entity_id, details, correlation_id, created_at"
                    + " FROM rbac_audit_log WHERE tenant = ? ORDER BY id DESC LIMIT ?";

    private static final RowMapper<AuditEntry> ROW_MAPPER =
            (rs, rowNum) ->
                    new AuditEntry(
                            rs.getLong("id"),
                            rs.getString("tenant"),
                            AuditAction.valueOf(rs.getString("action")),
                            rs.getString("entity_type"),
                            rs.getString("entity_id"),
                            rs.getString("details"),
                            rs.getString("correlation_id"),
                            rs.getObject("created_at", OffsetDateTime.class).toInstant());

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean enabled;

    public AuditRecorder(ObjectMapper objectMapper, Clock clock, boolean enabled) {
        if (objectMapper == null || clock == null) {
            throw new IllegalArgumentException("objectMapper and clock must not be null");
        }
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.enabled = enabled;
        if (!enabled) {
            log.warn("Audit recording is disabled; role-graph mutations leave no audit trail");
        }
    }

    /**
     * Appends one entry in the caller's transaction.
     *
     * @param jdbc operations bound to the caller's transaction
     * @param entityId stored (encoded) identifier of the entity
     * @param details call arguments and outcome, identifiers in stored form
     */
    public void record(
            JdbcOperations jdbc,
            TenantKey tenant,
            AuditAction action,
            String entityId,
            Map<String, ?> details) {
        if (!enabled) {
            return;
        }
        String correlationId = CorrelationContextHolder.currentCorrelationId();
        String detailsJson = toJson(details);
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);

        jdbc.update(
                INSERT_SQL,
                tenant.value(),
                action.name(),
                action.entityType(),
                entityId,
                detailsJson,
                correlationId,
                now);

        if (auditLog.isInfoEnabled()) {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put("type", "audit");
            line.put("tenant", tenant.value());
            line.put("action", action.name());
            line.put("entityType", action.entityType());
            line.put("entityId", entityId);
            line.put("correlationId", correlationId);
            line.put("timestamp", now.toInstant().toString());
            line.put("details", details);
            auditLog.info(toJson(line));
        }
    }

    /** Latest entries for {@code tenant}, newest first. */
    public List<AuditEntry> recent(JdbcOperations jdbc, TenantKey tenant, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return jdbc.query(RECENT_SQL, ROW_MAPPER, tenant.value(), limit);
    }

    public boolean isEnabled() {
        return enabled;
    }

    private String toJson(Map<String, ?> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize audit details", e);
        }
    }
}
