package com.bastion.observability;

/**
 * Identifiers that tie one RBAC call to its log lines and audit entry.
 * <p>
 * Established by the inbound adapter (HTTP filter, CLI, library caller) and pushed into
 * SLF4J MDC by {@link CorrelationContextHolder}. The audit recorder stores
 * {@link #correlationId()} next to every entry it writes.
 *
 * @param correlationId unique ID of the call chain, never blank
 * @param tenantKey     tenant the call is scoped to (nullable before the tenant is known)
 */
public record CorrelationContext(String correlationId, String tenantKey) {

    /** MDC key for the correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the tenant key. */
    public static final String MDC_TENANT = "tenant";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Returns a copy of this context scoped to {@code tenantKey}. */
    public CorrelationContext withTenant(String tenantKey) {
        return new CorrelationContext(correlationId, tenantKey);
    }
}
