package com.bastion.rbac.audit;

import java.time.Instant;

/**
 * One row of the audit trail.
 *
 * <p>{@code entityId} and {@code details} hold identifiers in their stored form: when field
 * encryption is on, user identifiers and permission names appear as ciphertext.
 *
 * @param id surrogate key, increasing in insertion order
 * @param tenant owning tenant
 * @param action what was done
 * @param entityType kind of entity ("role", "permission", "membership")
 * @param entityId stored identifier of the entity
 * @param details JSON object with the call's arguments and result
 * @param correlationId request correlation ID (null outside a request)
 * @param createdAt when the entry was written
 */
public record AuditEntry(
        long id,
        String tenant,
        AuditAction action,
        String entityType,
        String entityId,
        String details,
        String correlationId,
        Instant createdAt) {}
