package com.bastion.rbac.audit;

/** Mutating operations that leave an audit entry. */
public enum AuditAction {
    CREATE_ROLE("role"),
    DELETE_ROLE("role"),
    ADD_PERMISSION("permission"),
    REMOVE_PERMISSION("permission"),
    ADD_MEMBERSHIP("membership"),
    REMOVE_MEMBERSHIP("membership");

    private final String entityType;

    AuditAction(String entityType) {
        this.entityType = entityType;
    }

    /** Kind of entity the action touches, stored in {@code entity_type}. */
    public String entityType() {
        return entityType;
    }
}
