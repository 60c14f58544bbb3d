package com.bastion.rbac.model;

/**
 * A role as listed to callers.
 *
 * @param name role name, unique per tenant
 * @param description free-text description (null if none)
 */
public record RoleDefinition(String name, String description) {}
