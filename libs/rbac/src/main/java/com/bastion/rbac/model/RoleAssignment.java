package com.bastion.rbac.model;

/**
 * One (user, role) membership, as returned by reverse permission lookups.
 *
 * <p>A user holding a permission through two roles appears as two assignments.
 */
public record RoleAssignment(String user, String role) {}
