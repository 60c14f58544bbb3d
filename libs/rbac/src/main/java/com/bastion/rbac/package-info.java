/**
 * Multi-tenant role-based access control.
 *
 * <p>{@link com.bastion.rbac.PermissionResolver} is the entry point. It validates identifiers,
 * encodes the sensitive ones, runs each call as one store transaction, and records mutations in
 * the audit trail within that transaction.
 */
package com.bastion.rbac;
