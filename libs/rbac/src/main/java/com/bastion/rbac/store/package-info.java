/**
 * Persistence of the role graph.
 *
 * <p>Four tables, one row per association, keyed by tenant. See {@code
 * db/migration/bastion/V1__rbac_schema.sql}.
 */
package com.bastion.rbac.store;
