/**
 * Flyway-based schema migrations.
 *
 * <p>Scripts live under {@code db/migration/<schema>} on the classpath and are portable between
 * PostgreSQL and H2 (PostgreSQL mode).
 */
package com.bastion.database.migration;
