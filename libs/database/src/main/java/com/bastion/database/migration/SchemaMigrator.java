package com.bastion.database.migration;

import java.util.Arrays;
import java.util.List;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies and reports the versioned schema of the backing store, using Flyway.
 *
 * <p>This is a POJO (no Spring annotations): the service wires it against the pooled data source,
 * and tests point it at an in-memory H2 database.
 */
public final class SchemaMigrator {

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    /** Flyway history table used by every Bastion schema. */
    public static final String HISTORY_TABLE = "bastion_schema_history";

    /**
     * One applied migration.
     *
     * @param version migration version (e.g., "1")
     * @param description migration description (e.g., "rbac schema")
     * @param state Flyway state name (e.g., "SUCCESS")
     * @param installedOn ISO-8601 timestamp of when the migration was applied
     */
    public record AppliedMigration(
            String version, String description, String state, String installedOn) {}

    /**
     * Overall schema status.
     *
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version (null if no migrations applied)
     */
    public record SchemaStatus(int appliedMigrations, int pendingMigrations, String currentVersion) {

        public boolean upToDate() {
            return pendingMigrations == 0;
        }
    }

    private final Flyway flyway;

    /**
     * @param dataSource store to migrate
     * @param locations Flyway locations, e.g. {@code classpath:db/migration/bastion}
     */
    public SchemaMigrator(DataSource dataSource, String... locations) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        if (locations == null || locations.length == 0) {
            throw new IllegalArgumentException("at least one migration location is required");
        }
        this.flyway =
                Flyway.configure()
                        .dataSource(dataSource)
                        .locations(locations)
                        .table(HISTORY_TABLE)
                        .load();
    }

    /**
     * Applies pending migrations.
     *
     * @return number of migrations executed by this call
     */
    public int migrate() {
        MigrateResult result = flyway.migrate();
        log.info(
                "Schema migrated: {} migration(s) executed, now at version {}",
                result.migrationsExecuted,
                result.targetSchemaVersion);
        return result.migrationsExecuted;
    }

    public SchemaStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        return new SchemaStatus(
                info.applied().length,
                info.pending().length,
                current != null && current.getVersion() != null
                        ? current.getVersion().getVersion()
                        : null);
    }

    /** Applied migrations, oldest first. */
    public List<AppliedMigration> history() {
        return Arrays.stream(flyway.info().applied())
                .map(
                        m ->
                                new AppliedMigration(
                                        m.getVersion() != null ? m.getVersion().getVersion() : null,
                                        m.getDescription(),
                                        m.getState().name(),
                                        m.getInstalledOn() != null
                                                ? m.getInstalledOn().toInstant().toString()
                                                : null))
                .toList();
    }
}
