package com.acme.cqrs.processor.config;

import com.zaxxer.hikari.HikariDataSource;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import java.sql.SQLException;
import java.util.Locale;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the Flyway migrations of the configured dialect ({@code db/migration/h2} or
 * {@code db/migration/postgres}) while the context starts, before any store is used.
 */
@Context
@Requires(property = "db.dialect")
@Requires(property = "flyway.enabled", notEquals = "false")
public class SchemaMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaMigrator.class);

    private final MigrateResult result;

    public SchemaMigrator(DataSource dataSource, @Property(name = "db.dialect") String dialect) {
        String location = "classpath:db/migration/" + dialect.toLowerCase(Locale.ROOT);
        LOG.info("Migrating schema from {}", location);
        result = Flyway.configure()
                .dataSource(target(dataSource))
                .locations(location)
                .load()
                .migrate();
        LOG.info("Schema migrated: {} migration(s) applied, version={}",
                result.migrationsExecuted, result.targetSchemaVersion);
    }

    public MigrateResult getResult() {
        return result;
    }

    // Flyway opens its own connections outside any managed transaction
    private static DataSource target(DataSource dataSource) {
        try {
            return dataSource.isWrapperFor(HikariDataSource.class)
                    ? dataSource.unwrap(HikariDataSource.class)
                    : dataSource;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot unwrap data source for migration", e);
        }
    }
}
