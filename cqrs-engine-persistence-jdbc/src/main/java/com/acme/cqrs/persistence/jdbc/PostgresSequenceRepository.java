package com.acme.cqrs.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PostgreSQL-specific counter store: one {@code INSERT ... ON CONFLICT DO UPDATE ... RETURNING}
 * creates or increments the row and returns the new value atomically.
 */
@Singleton
@Requires(property = "db.dialect", value = "POSTGRES")
public class PostgresSequenceRepository extends JdbcSequenceRepository {

    private static final Logger LOG = LoggerFactory.getLogger(PostgresSequenceRepository.class);

    public PostgresSequenceRepository(DataSource dataSource) {
        super(dataSource);
    }

    protected String getUpsertReturningSql() {
        return """
                INSERT INTO sequence_counter (scope_key, period, counter_value, updated_at)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (scope_key, period) DO UPDATE
                SET counter_value = sequence_counter.counter_value + EXCLUDED.counter_value,
                    updated_at = EXCLUDED.updated_at
                RETURNING counter_value
                """;
    }

    @Override
    @Transactional
    public long increment(String scopeKey, String period, long delta) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getUpsertReturningSql())) {
            ps.setString(1, scopeKey);
            ps.setString(2, period);
            ps.setLong(3, delta);
            ps.setTimestamp(4, Timestamp.from(Instant.now()));
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Counter upsert returned no row for " + scopeKey);
                }
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "increment sequence " + scopeKey, LOG);
        }
    }
}
