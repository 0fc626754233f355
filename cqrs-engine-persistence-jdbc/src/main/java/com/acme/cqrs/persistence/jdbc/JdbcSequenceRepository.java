package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.repository.SequenceRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of the counter store. The base increment locks the row with an
 * UPDATE, creates it when missing and reads the value back in the same transaction.
 */
public abstract class JdbcSequenceRepository implements SequenceRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcSequenceRepository.class);

    protected final DataSource dataSource;

    protected JdbcSequenceRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    protected String getIncrementSql() {
        return """
                UPDATE sequence_counter
                SET counter_value = counter_value + ?, updated_at = ?
                WHERE scope_key = ? AND period = ?
                """;
    }

    protected String getInsertSql() {
        return """
                INSERT INTO sequence_counter (scope_key, period, counter_value, updated_at)
                VALUES (?, ?, ?, ?)
                """;
    }

    protected String getCurrentSql() {
        return "SELECT counter_value FROM sequence_counter WHERE scope_key = ? AND period = ?";
    }

    @Override
    @Transactional
    public long increment(String scopeKey, String period, long delta) {
        try {
            long value = JdbcSupport.inTransaction(dataSource, conn -> {
                if (add(conn, scopeKey, period, delta) == 0) {
                    try {
                        create(conn, scopeKey, period, delta);
                        return delta;
                    } catch (SQLException e) {
                        if (!ExceptionTranslator.isUniqueViolation(e)) {
                            throw e;
                        }
                        // created concurrently, the row now exists
                        add(conn, scopeKey, period, delta);
                    }
                }
                return read(conn, scopeKey, period);
            });
            LOG.debug("Incremented counter {}/{} to {}", scopeKey, period, value);
            return value;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "increment sequence " + scopeKey, LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public long current(String scopeKey, String period) {
        try (Connection conn = dataSource.getConnection()) {
            return read(conn, scopeKey, period);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "read sequence " + scopeKey, LOG);
        }
    }

    private int add(Connection conn, String scopeKey, String period, long delta) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getIncrementSql())) {
            ps.setLong(1, delta);
            ps.setTimestamp(2, JdbcSupport.timestamp(Instant.now()));
            ps.setString(3, scopeKey);
            ps.setString(4, period);
            return ps.executeUpdate();
        }
    }

    private void create(Connection conn, String scopeKey, String period, long value) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getInsertSql())) {
            ps.setString(1, scopeKey);
            ps.setString(2, period);
            ps.setLong(3, value);
            ps.setTimestamp(4, JdbcSupport.timestamp(Instant.now()));
            ps.executeUpdate();
        }
    }

    private long read(Connection conn, String scopeKey, String period) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getCurrentSql())) {
            ps.setString(1, scopeKey);
            ps.setString(2, period);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }
}
