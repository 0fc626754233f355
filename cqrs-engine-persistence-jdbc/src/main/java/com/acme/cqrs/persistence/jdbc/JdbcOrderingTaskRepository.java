package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.ordering.OrderingState;
import com.acme.cqrs.ordering.OrderingTask;
import com.acme.cqrs.ordering.PipelineSignal;
import com.acme.cqrs.persistence.jdbc.mapper.OrderingTaskMapper;
import com.acme.cqrs.repository.OrderingTaskRepository;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of the ordering task store. State changes are conditional
 * UPDATEs on the current state, so only one caller wins each transition.
 */
public abstract class JdbcOrderingTaskRepository implements OrderingTaskRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcOrderingTaskRepository.class);

    private static final String SELECT = "SELECT " + OrderingTaskMapper.COLUMNS + " FROM ordering_task ";

    protected final DataSource dataSource;

    protected JdbcOrderingTaskRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /** Insert of every mapped column; a dialect may return 0 rows for an existing key. */
    protected abstract String getInsertSql();

    protected String getFindSql() {
        return SELECT + "WHERE pk = ? AND sk = ? AND version = ?";
    }

    protected String getFindByTokenSql() {
        return SELECT + "WHERE callback_token = ?";
    }

    protected String getFindLatestSql() {
        return SELECT + "WHERE pk = ? AND sk = ? ORDER BY version DESC LIMIT 1";
    }

    protected String getTransitionSql(int fromStates) {
        String placeholders = String.join(", ", Collections.nCopies(fromStates, "?"));
        return """
                UPDATE ordering_task
                SET state = ?, error = COALESCE(?, error), updated_at = ?
                WHERE pk = ? AND sk = ? AND version = ? AND state IN (%s)
                """.formatted(placeholders);
    }

    protected String getRecordSignalSql() {
        return """
                UPDATE ordering_task
                SET signal_type = ?, signal_payload = ?, updated_at = ?
                WHERE callback_token = ? AND signal_type IS NULL
                """;
    }

    protected String getFindWaitingPastDeadlineSql() {
        return SELECT + """
                WHERE state = 'WAITING_FOR_PREDECESSOR' AND deadline < ?
                ORDER BY deadline, version
                LIMIT ?
                """;
    }

    protected String getFindRunningUpdatedBeforeSql() {
        return SELECT + """
                WHERE state IN ('MATERIALIZING', 'NOTIFYING') AND updated_at < ?
                ORDER BY updated_at
                LIMIT ?
                """;
    }

    @Override
    @Transactional
    public boolean insertIfAbsent(OrderingTask task) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertSql())) {
            OrderingTaskMapper.bindInsert(ps, task);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                LOG.debug("Ordering task already exists: {} version={}", task.aggregateKey(), task.version());
                return false;
            }
            throw ExceptionTranslator.translateException(e, "insert ordering task", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderingTask> find(AggregateKey aggregateKey, int version) {
        return queryOne(getFindSql(), "find ordering task",
                aggregateKey.partitionKey(), aggregateKey.sortKey(), version);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderingTask> findByToken(String callbackToken) {
        return queryOne(getFindByTokenSql(), "find ordering task by token", callbackToken);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderingTask> findLatest(AggregateKey aggregateKey) {
        return queryOne(getFindLatestSql(), "find latest ordering task",
                aggregateKey.partitionKey(), aggregateKey.sortKey());
    }

    @Override
    @Transactional
    public boolean transition(
            AggregateKey aggregateKey,
            int version,
            Set<OrderingState> from,
            OrderingState to,
            String error,
            Instant at) {
        if (from.isEmpty()) {
            return false;
        }
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getTransitionSql(from.size()))) {
            int i = 1;
            ps.setString(i++, to.name());
            ps.setString(i++, error);
            ps.setTimestamp(i++, JdbcSupport.timestamp(at));
            ps.setString(i++, aggregateKey.partitionKey());
            ps.setString(i++, aggregateKey.sortKey());
            ps.setInt(i++, version);
            for (OrderingState state : from) {
                ps.setString(i++, state.name());
            }
            boolean won = ps.executeUpdate() > 0;
            if (won) {
                LOG.debug("Ordering task {} version={} -> {}", aggregateKey, version, to);
            }
            return won;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "transition ordering task", LOG);
        }
    }

    @Override
    @Transactional
    public Optional<OrderingTask> recordSignal(
            String callbackToken, PipelineSignal signal, String payload, Instant at) {
        try {
            return JdbcSupport.inTransaction(dataSource, conn -> {
                try (PreparedStatement ps = conn.prepareStatement(getRecordSignalSql())) {
                    ps.setString(1, signal.name());
                    ps.setString(2, payload);
                    ps.setTimestamp(3, JdbcSupport.timestamp(at));
                    ps.setString(4, callbackToken);
                    if (ps.executeUpdate() == 0) {
                        LOG.debug("Signal {} not recorded, token already signalled or unknown", signal);
                    }
                }
                List<OrderingTask> tasks = query(conn, getFindByTokenSql(), callbackToken);
                return tasks.stream().findFirst();
            });
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "record pipeline signal", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderingTask> findWaitingPastDeadline(Instant now, int limit) {
        return queryList(getFindWaitingPastDeadlineSql(), "find expired waiting tasks",
                JdbcSupport.timestamp(now), limit);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderingTask> findRunningUpdatedBefore(Instant cutoff, int limit) {
        return queryList(getFindRunningUpdatedBeforeSql(), "find stalled running tasks",
                JdbcSupport.timestamp(cutoff), limit);
    }

    private Optional<OrderingTask> queryOne(String sql, String operation, Object... params) {
        return queryList(sql, operation, params).stream().findFirst();
    }

    private List<OrderingTask> queryList(String sql, String operation, Object... params) {
        try (Connection conn = dataSource.getConnection()) {
            return query(conn, sql, params);
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }

    private static List<OrderingTask> query(Connection conn, String sql, Object... params) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            List<OrderingTask> tasks = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tasks.add(OrderingTaskMapper.map(rs));
                }
            }
            return tasks;
        }
    }
}
