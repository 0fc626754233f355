package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.CommandStatus;
import com.acme.cqrs.persistence.jdbc.mapper.CommandRecordMapper;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.QueryOrder;
import com.acme.cqrs.repository.SortKeyFilter;
import com.acme.cqrs.stream.ChangeEvent;
import com.acme.cqrs.stream.ChangeEventType;
import com.acme.cqrs.stream.ChangeStreamEntry;
import com.acme.cqrs.stream.ChangeStreamSource;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of the commands store using Template Method pattern. Every insert
 * appends a row to {@code command_change_log} in the same transaction; that log is the change
 * stream this repository also serves, and acknowledging an entry deletes its row. Status updates
 * are not logged. Subclasses override database-specific SQL methods.
 */
public abstract class JdbcCommandRepository implements CommandRepository, ChangeStreamSource {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcCommandRepository.class);

    protected final DataSource dataSource;

    protected JdbcCommandRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /** Insert of every mapped column; a dialect may return 0 rows for an existing key. */
    protected abstract String getInsertSql();

    protected String getInsertChangeSql() {
        return """
                INSERT INTO command_change_log (event_type, pk, sk, created_at)
                VALUES (?, ?, ?, ?)
                """;
    }

    protected String getFindSql() {
        return "SELECT " + CommandRecordMapper.COLUMNS + " FROM command_record WHERE pk = ? AND sk = ?";
    }

    protected String getFindLatestSql() {
        return "SELECT " + CommandRecordMapper.COLUMNS + """
                 FROM command_record
                WHERE pk = ? AND unversioned_sk = ?
                ORDER BY version DESC
                LIMIT 1
                """;
    }

    protected String getFindVersionsSql() {
        return "SELECT " + CommandRecordMapper.COLUMNS + """
                 FROM command_record
                WHERE pk = ? AND unversioned_sk = ?
                ORDER BY version ASC
                """;
    }

    protected String getQueryByPartitionSql(SortKeyFilter filter, QueryOrder order) {
        return "SELECT " + CommandRecordMapper.COLUMNS + " FROM command_record WHERE pk = ?"
                + JdbcSupport.sortKeyCondition(filter) + JdbcSupport.orderBy(order) + " LIMIT ?";
    }

    protected String getUpdateStatusSql() {
        return """
                UPDATE command_record
                SET status = ?, callback_token = ?
                WHERE pk = ? AND sk = ?
                """;
    }

    protected String getPollSql() {
        return "SELECT l.id AS change_id, l.event_type AS change_type, "
                + CommandRecordMapper.COLUMNS.replaceAll("(\\w+)", "r.$1") + """
                 FROM command_change_log l
                JOIN command_record r ON r.pk = l.pk AND r.sk = l.sk
                ORDER BY l.id
                LIMIT ?
                """;
    }

    protected String getAcknowledgeSql() {
        return "DELETE FROM command_change_log WHERE id = ?";
    }

    @Override
    @Transactional
    public boolean insertIfAbsent(CommandRecord record) {
        try {
            return JdbcSupport.inTransaction(dataSource, conn -> {
                try (PreparedStatement ps = conn.prepareStatement(getInsertSql())) {
                    CommandRecordMapper.bindInsert(ps, record);
                    if (ps.executeUpdate() == 0) {
                        return false;
                    }
                }
                appendInsert(conn, record.getPartitionKey(), record.getSortKey());
                LOG.debug("Inserted command record {}/{}", record.getPartitionKey(), record.getSortKey());
                return true;
            });
        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e)) {
                LOG.debug("Command key already taken: {}/{}", record.getPartitionKey(), record.getSortKey());
                return false;
            }
            throw ExceptionTranslator.translateException(e, "insert command record", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CommandRecord> find(AggregateKey commandKey) {
        List<CommandRecord> found = query(getFindSql(), "find command record",
                commandKey.partitionKey(), commandKey.sortKey());
        return found.stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CommandRecord> findLatest(AggregateKey aggregateKey) {
        List<CommandRecord> found = query(getFindLatestSql(), "find latest command record",
                aggregateKey.partitionKey(), aggregateKey.sortKey());
        return found.stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public List<CommandRecord> findVersions(AggregateKey aggregateKey) {
        return query(getFindVersionsSql(), "find command versions",
                aggregateKey.partitionKey(), aggregateKey.sortKey());
    }

    @Override
    @Transactional(readOnly = true)
    public List<CommandRecord> queryByPartition(
            String partitionKey, SortKeyFilter filter, int limit, QueryOrder order) {
        List<Object> params = new ArrayList<>();
        params.add(partitionKey);
        if (filter.operator() != SortKeyFilter.Operator.ANY) {
            params.add(JdbcSupport.sortKeyParameter(filter));
        }
        params.add(limit);
        return query(getQueryByPartitionSql(filter, order), "query command partition", params.toArray());
    }

    @Override
    @Transactional
    public boolean updateStatus(AggregateKey commandKey, CommandStatus status, String callbackToken) {
        try {
            return JdbcSupport.inTransaction(dataSource, conn -> {
                try (PreparedStatement ps = conn.prepareStatement(getUpdateStatusSql())) {
                    ps.setString(1, status.name());
                    ps.setString(2, callbackToken);
                    ps.setString(3, commandKey.partitionKey());
                    ps.setString(4, commandKey.sortKey());
                    return ps.executeUpdate() > 0;
                }
            });
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update command status", LOG);
        }
    }

    /** Unacknowledged change-log rows joined to the current state of their command. */
    @Override
    @Transactional(readOnly = true)
    public List<ChangeStreamEntry> poll(int limit) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getPollSql())) {
            ps.setInt(1, limit);
            List<ChangeStreamEntry> entries = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ChangeEventType type = ChangeEventType.valueOf(rs.getString("change_type"));
                    CommandRecord record = CommandRecordMapper.map(rs);
                    entries.add(new ChangeStreamEntry(rs.getLong("change_id"),
                            new ChangeEvent(type, record, null)));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "poll command change log", LOG);
        }
    }

    @Override
    @Transactional
    public void acknowledge(long entryId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getAcknowledgeSql())) {
            ps.setLong(1, entryId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "acknowledge change entry " + entryId, LOG);
        }
    }

    private void appendInsert(Connection conn, String pk, String sk) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getInsertChangeSql())) {
            ps.setString(1, ChangeEventType.INSERT.name());
            ps.setString(2, pk);
            ps.setString(3, sk);
            ps.setTimestamp(4, JdbcSupport.timestamp(Instant.now()));
            ps.executeUpdate();
        }
    }

    private List<CommandRecord> query(String sql, String operation, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            List<CommandRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(CommandRecordMapper.map(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, operation, LOG);
        }
    }
}
