package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.DataRecord;
import com.acme.cqrs.persistence.jdbc.mapper.DataRecordMapper;
import com.acme.cqrs.repository.DataRepository;
import com.acme.cqrs.repository.QueryOrder;
import com.acme.cqrs.repository.SortKeyFilter;
import io.micronaut.transaction.annotation.Transactional;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract JDBC implementation of the latest-state store. The base conditional upsert updates
 * first and inserts when no row exists; dialects with native upsert override it.
 */
public abstract class JdbcDataRepository implements DataRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcDataRepository.class);

    protected final DataSource dataSource;

    protected JdbcDataRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    protected abstract String getInsertSql();

    /** Update of all value columns, guarded by {@code version < ?} when {@code conditional}. */
    protected abstract String getUpdateSql(boolean conditional);

    protected String getFindSql() {
        return "SELECT " + DataRecordMapper.COLUMNS + " FROM data_record WHERE pk = ? AND sk = ?";
    }

    protected String getQueryByPartitionSql(SortKeyFilter filter, QueryOrder order) {
        return "SELECT " + DataRecordMapper.COLUMNS + " FROM data_record WHERE pk = ?"
                + JdbcSupport.sortKeyCondition(filter) + JdbcSupport.orderBy(order) + " LIMIT ?";
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DataRecord> find(AggregateKey key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindSql())) {
            ps.setString(1, key.partitionKey());
            ps.setString(2, key.sortKey());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(DataRecordMapper.map(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find data record", LOG);
        }
    }

    @Override
    @Transactional
    public boolean upsertIfNewer(DataRecord record) {
        try {
            return JdbcSupport.inTransaction(dataSource, conn -> {
                if (update(conn, record, true) > 0) {
                    return true;
                }
                if (exists(conn, record.key())) {
                    LOG.debug("Stale data write ignored: {} version={}", record.key(), record.getVersion());
                    return false;
                }
                try {
                    insert(conn, record);
                    return true;
                } catch (SQLException e) {
                    if (!ExceptionTranslator.isUniqueViolation(e)) {
                        throw e;
                    }
                    // a concurrent writer created the row first
                    return update(conn, record, true) > 0;
                }
            });
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "upsert data record", LOG);
        }
    }

    @Override
    @Transactional
    public void replace(DataRecord record) {
        try {
            JdbcSupport.inTransaction(dataSource, conn -> {
                if (update(conn, record, false) == 0) {
                    insert(conn, record);
                }
                return null;
            });
            LOG.info("Replaced data record {} with version={}", record.key(), record.getVersion());
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "replace data record", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DataRecord> queryByPartition(
            String partitionKey, SortKeyFilter filter, int limit, QueryOrder order) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getQueryByPartitionSql(filter, order))) {
            int i = 1;
            ps.setString(i++, partitionKey);
            if (filter.operator() != SortKeyFilter.Operator.ANY) {
                ps.setString(i++, JdbcSupport.sortKeyParameter(filter));
            }
            ps.setInt(i, limit);
            List<DataRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(DataRecordMapper.map(rs));
                }
            }
            return records;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "query data partition", LOG);
        }
    }

    protected int update(Connection conn, DataRecord record, boolean conditional) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getUpdateSql(conditional))) {
            int i = DataRecordMapper.bindValues(ps, 1, record);
            ps.setString(i++, record.getPartitionKey());
            ps.setString(i++, record.getSortKey());
            if (conditional) {
                ps.setInt(i, record.getVersion());
            }
            return ps.executeUpdate();
        }
    }

    protected void insert(Connection conn, DataRecord record) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getInsertSql())) {
            ps.setString(1, record.getPartitionKey());
            ps.setString(2, record.getSortKey());
            DataRecordMapper.bindValues(ps, 3, record);
            ps.executeUpdate();
        }
    }

    private boolean exists(Connection conn, AggregateKey key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM data_record WHERE pk = ? AND sk = ?")) {
            ps.setString(1, key.partitionKey());
            ps.setString(2, key.sortKey());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
