package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.domain.DataRecord;
import com.acme.cqrs.persistence.jdbc.mapper.DataRecordMapper;
import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PostgreSQL-specific latest-state store. The conditional upsert is a single
 * {@code INSERT ... ON CONFLICT DO UPDATE ... WHERE}, so it never races with a concurrent insert.
 */
@Singleton
@Requires(property = "db.dialect", value = "POSTGRES")
public class PostgresDataRepository extends JdbcDataRepository {

    private static final Logger LOG = LoggerFactory.getLogger(PostgresDataRepository.class);

    public PostgresDataRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO data_record
                (pk, sk, version, entity_id, business_code, display_name, tenant_code, entity_type,
                 is_deleted, sequence_no, ttl, attributes, source_label, request_id, created_at,
                 created_by, created_ip, updated_at, updated_by, updated_ip, command_pk, command_sk)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected String getUpdateSql(boolean conditional) {
        return """
                UPDATE data_record
                SET version = ?, entity_id = ?, business_code = ?, display_name = ?, tenant_code = ?,
                    entity_type = ?, is_deleted = ?, sequence_no = ?, ttl = ?, attributes = ?::jsonb,
                    source_label = ?, request_id = ?, created_at = ?, created_by = ?, created_ip = ?,
                    updated_at = ?, updated_by = ?, updated_ip = ?, command_pk = ?, command_sk = ?
                WHERE pk = ? AND sk = ?
                """ + (conditional ? " AND version < ?" : "");
    }

    protected String getUpsertIfNewerSql() {
        return getInsertSql() + """
                ON CONFLICT (pk, sk) DO UPDATE
                SET version = EXCLUDED.version, entity_id = EXCLUDED.entity_id,
                    business_code = EXCLUDED.business_code, display_name = EXCLUDED.display_name,
                    tenant_code = EXCLUDED.tenant_code, entity_type = EXCLUDED.entity_type,
                    is_deleted = EXCLUDED.is_deleted, sequence_no = EXCLUDED.sequence_no,
                    ttl = EXCLUDED.ttl, attributes = EXCLUDED.attributes,
                    source_label = EXCLUDED.source_label, request_id = EXCLUDED.request_id,
                    created_at = EXCLUDED.created_at, created_by = EXCLUDED.created_by,
                    created_ip = EXCLUDED.created_ip, updated_at = EXCLUDED.updated_at,
                    updated_by = EXCLUDED.updated_by, updated_ip = EXCLUDED.updated_ip,
                    command_pk = EXCLUDED.command_pk, command_sk = EXCLUDED.command_sk
                WHERE data_record.version < EXCLUDED.version
                """;
    }

    @Override
    @Transactional
    public boolean upsertIfNewer(DataRecord record) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getUpsertIfNewerSql())) {
            ps.setString(1, record.getPartitionKey());
            ps.setString(2, record.getSortKey());
            DataRecordMapper.bindValues(ps, 3, record);
            boolean written = ps.executeUpdate() > 0;
            if (!written) {
                LOG.debug("Stale data write ignored: {} version={}", record.key(), record.getVersion());
            }
            return written;
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "upsert data record", LOG);
        }
    }
}
