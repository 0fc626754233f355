package com.acme.cqrs.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import javax.sql.DataSource;

/** H2-specific latest-state store using the update-then-insert upsert of the base class. */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2DataRepository extends JdbcDataRepository {

    public H2DataRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected String getInsertSql() {
        return """
                INSERT INTO data_record
                (pk, sk, version, entity_id, business_code, display_name, tenant_code, entity_type,
                 is_deleted, sequence_no, ttl, attributes, source_label, request_id, created_at,
                 created_by, created_ip, updated_at, updated_by, updated_ip, command_pk, command_sk)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    @Override
    protected String getUpdateSql(boolean conditional) {
        return """
                UPDATE data_record
                SET version = ?, entity_id = ?, business_code = ?, display_name = ?, tenant_code = ?,
                    entity_type = ?, is_deleted = ?, sequence_no = ?, ttl = ?, attributes = ?,
                    source_label = ?, request_id = ?, created_at = ?, created_by = ?, created_ip = ?,
                    updated_at = ?, updated_by = ?, updated_ip = ?, command_pk = ?, command_sk = ?
                WHERE pk = ? AND sk = ?
                """ + (conditional ? " AND version < ?" : "");
    }
}
