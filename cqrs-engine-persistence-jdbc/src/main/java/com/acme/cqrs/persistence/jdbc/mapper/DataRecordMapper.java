package com.acme.cqrs.persistence.jdbc.mapper;

import static com.acme.cqrs.persistence.jdbc.mapper.CommandRecordMapper.toInstant;
import static com.acme.cqrs.persistence.jdbc.mapper.CommandRecordMapper.toTimestamp;

import com.acme.cqrs.core.Jsons;
import com.acme.cqrs.domain.DataRecord;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Maps between DataRecord and rows of {@code data_record}.
 */
public class DataRecordMapper {

    public static final String COLUMNS = """
            pk, sk, version, entity_id, business_code, display_name, tenant_code, entity_type,
            is_deleted, sequence_no, ttl, attributes, source_label, request_id, created_at,
            created_by, created_ip, updated_at, updated_by, updated_ip, command_pk, command_sk
            """;

    /** Columns after the key, in {@link #bindValues} order. */
    public static final String VALUE_COLUMNS = """
            version, entity_id, business_code, display_name, tenant_code, entity_type,
            is_deleted, sequence_no, ttl, attributes, source_label, request_id, created_at,
            created_by, created_ip, updated_at, updated_by, updated_ip, command_pk, command_sk
            """;

    public static final int VALUE_PARAMETERS = 20;

    private DataRecordMapper() {
    }

    public static DataRecord map(ResultSet rs) throws SQLException {
        int sequenceNo = rs.getInt("sequence_no");
        Integer sequence = rs.wasNull() ? null : sequenceNo;
        long ttlValue = rs.getLong("ttl");
        Long ttl = rs.wasNull() ? null : ttlValue;
        return DataRecord.builder()
                .partitionKey(rs.getString("pk"))
                .sortKey(rs.getString("sk"))
                .version(rs.getInt("version"))
                .entityId(rs.getString("entity_id"))
                .businessCode(rs.getString("business_code"))
                .displayName(rs.getString("display_name"))
                .tenantCode(rs.getString("tenant_code"))
                .entityType(rs.getString("entity_type"))
                .deleted(rs.getBoolean("is_deleted"))
                .sequenceNo(sequence)
                .ttl(ttl)
                .attributes(Jsons.toMap(rs.getString("attributes")))
                .sourceLabel(rs.getString("source_label"))
                .requestId(rs.getString("request_id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .createdBy(rs.getString("created_by"))
                .createdIp(rs.getString("created_ip"))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .updatedBy(rs.getString("updated_by"))
                .updatedIp(rs.getString("updated_ip"))
                .commandPartitionKey(rs.getString("command_pk"))
                .commandSortKey(rs.getString("command_sk"))
                .build();
    }

    /**
     * Binds the {@link #VALUE_COLUMNS} starting at parameter {@code first}.
     *
     * @return the next free parameter index
     */
    public static int bindValues(PreparedStatement ps, int first, DataRecord record) throws SQLException {
        int i = first;
        ps.setInt(i++, record.getVersion());
        ps.setString(i++, record.getEntityId());
        ps.setString(i++, record.getBusinessCode());
        ps.setString(i++, record.getDisplayName());
        ps.setString(i++, record.getTenantCode());
        ps.setString(i++, record.getEntityType());
        ps.setBoolean(i++, record.isDeleted());
        if (record.getSequenceNo() == null) {
            ps.setNull(i++, Types.INTEGER);
        } else {
            ps.setInt(i++, record.getSequenceNo());
        }
        if (record.getTtl() == null) {
            ps.setNull(i++, Types.BIGINT);
        } else {
            ps.setLong(i++, record.getTtl());
        }
        ps.setString(i++, Jsons.toJson(record.getAttributes()));
        ps.setString(i++, record.getSourceLabel());
        ps.setString(i++, record.getRequestId());
        ps.setTimestamp(i++, toTimestamp(record.getCreatedAt()));
        ps.setString(i++, record.getCreatedBy());
        ps.setString(i++, record.getCreatedIp());
        ps.setTimestamp(i++, toTimestamp(record.getUpdatedAt()));
        ps.setString(i++, record.getUpdatedBy());
        ps.setString(i++, record.getUpdatedIp());
        ps.setString(i++, record.getCommandPartitionKey());
        ps.setString(i++, record.getCommandSortKey());
        return i;
    }
}
