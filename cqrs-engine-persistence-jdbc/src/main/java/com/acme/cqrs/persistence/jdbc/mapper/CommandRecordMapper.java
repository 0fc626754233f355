package com.acme.cqrs.persistence.jdbc.mapper;

import com.acme.cqrs.core.Jsons;
import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.CommandStatus;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Maps between CommandRecord and rows of {@code command_record}.
 */
public class CommandRecordMapper {

    public static final String COLUMNS = """
            pk, sk, unversioned_sk, version, entity_id, business_code, display_name, tenant_code,
            entity_type, is_deleted, sequence_no, ttl, attributes, status, source_label, request_id,
            created_at, created_by, created_ip, updated_at, updated_by, updated_ip, callback_token
            """;

    /** Number of placeholders {@link #bindInsert} fills. */
    public static final int INSERT_PARAMETERS = 23;

    private CommandRecordMapper() {
    }

    public static CommandRecord map(ResultSet rs) throws SQLException {
        int sequenceNo = rs.getInt("sequence_no");
        Integer sequence = rs.wasNull() ? null : sequenceNo;
        long ttlValue = rs.getLong("ttl");
        Long ttl = rs.wasNull() ? null : ttlValue;
        return CommandRecord.builder()
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
                .status(CommandStatus.valueOf(rs.getString("status")))
                .sourceLabel(rs.getString("source_label"))
                .requestId(rs.getString("request_id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .createdBy(rs.getString("created_by"))
                .createdIp(rs.getString("created_ip"))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .updatedBy(rs.getString("updated_by"))
                .updatedIp(rs.getString("updated_ip"))
                .callbackToken(rs.getString("callback_token"))
                .build();
    }

    /** Binds every column of {@link #COLUMNS}, in order, starting at parameter 1. */
    public static void bindInsert(PreparedStatement ps, CommandRecord record) throws SQLException {
        ps.setString(1, record.getPartitionKey());
        ps.setString(2, record.getSortKey());
        ps.setString(3, AggregateKey.unversioned(record.getSortKey()));
        ps.setInt(4, record.getVersion());
        ps.setString(5, record.getEntityId());
        ps.setString(6, record.getBusinessCode());
        ps.setString(7, record.getDisplayName());
        ps.setString(8, record.getTenantCode());
        ps.setString(9, record.getEntityType());
        ps.setBoolean(10, record.isDeleted());
        if (record.getSequenceNo() == null) {
            ps.setNull(11, Types.INTEGER);
        } else {
            ps.setInt(11, record.getSequenceNo());
        }
        if (record.getTtl() == null) {
            ps.setNull(12, Types.BIGINT);
        } else {
            ps.setLong(12, record.getTtl());
        }
        ps.setString(13, Jsons.toJson(record.getAttributes()));
        ps.setString(14, record.getStatus().name());
        ps.setString(15, record.getSourceLabel());
        ps.setString(16, record.getRequestId());
        ps.setTimestamp(17, toTimestamp(record.getCreatedAt()));
        ps.setString(18, record.getCreatedBy());
        ps.setString(19, record.getCreatedIp());
        ps.setTimestamp(20, toTimestamp(record.getUpdatedAt()));
        ps.setString(21, record.getUpdatedBy());
        ps.setString(22, record.getUpdatedIp());
        ps.setString(23, record.getCallbackToken());
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
