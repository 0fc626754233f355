package com.acme.cqrs.domain;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Latest materialized state of an aggregate, pointing back at the command that produced it. */
@Value
@Builder(toBuilder = true)
public class DataRecord {

  String partitionKey;
  /** Unversioned sort key. */
  String sortKey;
  int version;
  String entityId;
  String businessCode;
  String displayName;
  String tenantCode;
  String entityType;
  boolean deleted;
  Integer sequenceNo;
  Long ttl;
  @Builder.Default Map<String, Object> attributes = Map.of();
  String sourceLabel;
  String requestId;
  Instant createdAt;
  String createdBy;
  String createdIp;
  Instant updatedAt;
  String updatedBy;
  String updatedIp;
  String commandPartitionKey;
  String commandSortKey;

  public AggregateKey key() {
    return new AggregateKey(partitionKey, sortKey);
  }

  /**
   * Projects a command into its data record. {@code createdAt/By/Ip} are carried over from
   * {@code previous} when the aggregate already has state.
   */
  public static DataRecord fromCommand(CommandRecord command, DataRecord previous) {
    DataRecordBuilder b =
        DataRecord.builder()
            .partitionKey(command.getPartitionKey())
            .sortKey(AggregateKey.unversioned(command.getSortKey()))
            .version(command.getVersion())
            .entityId(command.getEntityId())
            .businessCode(command.getBusinessCode())
            .displayName(command.getDisplayName())
            .tenantCode(command.getTenantCode())
            .entityType(command.getEntityType())
            .deleted(command.isDeleted())
            .sequenceNo(command.getSequenceNo())
            .ttl(command.getTtl())
            .attributes(command.getAttributes())
            .sourceLabel(command.getSourceLabel())
            .requestId(command.getRequestId())
            .createdAt(command.getCreatedAt())
            .createdBy(command.getCreatedBy())
            .createdIp(command.getCreatedIp())
            .updatedAt(command.getUpdatedAt())
            .updatedBy(command.getUpdatedBy())
            .updatedIp(command.getUpdatedIp())
            .commandPartitionKey(command.getPartitionKey())
            .commandSortKey(command.getSortKey());
    if (previous != null) {
      b.createdAt(previous.getCreatedAt())
          .createdBy(previous.getCreatedBy())
          .createdIp(previous.getCreatedIp());
    }
    return b.build();
  }
}
