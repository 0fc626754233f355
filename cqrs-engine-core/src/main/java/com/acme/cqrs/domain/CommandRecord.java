package com.acme.cqrs.domain;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * One immutable version of an aggregate. Only {@code status} and {@code callbackToken} change after
 * the record is written.
 */
@Value
@Builder(toBuilder = true)
public class CommandRecord {

  String partitionKey;
  /** Versioned sort key, {@code <sortKey>@<version>}. */
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
  CommandStatus status;
  String sourceLabel;
  String requestId;
  Instant createdAt;
  String createdBy;
  String createdIp;
  Instant updatedAt;
  String updatedBy;
  String updatedIp;
  String callbackToken;

  /** The unversioned aggregate this command belongs to. */
  public AggregateKey aggregateKey() {
    return new AggregateKey(partitionKey, AggregateKey.unversioned(sortKey));
  }

  /** Key of this record in the commands store. */
  public AggregateKey commandKey() {
    return new AggregateKey(partitionKey, sortKey);
  }
}
