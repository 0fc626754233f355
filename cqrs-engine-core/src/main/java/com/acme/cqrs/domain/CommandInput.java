package com.acme.cqrs.domain;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A full mutation request. {@code version} is the version the caller last observed,
 * {@link #VERSION_NEW} to create the aggregate, or {@link #VERSION_LATEST} to let the processor
 * resolve it (asynchronous publication only).
 */
@Value
@Builder(toBuilder = true)
public class CommandInput {

  public static final int VERSION_LATEST = -1;

  /** Creates version 0; conflicts when the aggregate already has any version. */
  public static final int VERSION_NEW = -2;

  String partitionKey;
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

  public AggregateKey aggregateKey() {
    return new AggregateKey(partitionKey, sortKey);
  }
}
