package com.acme.cqrs.domain;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Sparse patch against the current state of an aggregate. Null fields and absent attribute keys
 * keep their current values.
 */
@Value
@Builder(toBuilder = true)
public class PartialUpdateInput {

  String partitionKey;
  String sortKey;
  int version;
  String displayName;
  String businessCode;
  Boolean deleted;
  Integer sequenceNo;
  Long ttl;
  @Builder.Default Map<String, Object> attributes = Map.of();

  public AggregateKey aggregateKey() {
    return new AggregateKey(partitionKey, sortKey);
  }
}
