package com.acme.cqrs.repository;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.CommandStatus;
import java.util.List;
import java.util.Optional;

/**
 * Append-only commands table. Records are keyed by {@code (partitionKey, sortKey@version)} and
 * never deleted.
 */
public interface CommandRepository {

  /**
   * Conditional put: writes the record only if no record exists under its key.
   *
   * @return false when the key is already taken (the optimistic lock was lost)
   */
  boolean insertIfAbsent(CommandRecord record);

  /** Find a command by its versioned key */
  Optional<CommandRecord> find(AggregateKey commandKey);

  /** Highest version recorded for an unversioned aggregate key */
  Optional<CommandRecord> findLatest(AggregateKey aggregateKey);

  /** All versions of an aggregate, ascending by version */
  List<CommandRecord> findVersions(AggregateKey aggregateKey);

  /** Records of a partition whose (versioned) sort key matches the filter */
  List<CommandRecord> queryByPartition(
      String partitionKey, SortKeyFilter filter, int limit, QueryOrder order);

  /**
   * Update the only mutable fields of a command. A null token clears it.
   *
   * @return false when no such command exists
   */
  boolean updateStatus(AggregateKey commandKey, CommandStatus status, String callbackToken);
}
