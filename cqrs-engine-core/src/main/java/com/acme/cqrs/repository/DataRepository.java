package com.acme.cqrs.repository;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.DataRecord;
import java.util.List;
import java.util.Optional;

/** Mutable latest-state table, at most one record per unversioned key. */
public interface DataRepository {

  Optional<DataRecord> find(AggregateKey key);

  /**
   * Write the record when none exists or the stored version is lower.
   *
   * @return false when an equal or newer version is already stored
   */
  boolean upsertIfNewer(DataRecord record);

  /** Unconditional overwrite, used by manual rollback */
  void replace(DataRecord record);

  List<DataRecord> queryByPartition(
      String partitionKey, SortKeyFilter filter, int limit, QueryOrder order);
}
