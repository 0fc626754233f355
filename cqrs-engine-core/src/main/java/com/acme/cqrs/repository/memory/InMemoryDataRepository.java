package com.acme.cqrs.repository.memory;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.DataRecord;
import com.acme.cqrs.repository.DataRepository;
import com.acme.cqrs.repository.QueryOrder;
import com.acme.cqrs.repository.SortKeyFilter;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDataRepository implements DataRepository {

  private final ConcurrentHashMap<AggregateKey, DataRecord> records = new ConcurrentHashMap<>();

  @Override
  public Optional<DataRecord> find(AggregateKey key) {
    return Optional.ofNullable(records.get(key));
  }

  @Override
  public boolean upsertIfNewer(DataRecord record) {
    boolean[] written = {false};
    records.compute(
        record.key(),
        (k, existing) -> {
          if (existing == null || existing.getVersion() < record.getVersion()) {
            written[0] = true;
            return record;
          }
          return existing;
        });
    return written[0];
  }

  @Override
  public void replace(DataRecord record) {
    records.put(record.key(), record);
  }

  @Override
  public List<DataRecord> queryByPartition(
      String partitionKey, SortKeyFilter filter, int limit, QueryOrder order) {
    Comparator<DataRecord> bySortKey = Comparator.comparing(DataRecord::getSortKey);
    return records.values().stream()
        .filter(r -> r.getPartitionKey().equals(partitionKey))
        .filter(r -> filter.matches(r.getSortKey()))
        .sorted(order == QueryOrder.ASC ? bySortKey : bySortKey.reversed())
        .limit(limit)
        .toList();
  }
}
