package com.acme.cqrs.data;

import com.acme.cqrs.core.ValidationException;
import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.DataRecord;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.DataRepository;
import com.acme.cqrs.repository.QueryOrder;
import com.acme.cqrs.repository.SortKeyFilter;
import java.util.List;
import java.util.Optional;

/** Read side: latest materialized state plus the version history kept in the commands store. */
public class DataService {

  public static final int DEFAULT_LIMIT = 100;

  private final DataRepository dataRepository;
  private final CommandRepository commandRepository;

  public DataService(DataRepository dataRepository, CommandRepository commandRepository) {
    this.dataRepository = dataRepository;
    this.commandRepository = commandRepository;
  }

  public Optional<DataRecord> getItem(AggregateKey key) {
    return dataRepository.find(key);
  }

  public List<DataRecord> listItemsByPk(String partitionKey) {
    return listItemsByPk(partitionKey, SortKeyFilter.any(), DEFAULT_LIMIT, QueryOrder.ASC);
  }

  public List<DataRecord> listItemsByPk(
      String partitionKey, SortKeyFilter filter, int limit, QueryOrder order) {
    if (partitionKey == null || partitionKey.isBlank()) {
      throw new ValidationException("partitionKey is required");
    }
    if (limit <= 0) {
      throw new ValidationException("limit must be positive");
    }
    return dataRepository.queryByPartition(partitionKey, filter, limit, order);
  }

  /** Every committed version of an aggregate, oldest first. */
  public List<CommandRecord> listHistory(AggregateKey key) {
    return commandRepository.findVersions(key);
  }
}
