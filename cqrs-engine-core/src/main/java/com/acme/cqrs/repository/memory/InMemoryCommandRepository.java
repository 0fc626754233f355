package com.acme.cqrs.repository.memory;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.CommandStatus;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.QueryOrder;
import com.acme.cqrs.repository.SortKeyFilter;
import com.acme.cqrs.stream.ChangeEvent;
import com.acme.cqrs.stream.ChangeStreamEntry;
import com.acme.cqrs.stream.ChangeStreamSource;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commands table held in memory. Every insert is also appended to an in-memory change log, which
 * this repository serves as its {@link ChangeStreamSource}; status updates are not logged.
 */
public class InMemoryCommandRepository implements CommandRepository, ChangeStreamSource {

  private static final Logger LOG = LoggerFactory.getLogger(InMemoryCommandRepository.class);

  private final Map<AggregateKey, TreeMap<Integer, CommandRecord>> versions = new HashMap<>();
  private final LinkedHashMap<Long, ChangeStreamEntry> changeLog = new LinkedHashMap<>();
  private long nextEntryId = 1;

  @Override
  public synchronized boolean insertIfAbsent(CommandRecord record) {
    TreeMap<Integer, CommandRecord> chain =
        versions.computeIfAbsent(record.aggregateKey(), k -> new TreeMap<>());
    if (chain.containsKey(record.getVersion())) {
      LOG.debug("Conditional insert lost: {}", record.commandKey());
      return false;
    }
    chain.put(record.getVersion(), record);
    append(ChangeEvent.inserted(record));
    return true;
  }

  @Override
  public synchronized Optional<CommandRecord> find(AggregateKey commandKey) {
    TreeMap<Integer, CommandRecord> chain =
        versions.get(
            new AggregateKey(commandKey.partitionKey(), AggregateKey.unversioned(commandKey.sortKey())));
    if (chain == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(chain.get(AggregateKey.versionOf(commandKey.sortKey())));
  }

  @Override
  public synchronized Optional<CommandRecord> findLatest(AggregateKey aggregateKey) {
    TreeMap<Integer, CommandRecord> chain = versions.get(aggregateKey);
    if (chain == null || chain.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(chain.lastEntry().getValue());
  }

  @Override
  public synchronized List<CommandRecord> findVersions(AggregateKey aggregateKey) {
    TreeMap<Integer, CommandRecord> chain = versions.get(aggregateKey);
    return chain == null ? List.of() : List.copyOf(chain.values());
  }

  @Override
  public synchronized List<CommandRecord> queryByPartition(
      String partitionKey, SortKeyFilter filter, int limit, QueryOrder order) {
    Comparator<CommandRecord> bySortKey = Comparator.comparing(CommandRecord::getSortKey);
    return versions.entrySet().stream()
        .filter(e -> e.getKey().partitionKey().equals(partitionKey))
        .flatMap(e -> e.getValue().values().stream())
        .filter(r -> filter.matches(r.getSortKey()))
        .sorted(order == QueryOrder.ASC ? bySortKey : bySortKey.reversed())
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized boolean updateStatus(
      AggregateKey commandKey, CommandStatus status, String callbackToken) {
    Optional<CommandRecord> current = find(commandKey);
    if (current.isEmpty()) {
      LOG.warn("No command to update: {}", commandKey);
      return false;
    }
    CommandRecord old = current.get();
    CommandRecord updated =
        old.toBuilder().status(status).callbackToken(callbackToken).build();
    versions.get(old.aggregateKey()).put(old.getVersion(), updated);
    return true;
  }

  @Override
  public synchronized List<ChangeStreamEntry> poll(int limit) {
    return changeLog.values().stream().limit(limit).toList();
  }

  @Override
  public synchronized void acknowledge(long entryId) {
    changeLog.remove(entryId);
  }

  /** Number of change-log entries not yet acknowledged */
  public synchronized int pendingChanges() {
    return changeLog.size();
  }

  private void append(ChangeEvent event) {
    long id = nextEntryId++;
    changeLog.put(id, new ChangeStreamEntry(id, event));
  }

  /** Test helper: all records of all aggregates */
  public synchronized List<CommandRecord> all() {
    List<CommandRecord> all = new ArrayList<>();
    versions.values().forEach(chain -> all.addAll(chain.values()));
    return all;
  }
}
