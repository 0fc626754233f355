package com.acme.cqrs.repository.memory;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.ordering.OrderingState;
import com.acme.cqrs.ordering.OrderingTask;
import com.acme.cqrs.ordering.PipelineSignal;
import com.acme.cqrs.repository.OrderingTaskRepository;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class InMemoryOrderingTaskRepository implements OrderingTaskRepository {

  private final Map<String, OrderingTask> tasks = new HashMap<>();
  private final Map<String, String> keysByToken = new HashMap<>();

  @Override
  public synchronized boolean insertIfAbsent(OrderingTask task) {
    String key = key(task.aggregateKey(), task.version());
    if (tasks.containsKey(key)) {
      return false;
    }
    tasks.put(key, task);
    keysByToken.put(task.callbackToken(), key);
    return true;
  }

  @Override
  public synchronized Optional<OrderingTask> find(AggregateKey aggregateKey, int version) {
    return Optional.ofNullable(tasks.get(key(aggregateKey, version)));
  }

  @Override
  public synchronized Optional<OrderingTask> findByToken(String callbackToken) {
    String key = keysByToken.get(callbackToken);
    return key == null ? Optional.empty() : Optional.ofNullable(tasks.get(key));
  }

  @Override
  public synchronized Optional<OrderingTask> findLatest(AggregateKey aggregateKey) {
    return tasks.values().stream()
        .filter(t -> t.aggregateKey().equals(aggregateKey))
        .max(Comparator.comparingInt(OrderingTask::version));
  }

  @Override
  public synchronized boolean transition(
      AggregateKey aggregateKey,
      int version,
      Set<OrderingState> from,
      OrderingState to,
      String error,
      Instant at) {
    String key = key(aggregateKey, version);
    OrderingTask t = tasks.get(key);
    if (t == null || !from.contains(t.state())) {
      return false;
    }
    tasks.put(
        key,
        new OrderingTask(
            t.partitionKey(),
            t.sortKey(),
            t.version(),
            to,
            t.callbackToken(),
            t.signal(),
            t.signalPayload(),
            error != null ? error : t.error(),
            t.deadline(),
            t.createdAt(),
            at));
    return true;
  }

  @Override
  public synchronized Optional<OrderingTask> recordSignal(
      String callbackToken, PipelineSignal signal, String payload, Instant at) {
    String key = keysByToken.get(callbackToken);
    if (key == null) {
      return Optional.empty();
    }
    OrderingTask t = tasks.get(key);
    if (t.signal() != null) {
      return Optional.of(t);
    }
    OrderingTask signalled =
        new OrderingTask(
            t.partitionKey(),
            t.sortKey(),
            t.version(),
            t.state(),
            t.callbackToken(),
            signal,
            payload,
            t.error(),
            t.deadline(),
            t.createdAt(),
            at);
    tasks.put(key, signalled);
    return Optional.of(signalled);
  }

  @Override
  public synchronized List<OrderingTask> findWaitingPastDeadline(Instant now, int limit) {
    return tasks.values().stream()
        .filter(t -> t.state() == OrderingState.WAITING_FOR_PREDECESSOR)
        .filter(t -> t.deadline().isBefore(now))
        .sorted(Comparator.comparing(OrderingTask::deadline).thenComparingInt(OrderingTask::version))
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized List<OrderingTask> findRunningUpdatedBefore(Instant cutoff, int limit) {
    return tasks.values().stream()
        .filter(t -> OrderingState.RUNNING.contains(t.state()))
        .filter(t -> t.updatedAt().isBefore(cutoff))
        .sorted(Comparator.comparing(OrderingTask::updatedAt))
        .limit(limit)
        .toList();
  }

  private static String key(AggregateKey aggregateKey, int version) {
    return aggregateKey.partitionKey() + "|" + aggregateKey.sortKey() + "|" + version;
  }
}
