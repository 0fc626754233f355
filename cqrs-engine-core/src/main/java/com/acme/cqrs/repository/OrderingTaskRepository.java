package com.acme.cqrs.repository;

import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.ordering.OrderingState;
import com.acme.cqrs.ordering.OrderingTask;
import com.acme.cqrs.ordering.PipelineSignal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Durable orchestration state, one task per command version. */
public interface OrderingTaskRepository {

  /** @return false when a task for the same version already exists */
  boolean insertIfAbsent(OrderingTask task);

  Optional<OrderingTask> find(AggregateKey aggregateKey, int version);

  Optional<OrderingTask> findByToken(String callbackToken);

  /** Task of the highest scheduled version of an aggregate */
  Optional<OrderingTask> findLatest(AggregateKey aggregateKey);

  /**
   * Compare-and-set state change.
   *
   * @param error stored with the new state, may be null
   * @param at new {@code updatedAt}
   * @return true only for the caller whose expected state still matched
   */
  boolean transition(
      AggregateKey aggregateKey,
      int version,
      Set<OrderingState> from,
      OrderingState to,
      String error,
      Instant at);

  /**
   * Durably record the completion signal of the task owning {@code callbackToken}. The first signal
   * wins; later signals are ignored. {@code at} becomes the task's update time.
   *
   * @return the task after recording, empty for an unknown token
   */
  Optional<OrderingTask> recordSignal(
      String callbackToken, PipelineSignal signal, String payload, Instant at);

  /** Waiting tasks whose deadline is before {@code now} */
  List<OrderingTask> findWaitingPastDeadline(Instant now, int limit);

  /** Materializing or notifying tasks not updated since {@code cutoff} */
  List<OrderingTask> findRunningUpdatedBefore(Instant cutoff, int limit);
}
