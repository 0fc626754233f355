package com.acme.cqrs.ordering;

import com.acme.cqrs.domain.AggregateKey;
import java.time.Instant;

/**
 * Persisted orchestration state of one command version. A task in
 * {@link OrderingState#WAITING_FOR_PREDECESSOR} is the durable form of a suspended workflow step;
 * {@code signal} is the durable completion signal its successor looks for.
 */
public record OrderingTask(
    String partitionKey,
    String sortKey,
    int version,
    OrderingState state,
    String callbackToken,
    PipelineSignal signal,
    String signalPayload,
    String error,
    Instant deadline,
    Instant createdAt,
    Instant updatedAt) {

  public static OrderingTask waiting(
      AggregateKey key, int version, String callbackToken, Instant deadline, Instant now) {
    return new OrderingTask(
        key.partitionKey(),
        key.sortKey(),
        version,
        OrderingState.WAITING_FOR_PREDECESSOR,
        callbackToken,
        null,
        null,
        null,
        deadline,
        now,
        now);
  }

  public static OrderingTask failed(
      AggregateKey key, int version, String callbackToken, String error, Instant now) {
    return new OrderingTask(
        key.partitionKey(),
        key.sortKey(),
        version,
        OrderingState.FAILED,
        callbackToken,
        PipelineSignal.FAILED,
        null,
        error,
        now,
        now,
        now);
  }

  public AggregateKey aggregateKey() {
    return new AggregateKey(partitionKey, sortKey);
  }

  /** Key of the command record this task orders. */
  public AggregateKey commandKey() {
    return aggregateKey().atVersion(version);
  }

  /** A successor may start once its predecessor is terminal or has left a signal. */
  public boolean releasesSuccessor() {
    return state.isTerminal() || signal != null;
  }

  public boolean isFailed() {
    return state == OrderingState.FAILED;
  }
}
