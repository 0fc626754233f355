package com.acme.cqrs.ordering;

import com.acme.cqrs.core.Jsons;
import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.repository.OrderingTaskRepository;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Callback tokens backed by the ordering task table: a signal is a durable column on the task, so
 * a successor that arrives after its predecessor finished still finds it.
 */
public class StoreWorkflowCallbacks implements WorkflowCallbacks {

  private static final Logger LOG = LoggerFactory.getLogger(StoreWorkflowCallbacks.class);

  private final OrderingTaskRepository taskRepository;
  private final Clock clock;

  public StoreWorkflowCallbacks(OrderingTaskRepository taskRepository, Clock clock) {
    this.taskRepository = taskRepository;
    this.clock = clock;
  }

  @Override
  public String suspendWithToken(AggregateKey aggregateKey, int version) {
    return aggregateKey.versionedSortKey(version) + ":" + UUID.randomUUID();
  }

  @Override
  public Optional<OrderingTask> resume(String callbackToken, Map<String, Object> payload) {
    Optional<OrderingTask> task =
        taskRepository.recordSignal(
            callbackToken, PipelineSignal.SUCCEEDED, Jsons.toJson(payload), clock.instant());
    if (task.isEmpty()) {
      LOG.warn("Resume for unknown callback token: {}", callbackToken);
    }
    return task;
  }

  @Override
  public Optional<OrderingTask> fail(String callbackToken, String error) {
    Optional<OrderingTask> task =
        taskRepository.recordSignal(
            callbackToken,
            PipelineSignal.FAILED,
            Jsons.toJson(Map.of("error", String.valueOf(error))),
            clock.instant());
    if (task.isEmpty()) {
      LOG.warn("Failure signal for unknown callback token: {}", callbackToken);
    }
    return task;
  }
}
