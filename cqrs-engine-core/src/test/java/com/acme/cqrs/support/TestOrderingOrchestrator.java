package com.acme.cqrs.support;

import com.acme.cqrs.config.TimeoutConfig;
import com.acme.cqrs.ordering.BaseOrderingOrchestrator;
import com.acme.cqrs.ordering.WorkflowCallbacks;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.OrderingTaskRepository;
import com.acme.cqrs.sync.ChangeNotifier;
import java.time.Clock;
import java.util.concurrent.Executor;

/** Orchestrator without a container: no transactions, pipelines run on the given executor. */
public class TestOrderingOrchestrator extends BaseOrderingOrchestrator {

  private final OrderingTaskRepository taskRepository;
  private final CommandRepository commandRepository;
  private final WorkflowCallbacks callbacks;
  private final ChangeNotifier notifier;
  private final TimeoutConfig timeoutConfig;
  private final Clock clock;
  private final Executor executor;

  public TestOrderingOrchestrator(
      OrderingTaskRepository taskRepository,
      CommandRepository commandRepository,
      WorkflowCallbacks callbacks,
      ChangeNotifier notifier,
      TimeoutConfig timeoutConfig,
      Clock clock,
      Executor executor) {
    this.taskRepository = taskRepository;
    this.commandRepository = commandRepository;
    this.callbacks = callbacks;
    this.notifier = notifier;
    this.timeoutConfig = timeoutConfig;
    this.clock = clock;
    this.executor = executor;
  }

  @Override
  protected OrderingTaskRepository getTaskRepository() {
    return taskRepository;
  }

  @Override
  protected CommandRepository getCommandRepository() {
    return commandRepository;
  }

  @Override
  protected WorkflowCallbacks getCallbacks() {
    return callbacks;
  }

  @Override
  protected ChangeNotifier getNotifier() {
    return notifier;
  }

  @Override
  protected TimeoutConfig getTimeoutConfig() {
    return timeoutConfig;
  }

  @Override
  protected Clock getClock() {
    return clock;
  }

  @Override
  protected void executeInTransaction(Runnable action) {
    action.run();
  }

  @Override
  protected void dispatch(Runnable pipeline) {
    executor.execute(pipeline);
  }
}
