package com.acme.cqrs.processor.ordering;

import com.acme.cqrs.config.TimeoutConfig;
import com.acme.cqrs.ordering.WorkflowCallbacks;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.OrderingTaskRepository;
import com.acme.cqrs.sync.ChangeNotifier;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.concurrent.ExecutorService;

/** Orchestrator for the in-memory stores; there is no transaction to join. */
@Singleton
@Requires(missingProperty = "db.dialect")
public class InMemoryOrderingOrchestrator extends ExecutorOrderingOrchestrator {

    public InMemoryOrderingOrchestrator(
            OrderingTaskRepository taskRepository,
            CommandRepository commandRepository,
            WorkflowCallbacks callbacks,
            ChangeNotifier notifier,
            TimeoutConfig timeoutConfig,
            Clock clock,
            @Named("ordering") ExecutorService executor) {
        super(taskRepository, commandRepository, callbacks, notifier, timeoutConfig, clock, executor);
    }

    @Override
    protected void executeInTransaction(Runnable action) {
        action.run();
    }
}
