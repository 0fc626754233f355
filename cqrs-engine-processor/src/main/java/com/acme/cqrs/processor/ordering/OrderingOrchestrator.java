package com.acme.cqrs.processor.ordering;

import com.acme.cqrs.config.TimeoutConfig;
import com.acme.cqrs.ordering.WorkflowCallbacks;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.OrderingTaskRepository;
import com.acme.cqrs.sync.ChangeNotifier;
import io.micronaut.context.annotation.Requires;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Micronaut-specific ordering orchestrator over the JDBC stores. Handles infrastructure concerns:
 * transactions and the pipeline thread pool. Ordering logic is in BaseOrderingOrchestrator.
 */
@Singleton
@Requires(property = "db.dialect")
public class OrderingOrchestrator extends ExecutorOrderingOrchestrator {

    public OrderingOrchestrator(
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
    @Transactional
    protected void executeInTransaction(Runnable action) {
        action.run();
    }
}
