package com.acme.cqrs.processor.config;

import com.acme.cqrs.command.CommandProcessor;
import com.acme.cqrs.config.ProcessingConfig;
import com.acme.cqrs.config.TimeoutConfig;
import com.acme.cqrs.data.DataService;
import com.acme.cqrs.ordering.BaseOrderingOrchestrator;
import com.acme.cqrs.ordering.StoreWorkflowCallbacks;
import com.acme.cqrs.ordering.WorkflowCallbacks;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.DataRepository;
import com.acme.cqrs.repository.OrderingTaskRepository;
import com.acme.cqrs.repository.SequenceRepository;
import com.acme.cqrs.sequence.InMemorySequenceSettingsRegistry;
import com.acme.cqrs.sequence.SequenceGenerator;
import com.acme.cqrs.sequence.SequenceSettingsRegistry;
import com.acme.cqrs.stream.ChangeStreamDispatcher;
import com.acme.cqrs.stream.ChangeStreamSource;
import com.acme.cqrs.sync.ChangeNotifier;
import com.acme.cqrs.sync.DataMaterializationHandler;
import com.acme.cqrs.sync.SyncHandler;
import com.acme.cqrs.sync.SyncHandlerRegistry;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this module does the DI wiring.
 */
@Factory
public class CoreBeansFactory {

  /** Creates TimeoutConfig bean populated from application.yml timeout.* properties */
  @Singleton
  @ConfigurationProperties("timeout")
  public TimeoutConfig timeoutConfig() {
    return new TimeoutConfig();
  }

  /** Creates ProcessingConfig bean populated from application.yml processing.* properties */
  @Singleton
  @ConfigurationProperties("processing")
  public ProcessingConfig processingConfig() {
    return new ProcessingConfig();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Registers every SyncHandler bean under its declared scope, in bean order */
  @Singleton
  public SyncHandlerRegistry syncHandlerRegistry(List<SyncHandler> handlers) {
    SyncHandlerRegistry registry = new SyncHandlerRegistry();
    handlers.forEach(registry::register);
    return registry;
  }

  /**
   * The default materialization handler is created here rather than exposed as a bean, so it is
   * not registered a second time as a custom handler.
   */
  @Singleton
  public ChangeNotifier changeNotifier(
      SyncHandlerRegistry registry,
      DataRepository dataRepository,
      CommandRepository commandRepository,
      ProcessingConfig processingConfig) {
    return new ChangeNotifier(
        registry, new DataMaterializationHandler(dataRepository, commandRepository), processingConfig);
  }

  @Singleton
  public WorkflowCallbacks workflowCallbacks(OrderingTaskRepository taskRepository, Clock clock) {
    return new StoreWorkflowCallbacks(taskRepository, clock);
  }

  @Singleton
  public CommandProcessor commandProcessor(
      CommandRepository commandRepository,
      DataRepository dataRepository,
      BaseOrderingOrchestrator orchestrator,
      TimeoutConfig timeoutConfig,
      ProcessingConfig processingConfig,
      Clock clock) {
    return new CommandProcessor(
        commandRepository, dataRepository, orchestrator, timeoutConfig, processingConfig, clock);
  }

  @Singleton
  public ChangeStreamDispatcher changeStreamDispatcher(
      ChangeStreamSource changeStreamSource, BaseOrderingOrchestrator orchestrator) {
    return new ChangeStreamDispatcher(changeStreamSource, orchestrator);
  }

  @Singleton
  public DataService dataService(DataRepository dataRepository, CommandRepository commandRepository) {
    return new DataService(dataRepository, commandRepository);
  }

  /** Settings of every configured sequences.* entry; a tenant-scoped entry overrides the type-wide one */
  @Singleton
  public SequenceSettingsRegistry sequenceSettingsRegistry(List<SequenceProperties> sequences) {
    InMemorySequenceSettingsRegistry registry = new InMemorySequenceSettingsRegistry();
    for (SequenceProperties sequence : sequences) {
      if (sequence.getTenantCode() == null || sequence.getTenantCode().isBlank()) {
        registry.register(sequence.getTypeCode(), sequence.toSettings());
      } else {
        registry.register(sequence.getTenantCode(), sequence.getTypeCode(), sequence.toSettings());
      }
    }
    return registry;
  }

  @Singleton
  public SequenceGenerator sequenceGenerator(
      SequenceRepository sequenceRepository, SequenceSettingsRegistry settingsRegistry, Clock clock) {
    return new SequenceGenerator(sequenceRepository, settingsRegistry, clock);
  }
}
