package com.acme.cqrs.processor.config;

import com.acme.cqrs.repository.memory.InMemoryCommandRepository;
import com.acme.cqrs.repository.memory.InMemoryDataRepository;
import com.acme.cqrs.repository.memory.InMemoryOrderingTaskRepository;
import com.acme.cqrs.repository.memory.InMemorySequenceRepository;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

/**
 * Process-local stores used when no {@code db.dialect} is configured. State is lost on restart
 * and not shared between instances.
 */
@Factory
@Requires(missingProperty = "db.dialect")
public class InMemoryRepositoryFactory {

  /** Also serves as the change stream source */
  @Singleton
  public InMemoryCommandRepository commandRepository() {
    return new InMemoryCommandRepository();
  }

  @Singleton
  public InMemoryDataRepository dataRepository() {
    return new InMemoryDataRepository();
  }

  @Singleton
  public InMemoryOrderingTaskRepository orderingTaskRepository() {
    return new InMemoryOrderingTaskRepository();
  }

  @Singleton
  public InMemorySequenceRepository sequenceRepository() {
    return new InMemorySequenceRepository();
  }
}
