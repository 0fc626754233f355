package com.acme.cqrs.sync;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of sync handlers by entity-type scope. Several handlers may share a scope; they are
 * returned in registration order. Pure POJO - no framework dependencies.
 */
public class SyncHandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(SyncHandlerRegistry.class);

  private final List<Registration> registrations = new CopyOnWriteArrayList<>();

  /** Register a handler under its own declared scope */
  public void register(SyncHandler handler) {
    register(handler.scope(), handler);
  }

  /**
   * Register a handler for an entity type, or {@link SyncHandler#ALL_TYPES}
   *
   * @throws IllegalStateException if a handler with the same name is already registered for the
   *     scope
   */
  public synchronized void register(String scope, SyncHandler handler) {
    boolean duplicate =
        registrations.stream()
            .anyMatch(r -> r.scope().equals(scope) && r.handler().name().equals(handler.name()));
    if (duplicate) {
      String error = "Sync handler already registered: " + handler.name() + " scope=" + scope;
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registering sync handler: {} scope={}", handler.name(), scope);
    registrations.add(new Registration(scope, handler));
  }

  /** Handlers whose scope matches the entity type, in registration order */
  public List<SyncHandler> handlersFor(String entityType) {
    return registrations.stream()
        .filter(r -> r.scope().equals(SyncHandler.ALL_TYPES) || r.scope().equals(entityType))
        .map(Registration::handler)
        .toList();
  }

  public Optional<SyncHandler> findByName(String name) {
    return registrations.stream()
        .map(Registration::handler)
        .filter(h -> h.name().equals(name))
        .findFirst();
  }

  public int size() {
    return registrations.size();
  }

  private record Registration(String scope, SyncHandler handler) {}
}
