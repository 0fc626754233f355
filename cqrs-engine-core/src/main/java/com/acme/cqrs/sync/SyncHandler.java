package com.acme.cqrs.sync;

import com.acme.cqrs.domain.CommandRecord;

/**
 * Projects committed commands into an external system. Delivery is at-least-once, so {@link
 * #up(CommandRecord)} must tolerate seeing the same version twice.
 */
public interface SyncHandler {

  /** Scope that matches every entity type */
  String ALL_TYPES = "*";

  default String name() {
    return getClass().getSimpleName();
  }

  /** Entity type this handler is registered for when no scope is given explicitly. */
  default String scope() {
    return ALL_TYPES;
  }

  /** Apply a committed version forward. */
  Object up(CommandRecord record);

  /** Undo a version. Only ever invoked on explicit request, never by the engine itself. */
  default Object down(CommandRecord record) {
    throw new UnsupportedOperationException(name() + " does not support rollback");
  }
}
