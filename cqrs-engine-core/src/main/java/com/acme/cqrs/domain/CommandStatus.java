package com.acme.cqrs.domain;

/** Lifecycle of a command record. */
public enum CommandStatus {
  /** Persisted, not yet seen by the orchestrator */
  PENDING,

  /** Scheduled, parked until the previous version finishes */
  WAITING,

  /** Being materialized and dispatched to sync handlers */
  PROCESSING,

  /** Materialized and notified */
  COMPLETED,

  /** Failed, aborted or timed out */
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
