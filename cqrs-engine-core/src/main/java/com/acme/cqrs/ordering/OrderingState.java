package com.acme.cqrs.ordering;

import java.util.EnumSet;
import java.util.Set;

/**
 * Ordering state of one command version. Seen per aggregate, a key cycles
 * IDLE → WAITING_FOR_PREDECESSOR → MATERIALIZING → NOTIFYING → IDLE.
 */
public enum OrderingState {
  /** Parked until the previous version has finished */
  WAITING_FOR_PREDECESSOR,

  /** Writing the command's net effect into the data store */
  MATERIALIZING,

  /** Dispatching to sync handlers */
  NOTIFYING,

  /** Version finished; the aggregate is idle again */
  IDLE,

  /** Failed, aborted or timed out */
  FAILED;

  public static final Set<OrderingState> ACTIVE =
      EnumSet.of(WAITING_FOR_PREDECESSOR, MATERIALIZING, NOTIFYING);

  public static final Set<OrderingState> RUNNING = EnumSet.of(MATERIALIZING, NOTIFYING);

  public boolean isTerminal() {
    return this == IDLE || this == FAILED;
  }
}
