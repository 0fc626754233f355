package com.acme.cqrs.repository;

/** Counter rows keyed by {@code (scopeKey, period)}. */
public interface SequenceRepository {

  /**
   * Atomically add {@code delta} to the counter, creating it at zero first when missing.
   *
   * @return the post-increment value; no two callers observe the same value
   */
  long increment(String scopeKey, String period, long delta);

  /** Current value, 0 when the counter does not exist */
  long current(String scopeKey, String period);
}
