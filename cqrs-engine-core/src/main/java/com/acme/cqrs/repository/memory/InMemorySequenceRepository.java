package com.acme.cqrs.repository.memory;

import com.acme.cqrs.repository.SequenceRepository;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemorySequenceRepository implements SequenceRepository {

  private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

  @Override
  public long increment(String scopeKey, String period, long delta) {
    return counters.computeIfAbsent(key(scopeKey, period), k -> new AtomicLong()).addAndGet(delta);
  }

  @Override
  public long current(String scopeKey, String period) {
    AtomicLong counter = counters.get(key(scopeKey, period));
    return counter == null ? 0 : counter.get();
  }

  private static String key(String scopeKey, String period) {
    return scopeKey + "|" + period;
  }
}
