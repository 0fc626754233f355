package com.acme.cqrs.stream;

import java.util.List;

/**
 * Ordered feed of committed command writes. Delivery is at-least-once: an entry that is not
 * acknowledged is delivered again by a later {@link #poll(int)}.
 */
public interface ChangeStreamSource {

  /** Next unacknowledged entries, oldest first. */
  List<ChangeStreamEntry> poll(int limit);

  void acknowledge(long entryId);
}
