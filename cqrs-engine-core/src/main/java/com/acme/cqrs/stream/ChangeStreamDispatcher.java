package com.acme.cqrs.stream;

import com.acme.cqrs.ordering.BaseOrderingOrchestrator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds committed command inserts from the change stream into ordering. Any other entry, such as a
 * MODIFY from a source that reports updates, is acknowledged without action.
 */
public class ChangeStreamDispatcher {

  private static final Logger LOG = LoggerFactory.getLogger(ChangeStreamDispatcher.class);

  private final ChangeStreamSource source;
  private final BaseOrderingOrchestrator orchestrator;

  public ChangeStreamDispatcher(ChangeStreamSource source, BaseOrderingOrchestrator orchestrator) {
    this.source = source;
    this.orchestrator = orchestrator;
  }

  /**
   * Process one batch. An entry whose handling fails stays unacknowledged and is redelivered by a
   * later call.
   *
   * @return number of versions handed to the orchestrator
   */
  public int drain(int limit) {
    List<ChangeStreamEntry> entries = source.poll(limit);
    int scheduled = 0;
    for (ChangeStreamEntry entry : entries) {
      try {
        if (handle(entry.event())) {
          scheduled++;
        }
        source.acknowledge(entry.id());
      } catch (Exception e) {
        LOG.warn("Failed to dispatch change entry id={}, will retry", entry.id(), e);
      }
    }
    if (!entries.isEmpty()) {
      LOG.debug("Drained {} change entries, scheduled {}", entries.size(), scheduled);
    }
    return scheduled;
  }

  private boolean handle(ChangeEvent event) {
    if (event.eventType() != ChangeEventType.INSERT || event.newRecord() == null) {
      return false;
    }
    orchestrator.schedule(event.newRecord());
    return true;
  }
}
