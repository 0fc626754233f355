package com.acme.cqrs.sync;

import com.acme.cqrs.config.ProcessingConfig;
import com.acme.cqrs.core.HandlerFailureException;
import com.acme.cqrs.core.NotFoundException;
import com.acme.cqrs.domain.CommandRecord;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches committed command versions: first the built-in materialization, then every sync
 * handler registered for the record's entity type. Handler failures stay here; they are logged and
 * reported, never rethrown, so one broken sink cannot block later versions of an aggregate.
 */
public class ChangeNotifier {

  private static final Logger LOG = LoggerFactory.getLogger(ChangeNotifier.class);

  private final SyncHandlerRegistry registry;
  private final DataMaterializationHandler defaultHandler;
  private final ProcessingConfig processingConfig;

  public ChangeNotifier(
      SyncHandlerRegistry registry,
      DataMaterializationHandler defaultHandler,
      ProcessingConfig processingConfig) {
    this.registry = registry;
    this.defaultHandler = defaultHandler;
    this.processingConfig = processingConfig;
  }

  /** Runs the default handler. Errors propagate: a version that cannot be materialized fails. */
  public void materialize(CommandRecord record) {
    if (processingConfig.isDisableDefaultHandler()) {
      LOG.debug("Default handler disabled, not materializing {}", record.commandKey());
      return;
    }
    defaultHandler.up(record);
  }

  /** Invokes every matching handler in registration order. */
  public List<SyncResult> notifyHandlers(CommandRecord record) {
    List<SyncHandler> handlers = registry.handlersFor(record.getEntityType());
    List<SyncResult> results = new ArrayList<>(handlers.size());
    for (SyncHandler handler : handlers) {
      try {
        Object result = handler.up(record);
        results.add(SyncResult.success(handler.name(), result));
        LOG.debug("Handler {} applied {}", handler.name(), record.commandKey());
      } catch (Exception e) {
        HandlerFailureException failure =
            new HandlerFailureException(handler.name(), record.getSortKey(), e);
        LOG.warn(
            "Sync handler failed: handler={} command={} type={}",
            handler.name(),
            record.commandKey(),
            record.getEntityType(),
            e);
        results.add(SyncResult.failure(handler.name(), failure));
      }
    }
    return results;
  }

  /**
   * Explicit rollback through one handler's {@code down}. The default handler is addressed by its
   * name, {@code DataMaterializationHandler}.
   */
  public Object rollback(String handlerName, CommandRecord record) {
    SyncHandler handler =
        defaultHandler.name().equals(handlerName)
            ? defaultHandler
            : registry
                .findByName(handlerName)
                .orElseThrow(() -> new NotFoundException("No sync handler named " + handlerName));
    LOG.info("Rolling back {} through {}", record.commandKey(), handlerName);
    return handler.down(record);
  }
}
