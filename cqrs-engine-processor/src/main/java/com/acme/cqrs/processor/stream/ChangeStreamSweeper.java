package com.acme.cqrs.processor.stream;

import com.acme.cqrs.config.ProcessingConfig;
import com.acme.cqrs.stream.ChangeStreamDispatcher;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the change stream and hands committed command versions to ordering. A tick drains at most
 * {@link #MAX_BATCHES_PER_TICK} batches and stops at the first batch that schedules less than a
 * full batch.
 */
@Singleton
@Requires(property = "processing.sweepers-enabled", notEquals = "false")
public class ChangeStreamSweeper {
  private static final Logger LOG = LoggerFactory.getLogger(ChangeStreamSweeper.class);

  static final int MAX_BATCHES_PER_TICK = 10;

  private final ChangeStreamDispatcher dispatcher;
  private final ProcessingConfig processingConfig;

  public ChangeStreamSweeper(ChangeStreamDispatcher dispatcher, ProcessingConfig processingConfig) {
    this.dispatcher = dispatcher;
    this.processingConfig = processingConfig;
  }

  @Scheduled(fixedDelay = "${processing.change-stream-interval:1s}", initialDelay = "1s")
  public void tick() {
    try {
      int batchSize = processingConfig.getChangeStreamBatchSize();
      int scheduled = 0;
      for (int batch = 0; batch < MAX_BATCHES_PER_TICK; batch++) {
        int drained = dispatcher.drain(batchSize);
        scheduled += drained;
        if (drained < batchSize) {
          break;
        }
      }
      if (scheduled > 0) {
        LOG.debug("Scheduled {} version(s) from the change stream", scheduled);
      }
    } catch (Exception e) {
      LOG.error("Error in ChangeStreamSweeper tick: {}", e.getMessage(), e);
    }
  }
}
