package com.acme.cqrs.processor.ordering;

import com.acme.cqrs.config.ProcessingConfig;
import com.acme.cqrs.ordering.BaseOrderingOrchestrator;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fails versions waiting past their predecessor deadline or stalled while running. */
@Singleton
@Requires(property = "processing.sweepers-enabled", notEquals = "false")
public class TimeoutSweeper {
  private static final Logger LOG = LoggerFactory.getLogger(TimeoutSweeper.class);

  private final BaseOrderingOrchestrator orchestrator;
  private final ProcessingConfig processingConfig;

  public TimeoutSweeper(BaseOrderingOrchestrator orchestrator, ProcessingConfig processingConfig) {
    this.orchestrator = orchestrator;
    this.processingConfig = processingConfig;
  }

  @Scheduled(fixedDelay = "${processing.timeout-sweep-interval:5s}", initialDelay = "5s")
  public void tick() {
    try {
      int expired = orchestrator.expireOverdue(processingConfig.getTimeoutSweepBatchSize());
      if (expired > 0) {
        LOG.info("Expired {} overdue version(s)", expired);
      }
    } catch (Exception e) {
      LOG.error("Error in TimeoutSweeper tick: {}", e.getMessage(), e);
    }
  }
}
