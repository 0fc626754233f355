package com.acme.cqrs.processor.config;

import com.acme.cqrs.config.ProcessingConfig;
import com.acme.cqrs.config.TimeoutConfig;
import com.acme.cqrs.sync.SyncHandlerRegistry;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final TimeoutConfig timeoutConfig;
    private final ProcessingConfig processingConfig;
    private final SyncHandlerRegistry handlerRegistry;
    private final List<SequenceProperties> sequences;

    @Value("${db.dialect:IN_MEMORY}")
    protected String dialect;

    @Value("${datasources.default.url:}")
    protected String datasourceUrl;

    @Value("${datasources.default.maximum-pool-size:10}")
    protected int maxPoolSize;

    @Value("${micronaut.executors.ordering.n-threads:0}")
    protected int orderingThreads;

    public ConfigurationLogger(
            TimeoutConfig timeoutConfig,
            ProcessingConfig processingConfig,
            SyncHandlerRegistry handlerRegistry,
            List<SequenceProperties> sequences) {
        this.timeoutConfig = timeoutConfig;
        this.processingConfig = processingConfig;
        this.handlerRegistry = handlerRegistry;
        this.sequences = sequences;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");

        LOG.info("━━━ Storage ━━━");
        LOG.info("  Dialect:            {} (IN_MEMORY when db.dialect is unset)", dialect);
        if (!"IN_MEMORY".equals(dialect)) {
            LOG.info("  JDBC URL:           {}", datasourceUrl);
            LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);
        }

        LOG.info("━━━ Ordering & Timeouts ━━━");
        LOG.info("  Predecessor Wait:   {} (effective, clamped to max invocation)", timeoutConfig.getPredecessorWait());
        LOG.info("  Max Invocation:     {} (longest a version may stay running)", timeoutConfig.getMaxInvocationDuration());
        LOG.info("  Submit Timeout:     {} (synchronous publication wait)", timeoutConfig.getSubmitTimeout());
        LOG.info("  Status Poll:        {}", timeoutConfig.getStatusPollInterval());
        LOG.info("  Pipeline Threads:   {}", orderingThreads);

        LOG.info("━━━ Processing ━━━");
        LOG.info("  Default Handler:    {}", processingConfig.isDisableDefaultHandler() ? "DISABLED" : "ENABLED");
        LOG.info("  Skip Unchanged:     {}", processingConfig.isSkipUnchangedCommands());
        LOG.info("  Latest Retries:     {}", processingConfig.getLatestVersionRetries());
        LOG.info("  Stream Batch:       {}", processingConfig.getChangeStreamBatchSize());
        LOG.info("  Timeout Batch:      {}", processingConfig.getTimeoutSweepBatchSize());
        LOG.info("  Sync Handlers:      {}", handlerRegistry.size());

        LOG.info("━━━ Sequences ━━━");
        if (sequences.isEmpty()) {
            LOG.info("  (none configured, defaults apply)");
        }
        for (SequenceProperties sequence : sequences) {
            LOG.info("  {}: format={} rotateBy={} tenant={}", sequence.getTypeCode(), sequence.getFormat(),
                    sequence.getRotateBy(), sequence.getTenantCode() == null ? "*" : sequence.getTenantCode());
        }
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
