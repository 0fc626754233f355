package com.acme.cqrs.processor.sync;

import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.sync.SyncHandler;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one audit line per processed version to the {@code audit} logger. Enabled with
 * {@code sync.audit-log.enabled=true}; {@code sync.audit-log.scope} limits it to one entity type.
 */
@Singleton
@Requires(property = "sync.audit-log.enabled", value = "true")
public class AuditLogSyncHandler implements SyncHandler {

    private static final Logger AUDIT = LoggerFactory.getLogger("audit");

    private final String scope;

    public AuditLogSyncHandler(@Value("${sync.audit-log.scope:*}") String scope) {
        this.scope = scope;
    }

    @Override
    public String scope() {
        return scope;
    }

    @Override
    public Map<String, Object> up(CommandRecord record) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("key", record.aggregateKey().toString());
        entry.put("version", record.getVersion());
        entry.put("deleted", record.isDeleted());
        entry.put("by", record.getUpdatedBy());
        entry.put("requestId", record.getRequestId());
        AUDIT.info("{} {}@{} by={} requestId={} deleted={}", record.getEntityType(), record.aggregateKey(),
                record.getVersion(), record.getUpdatedBy(), record.getRequestId(), record.isDeleted());
        return entry;
    }

    @Override
    public Map<String, Object> down(CommandRecord record) {
        AUDIT.info("{} {}@{} rolled back", record.getEntityType(), record.aggregateKey(), record.getVersion());
        return Map.of("key", record.aggregateKey().toString(), "version", record.getVersion(), "rolledBack", true);
    }
}
