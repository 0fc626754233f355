package com.acme.cqrs.command;

import com.acme.cqrs.config.ProcessingConfig;
import com.acme.cqrs.config.TimeoutConfig;
import com.acme.cqrs.core.CommandFailedException;
import com.acme.cqrs.core.Jsons;
import com.acme.cqrs.core.NotFoundException;
import com.acme.cqrs.core.VersionConflictException;
import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandInput;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.CommandStatus;
import com.acme.cqrs.domain.DataRecord;
import com.acme.cqrs.domain.InvocationContext;
import com.acme.cqrs.domain.PartialUpdateInput;
import com.acme.cqrs.ordering.BaseOrderingOrchestrator;
import com.acme.cqrs.ordering.OrderingTask;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.DataRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write side entry point. Validates a mutation, assigns it the next version of its aggregate under
 * an optimistic lock and appends it to the commands store. Asynchronous publication returns once
 * the record is durable; synchronous publication also waits for the version to be materialized and
 * dispatched.
 */
public class CommandProcessor {

  private static final Logger LOG = LoggerFactory.getLogger(CommandProcessor.class);

  private final CommandRepository commandRepository;
  private final DataRepository dataRepository;
  private final BaseOrderingOrchestrator orchestrator;
  private final TimeoutConfig timeoutConfig;
  private final ProcessingConfig processingConfig;
  private final Clock clock;

  public CommandProcessor(
      CommandRepository commandRepository,
      DataRepository dataRepository,
      BaseOrderingOrchestrator orchestrator,
      TimeoutConfig timeoutConfig,
      ProcessingConfig processingConfig,
      Clock clock) {
    this.commandRepository = commandRepository;
    this.dataRepository = dataRepository;
    this.orchestrator = orchestrator;
    this.timeoutConfig = timeoutConfig;
    this.processingConfig = processingConfig;
    this.clock = clock;
  }

  /**
   * Persist a full command. Downstream processing is triggered by the change stream.
   *
   * @return the written record, or the current one when the command changes nothing
   * @throws com.acme.cqrs.core.ValidationException for malformed input
   * @throws VersionConflictException when {@code version} is no longer current
   * @throws NotFoundException when a non-zero version is expected for an unknown aggregate
   */
  public CommandRecord publishAsync(CommandInput input, InvocationContext context) {
    CommandValidator.validate(input, true);
    return persistWithRetry(input.getVersion(), () -> input, context).record();
  }

  public CommandRecord publishSync(CommandInput input, InvocationContext context) {
    return publishSync(input, context, timeoutConfig.getSubmitTimeout());
  }

  /**
   * Persist a full command and wait until its version is processed.
   *
   * @throws CommandFailedException when the version ends FAILED
   * @throws com.acme.cqrs.core.SubmissionTimeoutException when {@code timeout} elapses first; the
   *     command stays persisted
   */
  public CommandRecord publishSync(CommandInput input, InvocationContext context, Duration timeout) {
    CommandValidator.validate(input, false);
    return awaitProcessed(persistWithRetry(input.getVersion(), () -> input, context), timeout);
  }

  /** Merge a sparse patch onto the latest version and publish the result asynchronously. */
  public CommandRecord publishPartialUpdateAsync(PartialUpdateInput patch, InvocationContext context) {
    CommandValidator.validate(patch, true);
    return persistWithRetry(patch.getVersion(), () -> mergePatch(patch), context).record();
  }

  public CommandRecord publishPartialUpdateSync(PartialUpdateInput patch, InvocationContext context) {
    return publishPartialUpdateSync(patch, context, timeoutConfig.getSubmitTimeout());
  }

  public CommandRecord publishPartialUpdateSync(
      PartialUpdateInput patch, InvocationContext context, Duration timeout) {
    CommandValidator.validate(patch, false);
    return awaitProcessed(persistWithRetry(patch.getVersion(), () -> mergePatch(patch), context), timeout);
  }

  /** Status polling: the command record of one version, with its current status. */
  public Optional<CommandRecord> findCommand(AggregateKey aggregateKey, int version) {
    return commandRepository.find(aggregateKey.atVersion(version));
  }

  private CommandRecord awaitProcessed(Persisted persisted, Duration timeout) {
    CommandRecord record = persisted.record();
    if (!persisted.written()) {
      return record;
    }
    orchestrator.schedule(record);
    OrderingTask task = orchestrator.awaitTerminal(record.aggregateKey(), record.getVersion(), timeout);
    if (task.isFailed()) {
      throw new CommandFailedException(record.getSortKey(), task.error());
    }
    return commandRepository.find(record.commandKey()).orElse(record);
  }

  private Persisted persistWithRetry(
      int requestedVersion, Supplier<CommandInput> input, InvocationContext context) {
    int attempts =
        requestedVersion == CommandInput.VERSION_LATEST
            ? Math.max(1, processingConfig.getLatestVersionRetries())
            : 1;
    for (int attempt = 1; ; attempt++) {
      try {
        return persist(input.get(), context);
      } catch (VersionConflictException e) {
        if (attempt >= attempts) {
          throw e;
        }
        LOG.debug("Retrying latest-version publication after conflict: attempt={}", attempt, e);
      }
    }
  }

  private Persisted persist(CommandInput input, InvocationContext context) {
    AggregateKey key = input.aggregateKey();
    Optional<CommandRecord> latest = commandRepository.findLatest(key);
    int expected =
        input.getVersion() == CommandInput.VERSION_LATEST
            ? latest.map(CommandRecord::getVersion).orElse(CommandInput.VERSION_NEW)
            : input.getVersion();

    int nextVersion;
    if (expected == CommandInput.VERSION_NEW) {
      if (latest.isPresent()) {
        throw VersionConflictException.alreadyExists(key.partitionKey(), key.sortKey());
      }
      nextVersion = 0;
    } else if (latest.isEmpty()) {
      throw new NotFoundException(
          "No versions of " + key + " exist, cannot apply expected version " + expected);
    } else {
      CommandRecord current = latest.get();
      if (current.getVersion() != expected) {
        throw new VersionConflictException(key.partitionKey(), key.sortKey(), expected);
      }
      if (processingConfig.isSkipUnchangedCommands() && isUnchanged(current, input)) {
        LOG.info("Unchanged command not published: {} version={}", key, current.getVersion());
        return new Persisted(current, false);
      }
      nextVersion = expected + 1;
    }

    CommandRecord record = toRecord(input, nextVersion, latest.orElse(null), context);
    if (!commandRepository.insertIfAbsent(record)) {
      throw expected == CommandInput.VERSION_NEW
          ? VersionConflictException.alreadyExists(key.partitionKey(), key.sortKey())
          : new VersionConflictException(key.partitionKey(), key.sortKey(), expected);
    }
    LOG.info(
        "Published command: {} version={} type={} source={}",
        key,
        nextVersion,
        record.getEntityType(),
        record.getSourceLabel());
    return new Persisted(record, true);
  }

  /**
   * The patch applies to the materialized state, so content of versions that failed or were
   * aborted is not carried forward. The optimistic lock still checks the command chain.
   */
  private CommandInput mergePatch(PartialUpdateInput patch) {
    AggregateKey key = patch.aggregateKey();
    CommandRecord latest =
        commandRepository
            .findLatest(key)
            .orElseThrow(() -> new NotFoundException("No versions of " + key + " to update"));
    if (patch.getVersion() != CommandInput.VERSION_LATEST && patch.getVersion() != latest.getVersion()) {
      throw new VersionConflictException(key.partitionKey(), key.sortKey(), patch.getVersion());
    }
    DataRecord current =
        dataRepository
            .find(key)
            .orElseThrow(() -> new NotFoundException("No materialized state of " + key + " to update"));
    return CommandInput.builder()
        .partitionKey(current.getPartitionKey())
        .sortKey(key.sortKey())
        .version(latest.getVersion())
        .entityId(current.getEntityId())
        .tenantCode(current.getTenantCode())
        .entityType(current.getEntityType())
        .displayName(patch.getDisplayName() != null ? patch.getDisplayName() : current.getDisplayName())
        .businessCode(
            patch.getBusinessCode() != null ? patch.getBusinessCode() : current.getBusinessCode())
        .deleted(patch.getDeleted() != null ? patch.getDeleted() : current.isDeleted())
        .sequenceNo(patch.getSequenceNo() != null ? patch.getSequenceNo() : current.getSequenceNo())
        .ttl(patch.getTtl() != null ? patch.getTtl() : current.getTtl())
        .attributes(Jsons.merge(current.getAttributes(), patch.getAttributes()))
        .build();
  }

  private static boolean isUnchanged(CommandRecord current, CommandInput input) {
    return Objects.equals(current.getEntityId(), input.getEntityId())
        && Objects.equals(current.getBusinessCode(), input.getBusinessCode())
        && Objects.equals(current.getDisplayName(), input.getDisplayName())
        && Objects.equals(current.getTenantCode(), input.getTenantCode())
        && Objects.equals(current.getEntityType(), input.getEntityType())
        && current.isDeleted() == input.isDeleted()
        && Objects.equals(current.getSequenceNo(), input.getSequenceNo())
        && Objects.equals(current.getTtl(), input.getTtl())
        && Jsons.sameContent(current.getAttributes(), input.getAttributes());
  }

  private CommandRecord toRecord(
      CommandInput input, int version, CommandRecord previous, InvocationContext context) {
    Instant now = clock.instant();
    AggregateKey key = input.aggregateKey();
    return CommandRecord.builder()
        .partitionKey(key.partitionKey())
        .sortKey(key.versionedSortKey(version))
        .version(version)
        .entityId(input.getEntityId())
        .businessCode(input.getBusinessCode())
        .displayName(input.getDisplayName())
        .tenantCode(input.getTenantCode())
        .entityType(input.getEntityType())
        .deleted(input.isDeleted())
        .sequenceNo(input.getSequenceNo())
        .ttl(input.getTtl())
        .attributes(input.getAttributes() == null ? Map.of() : input.getAttributes())
        .status(CommandStatus.PENDING)
        .sourceLabel(context.sourceLabel())
        .requestId(context.requestId())
        .createdAt(previous == null ? now : previous.getCreatedAt())
        .createdBy(previous == null ? context.userId() : previous.getCreatedBy())
        .createdIp(previous == null ? context.ip() : previous.getCreatedIp())
        .updatedAt(now)
        .updatedBy(context.userId())
        .updatedIp(context.ip())
        .build();
  }

  private record Persisted(CommandRecord record, boolean written) {}
}
