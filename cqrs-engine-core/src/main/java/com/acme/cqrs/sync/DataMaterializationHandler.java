package com.acme.cqrs.sync;

import com.acme.cqrs.core.NotFoundException;
import com.acme.cqrs.domain.CommandRecord;
import com.acme.cqrs.domain.DataRecord;
import com.acme.cqrs.repository.CommandRepository;
import com.acme.cqrs.repository.DataRepository;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in handler that writes a command's net effect into the data store. Writing an already
 * materialized version again is a no-op.
 */
public class DataMaterializationHandler implements SyncHandler {

  private static final Logger LOG = LoggerFactory.getLogger(DataMaterializationHandler.class);

  private final DataRepository dataRepository;
  private final CommandRepository commandRepository;

  public DataMaterializationHandler(
      DataRepository dataRepository, CommandRepository commandRepository) {
    this.dataRepository = dataRepository;
    this.commandRepository = commandRepository;
  }

  @Override
  public DataRecord up(CommandRecord record) {
    Optional<DataRecord> previous = dataRepository.find(record.aggregateKey());
    DataRecord data = DataRecord.fromCommand(record, previous.orElse(null));
    if (dataRepository.upsertIfNewer(data)) {
      LOG.debug("Materialized {} version={}", data.key(), data.getVersion());
      return data;
    }
    LOG.debug(
        "Skipped materialization of {} version={}, store already at version={}",
        data.key(),
        data.getVersion(),
        previous.map(DataRecord::getVersion).orElse(-1));
    return previous.orElse(data);
  }

  /** Restores the data record to the version before {@code record}. */
  @Override
  public DataRecord down(CommandRecord record) {
    DataRecord current =
        dataRepository
            .find(record.aggregateKey())
            .orElseThrow(() -> new NotFoundException("No data for " + record.aggregateKey()));
    DataRecord restored;
    if (record.getVersion() == 0) {
      restored = current.toBuilder().deleted(true).build();
    } else {
      CommandRecord previous =
          commandRepository
              .find(record.aggregateKey().atVersion(record.getVersion() - 1))
              .orElseThrow(
                  () ->
                      new NotFoundException(
                          "No command for " + record.aggregateKey().atVersion(record.getVersion() - 1)));
      restored = DataRecord.fromCommand(previous, current);
    }
    dataRepository.replace(restored);
    LOG.info("Rolled back {} to version={}", restored.key(), restored.getVersion());
    return restored;
  }
}
