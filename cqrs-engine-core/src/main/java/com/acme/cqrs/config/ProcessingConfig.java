package com.acme.cqrs.config;

/**
 * Command processing switches and batch sizes. Pure POJO - no framework dependencies.
 */
public class ProcessingConfig {

  private boolean disableDefaultHandler = false;
  private boolean skipUnchangedCommands = true;
  private int latestVersionRetries = 3;
  private int changeStreamBatchSize = 100;
  private int timeoutSweepBatchSize = 100;

  /** When true, committed commands are not materialized into the data store. */
  public boolean isDisableDefaultHandler() {
    return disableDefaultHandler;
  }

  public void setDisableDefaultHandler(boolean disableDefaultHandler) {
    this.disableDefaultHandler = disableDefaultHandler;
  }

  /** When true, a command whose content equals the current state does not create a new version. */
  public boolean isSkipUnchangedCommands() {
    return skipUnchangedCommands;
  }

  public void setSkipUnchangedCommands(boolean skipUnchangedCommands) {
    this.skipUnchangedCommands = skipUnchangedCommands;
  }

  /** Attempts made for a LATEST-version publication before the conflict is surfaced. */
  public int getLatestVersionRetries() {
    return latestVersionRetries;
  }

  public void setLatestVersionRetries(int latestVersionRetries) {
    this.latestVersionRetries = latestVersionRetries;
  }

  public int getChangeStreamBatchSize() {
    return changeStreamBatchSize;
  }

  public void setChangeStreamBatchSize(int changeStreamBatchSize) {
    this.changeStreamBatchSize = changeStreamBatchSize;
  }

  public int getTimeoutSweepBatchSize() {
    return timeoutSweepBatchSize;
  }

  public void setTimeoutSweepBatchSize(int timeoutSweepBatchSize) {
    this.timeoutSweepBatchSize = timeoutSweepBatchSize;
  }
}
