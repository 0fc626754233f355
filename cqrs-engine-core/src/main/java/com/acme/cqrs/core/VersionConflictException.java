package com.acme.cqrs.core;

import com.acme.cqrs.domain.CommandInput;

/**
 * The optimistic lock was lost: another writer already advanced the aggregate past the version the
 * caller expected. The caller must refetch and resubmit.
 */
public class VersionConflictException extends PermanentException {

  private final String partitionKey;
  private final String sortKey;
  private final int expectedVersion;

  public VersionConflictException(String partitionKey, String sortKey, int expectedVersion) {
    this(
        String.format(
            "Version conflict on %s/%s: expected version %d is no longer current",
            partitionKey, sortKey, expectedVersion),
        partitionKey,
        sortKey,
        expectedVersion);
  }

  private VersionConflictException(
      String message, String partitionKey, String sortKey, int expectedVersion) {
    super(message);
    this.partitionKey = partitionKey;
    this.sortKey = sortKey;
    this.expectedVersion = expectedVersion;
  }

  /** A create request lost against an existing aggregate. */
  public static VersionConflictException alreadyExists(String partitionKey, String sortKey) {
    return new VersionConflictException(
        String.format("Version conflict on %s/%s: aggregate already exists", partitionKey, sortKey),
        partitionKey,
        sortKey,
        CommandInput.VERSION_NEW);
  }

  public String getPartitionKey() {
    return partitionKey;
  }

  public String getSortKey() {
    return sortKey;
  }

  public int getExpectedVersion() {
    return expectedVersion;
  }
}
