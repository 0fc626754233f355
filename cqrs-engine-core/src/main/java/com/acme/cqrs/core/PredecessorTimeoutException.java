package com.acme.cqrs.core;

import java.time.Duration;

/** A version waited longer than allowed for its predecessor to finish. */
public class PredecessorTimeoutException extends TransientException {
  public PredecessorTimeoutException(String partitionKey, String sortKey, int version, Duration waited) {
    super(
        String.format(
            "PredecessorTimeout: %s/%s@%d waited %s for version %d",
            partitionKey, sortKey, version, waited, version - 1));
  }
}
