package com.acme.cqrs.core;

import java.time.Duration;

/**
 * A synchronous publication did not observe a terminal state within the caller's timeout. The
 * command is persisted and may still complete; its status can be polled.
 */
public class SubmissionTimeoutException extends TransientException {
  public SubmissionTimeoutException(String commandSortKey, Duration timeout) {
    super("Command " + commandSortKey + " did not finish within " + timeout);
  }
}
