package com.acme.cqrs.core;

/** Wraps an error raised by a sync handler. Contained by the notifier, never rethrown. */
public class HandlerFailureException extends RuntimeException {

  private final String handlerName;

  public HandlerFailureException(String handlerName, String commandSortKey, Throwable cause) {
    super("Handler " + handlerName + " failed for " + commandSortKey + ": " + cause.getMessage(), cause);
    this.handlerName = handlerName;
  }

  public String getHandlerName() {
    return handlerName;
  }
}
