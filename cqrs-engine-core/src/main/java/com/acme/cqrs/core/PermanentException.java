package com.acme.cqrs.core;

/** Failure that will not go away on retry of the same request. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
