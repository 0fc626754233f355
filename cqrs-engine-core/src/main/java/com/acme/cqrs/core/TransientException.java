package com.acme.cqrs.core;

/** Failure that may succeed when retried later (infrastructure hiccup, timeout). */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
