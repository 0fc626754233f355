package com.acme.cqrs.sync;

/** Outcome of one handler invocation. {@code error} is null on success. */
public record SyncResult(String handlerName, Object result, Throwable error) {

  public static SyncResult success(String handlerName, Object result) {
    return new SyncResult(handlerName, result, null);
  }

  public static SyncResult failure(String handlerName, Throwable error) {
    return new SyncResult(handlerName, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
