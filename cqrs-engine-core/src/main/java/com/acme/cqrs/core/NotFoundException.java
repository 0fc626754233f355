package com.acme.cqrs.core;

public class NotFoundException extends PermanentException {
  public NotFoundException(String message) {
    super(message);
  }
}
