package com.acme.cqrs.stream;

public enum ChangeEventType {
  INSERT,
  MODIFY,
  REMOVE
}
