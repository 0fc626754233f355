package com.acme.cqrs.core;

import java.util.List;

/** Malformed input, rejected before anything is written. */
public class ValidationException extends PermanentException {

  private final List<String> violations;

  public ValidationException(String message) {
    this(List.of(message));
  }

  public ValidationException(List<String> violations) {
    super("Validation failed: " + String.join("; ", violations));
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
