package com.acme.cqrs.sequence;

import com.acme.cqrs.core.ValidationException;
import java.util.Locale;

/** Rotation policy of a counter: which period bucket a date falls into. */
public enum RotateBy {
  NONE,
  DAILY,
  MONTHLY,
  YEARLY,
  FISCAL_YEARLY;

  /** Accepts the configuration spelling, e.g. {@code fiscal-yearly} or {@code monthly}. */
  public static RotateBy parse(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    try {
      return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Unknown rotation: " + value);
    }
  }
}
