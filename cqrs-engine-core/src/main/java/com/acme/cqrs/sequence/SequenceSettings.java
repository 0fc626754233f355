package com.acme.cqrs.sequence;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Formatting and rotation rules of one sequence type. */
@Value
@Builder(toBuilder = true)
public class SequenceSettings {

  public static final int DEFAULT_START_MONTH = 4;

  /** Template with {@code %%name%%} or {@code %%name#:0>N%%} placeholders. */
  @Builder.Default String format = "%%no%%";

  @Builder.Default RotateBy rotateBy = RotateBy.NONE;

  /** First month of the fiscal year, 1-12. Ignored when {@code registerDate} is set. */
  @Builder.Default int startMonth = DEFAULT_START_MONTH;

  /** Start of the first fiscal year; fiscal years then count 12-month periods from it. */
  LocalDate registerDate;
}
