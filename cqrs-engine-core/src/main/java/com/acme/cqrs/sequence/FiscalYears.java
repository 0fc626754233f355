package com.acme.cqrs.sequence;

import com.acme.cqrs.core.ValidationException;
import java.time.LocalDate;

final class FiscalYears {

  private FiscalYears() {}

  /**
   * With a register date: the 1-based count of 12-month periods since the register month. Without
   * one: the calendar year in which the fiscal year containing {@code date} began.
   */
  static int fiscalYear(LocalDate date, int startMonth, LocalDate registerDate) {
    if (registerDate != null) {
      int months =
          (date.getYear() - registerDate.getYear()) * 12
              + (date.getMonthValue() - registerDate.getMonthValue());
      if (date.isBefore(registerDate)) {
        throw new ValidationException("Date " + date + " is before register date " + registerDate);
      }
      return Math.floorDiv(months, 12) + 1;
    }
    if (startMonth < 1 || startMonth > 12) {
      throw new ValidationException("startMonth must be 1-12, got " + startMonth);
    }
    return date.getMonthValue() >= startMonth ? date.getYear() : date.getYear() - 1;
  }
}
