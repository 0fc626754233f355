package com.acme.cqrs.stream;

import com.acme.cqrs.domain.CommandRecord;

/** One committed write to the commands store. {@code oldRecord} is null for inserts. */
public record ChangeEvent(ChangeEventType eventType, CommandRecord newRecord, CommandRecord oldRecord) {

  public static ChangeEvent inserted(CommandRecord record) {
    return new ChangeEvent(ChangeEventType.INSERT, record, null);
  }

  public static ChangeEvent modified(CommandRecord newRecord, CommandRecord oldRecord) {
    return new ChangeEvent(ChangeEventType.MODIFY, newRecord, oldRecord);
  }
}
