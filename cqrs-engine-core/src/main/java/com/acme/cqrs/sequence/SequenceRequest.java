package com.acme.cqrs.sequence;

import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A request for the next number of a sequence type. {@code params} both scope the counter and feed
 * the template; {@code date} defaults to today.
 */
@Value
@Builder(toBuilder = true)
public class SequenceRequest {

  String tenantCode;
  String typeCode;
  @Builder.Default Map<String, String> params = Map.of();
  LocalDate date;
}
