package com.acme.cqrs.sequence;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Settings held in memory. A tenant-specific entry wins over the type-wide one. */
public class InMemorySequenceSettingsRegistry implements SequenceSettingsRegistry {

  private final Map<String, SequenceSettings> settings = new ConcurrentHashMap<>();

  public InMemorySequenceSettingsRegistry register(String typeCode, SequenceSettings value) {
    settings.put(typeCode, value);
    return this;
  }

  public InMemorySequenceSettingsRegistry register(
      String tenantCode, String typeCode, SequenceSettings value) {
    settings.put(tenantCode + "#" + typeCode, value);
    return this;
  }

  @Override
  public Optional<SequenceSettings> find(String tenantCode, String typeCode) {
    SequenceSettings tenantSpecific = settings.get(tenantCode + "#" + typeCode);
    return Optional.ofNullable(tenantSpecific != null ? tenantSpecific : settings.get(typeCode));
  }
}
