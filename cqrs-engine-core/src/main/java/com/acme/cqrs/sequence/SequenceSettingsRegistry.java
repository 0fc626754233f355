package com.acme.cqrs.sequence;

import java.util.Optional;

/** Stored sequence configuration, looked up per tenant and type. */
public interface SequenceSettingsRegistry {

  Optional<SequenceSettings> find(String tenantCode, String typeCode);
}
