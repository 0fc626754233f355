package com.acme.cqrs.command;

import com.acme.cqrs.core.ValidationException;
import com.acme.cqrs.domain.AggregateKey;
import com.acme.cqrs.domain.CommandInput;
import com.acme.cqrs.domain.PartialUpdateInput;
import java.util.ArrayList;
import java.util.List;

/** Input checks run before anything is read from or written to the stores. */
final class CommandValidator {

  private CommandValidator() {}

  static void validate(CommandInput input, boolean allowLatest) {
    List<String> violations = new ArrayList<>();
    checkKeys(input.getPartitionKey(), input.getSortKey(), violations);
    if (input.getVersion() < CommandInput.VERSION_NEW) {
      violations.add("version must be >= 0, -1 for latest or -2 for a new aggregate");
    } else if (input.getVersion() != CommandInput.VERSION_NEW) {
      checkVersion(input.getVersion(), allowLatest, violations);
    }
    if (isBlank(input.getTenantCode())) {
      violations.add("tenantCode is required");
    }
    if (isBlank(input.getEntityType())) {
      violations.add("entityType is required");
    }
    if (!isBlank(input.getPartitionKey()) && !isBlank(input.getTenantCode())) {
      String tenant = AggregateKey.of(input.getPartitionKey(), "").tenantSegment();
      if (!tenant.equals(input.getTenantCode())) {
        violations.add(
            "partitionKey tenant '" + tenant + "' does not match tenantCode '"
                + input.getTenantCode() + "'");
      }
    }
    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
  }

  static void validate(PartialUpdateInput input, boolean allowLatest) {
    List<String> violations = new ArrayList<>();
    checkKeys(input.getPartitionKey(), input.getSortKey(), violations);
    checkVersion(input.getVersion(), allowLatest, violations);
    if (!violations.isEmpty()) {
      throw new ValidationException(violations);
    }
  }

  private static void checkKeys(String partitionKey, String sortKey, List<String> violations) {
    if (isBlank(partitionKey)) {
      violations.add("partitionKey is required");
    }
    if (isBlank(sortKey)) {
      violations.add("sortKey is required");
    } else if (sortKey.contains(AggregateKey.VERSION_SEPARATOR)) {
      violations.add("sortKey must not contain '" + AggregateKey.VERSION_SEPARATOR + "'");
    }
  }

  private static void checkVersion(int version, boolean allowLatest, List<String> violations) {
    if (version < CommandInput.VERSION_LATEST) {
      violations.add("version must be >= 0, or -1 for latest");
    } else if (version == CommandInput.VERSION_LATEST && !allowLatest) {
      violations.add("version -1 (latest) is only accepted for asynchronous publication");
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
