package com.acme.cqrs.domain;

import java.util.Objects;

/**
 * Identity of an aggregate: {@code partitionKey} scopes tenant and entity type, {@code sortKey}
 * names the instance. Command records are addressed with a versioned sort key
 * ({@code sortKey@version}).
 */
public record AggregateKey(String partitionKey, String sortKey) {

  public static final String VERSION_SEPARATOR = "@";
  public static final String KEY_SEPARATOR = "#";

  public AggregateKey {
    Objects.requireNonNull(partitionKey, "partitionKey");
    Objects.requireNonNull(sortKey, "sortKey");
  }

  public static AggregateKey of(String partitionKey, String sortKey) {
    return new AggregateKey(partitionKey, sortKey);
  }

  /** Builds {@code <prefix>#<tenantCode>}. */
  public static String partitionKey(String prefix, String tenantCode) {
    return prefix + KEY_SEPARATOR + tenantCode;
  }

  /** The versioned sort key of this aggregate's command at {@code version}. */
  public String versionedSortKey(int version) {
    return sortKey + VERSION_SEPARATOR + version;
  }

  /** Key of the command record at {@code version}. */
  public AggregateKey atVersion(int version) {
    return new AggregateKey(partitionKey, versionedSortKey(version));
  }

  /** Tenant segment of the partition key: the text after the last {@code #}. */
  public String tenantSegment() {
    int idx = partitionKey.lastIndexOf(KEY_SEPARATOR);
    return idx < 0 ? partitionKey : partitionKey.substring(idx + 1);
  }

  public static String unversioned(String versionedSortKey) {
    int idx = versionedSortKey.lastIndexOf(VERSION_SEPARATOR);
    return idx < 0 ? versionedSortKey : versionedSortKey.substring(0, idx);
  }

  public static int versionOf(String versionedSortKey) {
    int idx = versionedSortKey.lastIndexOf(VERSION_SEPARATOR);
    if (idx < 0) {
      throw new IllegalArgumentException("Sort key has no version suffix: " + versionedSortKey);
    }
    return Integer.parseInt(versionedSortKey.substring(idx + 1));
  }

  @Override
  public String toString() {
    return partitionKey + "/" + sortKey;
  }
}
