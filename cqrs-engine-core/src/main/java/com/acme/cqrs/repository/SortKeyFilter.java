package com.acme.cqrs.repository;

/** Sort-key condition of a partition query. */
public record SortKeyFilter(Operator operator, String value) {

  public enum Operator {
    ANY,
    EQUALS,
    BEGINS_WITH
  }

  public static SortKeyFilter any() {
    return new SortKeyFilter(Operator.ANY, null);
  }

  public static SortKeyFilter equalTo(String value) {
    return new SortKeyFilter(Operator.EQUALS, value);
  }

  public static SortKeyFilter beginsWith(String prefix) {
    return new SortKeyFilter(Operator.BEGINS_WITH, prefix);
  }

  public boolean matches(String sortKey) {
    return switch (operator) {
      case ANY -> true;
      case EQUALS -> sortKey.equals(value);
      case BEGINS_WITH -> sortKey.startsWith(value);
    };
  }
}
