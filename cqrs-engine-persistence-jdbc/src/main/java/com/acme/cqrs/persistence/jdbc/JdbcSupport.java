package com.acme.cqrs.persistence.jdbc;

import com.acme.cqrs.repository.QueryOrder;
import com.acme.cqrs.repository.SortKeyFilter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import javax.sql.DataSource;

/** Connection and binding helpers shared by the JDBC repositories. */
final class JdbcSupport {

  private JdbcSupport() {}

  @FunctionalInterface
  interface SqlWork<T> {
    T apply(Connection connection) throws SQLException;
  }

  /**
   * Run several statements atomically. A connection already bound to a managed transaction
   * (auto-commit off) is used as is; otherwise a local transaction is opened and committed here.
   */
  static <T> T inTransaction(DataSource dataSource, SqlWork<T> work) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      if (!conn.getAutoCommit()) {
        return work.apply(conn);
      }
      conn.setAutoCommit(false);
      try {
        T result = work.apply(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(true);
      }
    }
  }

  static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  static Instant instant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  /** Sort-key condition appended after {@code WHERE pk = ?}; empty for {@code ANY}. */
  static String sortKeyCondition(SortKeyFilter filter) {
    return switch (filter.operator()) {
      case ANY -> "";
      case EQUALS -> " AND sk = ?";
      case BEGINS_WITH -> " AND sk LIKE ? ESCAPE '\\'";
    };
  }

  /** Bind value of a sort-key condition, LIKE wildcards escaped. */
  static String sortKeyParameter(SortKeyFilter filter) {
    if (filter.operator() == SortKeyFilter.Operator.BEGINS_WITH) {
      return filter.value().replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
    }
    return filter.value();
  }

  static String orderBy(QueryOrder order) {
    return order == QueryOrder.DESC ? " ORDER BY sk DESC" : " ORDER BY sk ASC";
  }
}
