package com.usagelens.engine.clickhouse;

import com.usagelens.engine.sql.SqlStatement;

import java.time.Duration;
import java.util.Objects;

/**
 * @param queryId stable, human-readable name of the query such as {@code count_operations_daily}
 * @param timeout caller timeout; capped by the global ceiling
 */
public record QueryRequest(SqlStatement statement, String queryId, Duration timeout) {

  public QueryRequest {
    Objects.requireNonNull(statement, "statement");
    if (queryId == null || queryId.isBlank()) {
      throw new IllegalArgumentException("queryId is required");
    }
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  public static QueryRequest of(SqlStatement statement, String queryId, Duration timeout) {
    return new QueryRequest(statement, queryId, timeout);
  }
}
