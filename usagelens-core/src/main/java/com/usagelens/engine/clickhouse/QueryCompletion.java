package com.usagelens.engine.clickhouse;

import java.time.Duration;

/**
 * Outcome of one logical query or insert, across all of its retries.
 */
public record QueryCompletion(
    String queryId,
    String executionId,
    Duration elapsed,
    int retries,
    Throwable error
) {

  public boolean succeeded() {
    return error == null;
  }

  public String status() {
    if (error == null) {
      return "ok";
    }
    return error instanceof ClickHouseTimeoutException ? "timeout" : "error";
  }
}
