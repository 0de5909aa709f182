package com.usagelens.engine.clickhouse;

/**
 * Connection-phase or whole-request timeout. Retried like any other store failure.
 */
public class ClickHouseTimeoutException extends ClickHouseException {

  public ClickHouseTimeoutException(String queryId, String executionId, String message, Throwable cause) {
    super(queryId, executionId, 0, message, cause);
  }
}
