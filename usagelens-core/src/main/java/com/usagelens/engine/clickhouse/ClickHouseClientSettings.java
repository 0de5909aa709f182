package com.usagelens.engine.clickhouse;

import java.time.Duration;
import java.util.Objects;

public record ClickHouseClientSettings(
    Duration requestTimeoutCeiling,
    RetryPolicy readRetry,
    RetryPolicy insertRetry,
    Duration asyncInsertBusyTimeout,
    long asyncInsertMaxDataSize
) {

  public ClickHouseClientSettings {
    Objects.requireNonNull(requestTimeoutCeiling, "requestTimeoutCeiling");
    readRetry = readRetry == null ? RetryPolicy.reads() : readRetry;
    insertRetry = insertRetry == null ? RetryPolicy.inserts() : insertRetry;
    asyncInsertBusyTimeout = asyncInsertBusyTimeout == null ? Duration.ofSeconds(30) : asyncInsertBusyTimeout;
    if (asyncInsertMaxDataSize <= 0) {
      asyncInsertMaxDataSize = 200_000_000L;
    }
  }

  public static ClickHouseClientSettings defaults() {
    return new ClickHouseClientSettings(Duration.ofSeconds(60), RetryPolicy.reads(), RetryPolicy.inserts(), null, 0);
  }
}
