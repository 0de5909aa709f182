package com.usagelens.engine.metrics;

import com.usagelens.engine.clickhouse.QueryCompletion;
import com.usagelens.engine.clickhouse.QueryCompletionListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Records store round trips per logical query id.
 */
@RequiredArgsConstructor
@Slf4j
public class MicrometerQueryCompletionListener implements QueryCompletionListener {

  public static final String DURATION = "usage_clickhouse_query_duration";
  public static final String RETRIES = "usage_clickhouse_query_retries";

  private final MeterRegistry registry;

  @Override
  public void onCompleted(QueryCompletion completion) {
    Timer.builder(DURATION)
        .description("Duration of ClickHouse queries, retries included")
        .tag("query_id", completion.queryId())
        .tag("status", completion.status())
        .register(registry)
        .record(completion.elapsed());
    if (!completion.succeeded()) {
      log.debug("clickhouse query recorded as failed queryId={} retries={}", completion.queryId(),
          completion.retries());
    }
  }

  @Override
  public void onRetry(String queryId, int retry) {
    Counter.builder(RETRIES)
        .description("ClickHouse query retries")
        .tag("query_id", queryId)
        .register(registry)
        .increment();
  }
}
