package com.usagelens.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.usagelens.engine.clickhouse.ClickHouseClient;
import com.usagelens.engine.clickhouse.ClickHouseClientSettings;
import com.usagelens.engine.clickhouse.ClickHouseHttpPool;
import com.usagelens.engine.clickhouse.ClickHouseRequestFactory;
import com.usagelens.engine.clickhouse.QueryCompletionListener;
import com.usagelens.engine.clickhouse.ClickHouseResponse;
import com.usagelens.engine.clickhouse.QueryDeduplicator;
import com.usagelens.engine.clickhouse.RetryPolicy;
import com.usagelens.engine.metrics.MicrometerQueryCompletionListener;
import com.usagelens.engine.reader.ClickHouseUsageAnalyticsReader;
import com.usagelens.engine.reader.CollectedOperationsCache;
import com.usagelens.engine.reader.UsageAnalyticsReader;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(UsageProperties.class)
public class UsageEngineConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "close")
  public ClickHouseHttpPool clickHouseHttpPool(UsageProperties properties) {
    UsageProperties.ClickHouse cfg = properties.clickhouse();
    return new ClickHouseHttpPool(cfg.connectTimeout(), cfg.maxSockets());
  }

  @Bean
  public ClickHouseRequestFactory clickHouseRequestFactory(UsageProperties properties) {
    UsageProperties.ClickHouse cfg = properties.clickhouse();
    return new ClickHouseRequestFactory(
        ClickHouseRequestFactory.endpoint(cfg.protocol(), cfg.host(), cfg.port()),
        cfg.username(),
        cfg.password()
    );
  }

  @Bean
  public QueryDeduplicator<ClickHouseResponse> queryDeduplicator() {
    return new QueryDeduplicator<>();
  }

  @Bean
  public QueryCompletionListener queryCompletionListener(ObjectProvider<MeterRegistry> registry) {
    MeterRegistry meterRegistry = registry.getIfAvailable();
    return meterRegistry == null ? QueryCompletionListener.noop() : new MicrometerQueryCompletionListener(meterRegistry);
  }

  @Bean
  public ClickHouseClient clickHouseClient(
      UsageProperties properties,
      ClickHouseHttpPool pool,
      ClickHouseRequestFactory requestFactory,
      ObjectProvider<ObjectMapper> objectMapper,
      QueryDeduplicator<ClickHouseResponse> deduplicator,
      QueryCompletionListener listener
  ) {
    UsageProperties.ClickHouse cfg = properties.clickhouse();
    ClickHouseClientSettings settings = new ClickHouseClientSettings(
        cfg.requestTimeoutCeiling(),
        buildRetryPolicy(cfg.readRetry()),
        buildRetryPolicy(cfg.insertRetry()),
        cfg.insert().asyncInsertBusyTimeout(),
        cfg.insert().asyncInsertMaxDataSize()
    );
    ObjectMapper mapper = objectMapper.getIfAvailable(() -> new ObjectMapper().findAndRegisterModules());
    return new ClickHouseClient(pool, requestFactory, mapper, deduplicator, settings, listener);
  }

  @Bean
  public CollectedOperationsCache collectedOperationsCache(UsageProperties properties) {
    UsageProperties.CollectedOperations cfg = properties.cache().collectedOperations();
    return new CollectedOperationsCache(cfg.capacity(), cfg.ttl());
  }

  @Bean
  public UsageAnalyticsReader usageAnalyticsReader(
      UsageProperties properties,
      ClickHouseClient client,
      Clock clock,
      CollectedOperationsCache collectedOperationsCache
  ) {
    UsageProperties.Batching batching = properties.batching();
    return new ClickHouseUsageAnalyticsReader(
        client,
        clock,
        collectedOperationsCache,
        properties.sql().longArrayCharLimit(),
        batching.maxBatchSize(),
        CompletableFuture.delayedExecutor(batching.window().toNanos(), TimeUnit.NANOSECONDS)
    );
  }

  private static RetryPolicy buildRetryPolicy(UsageProperties.Retry cfg) {
    return new RetryPolicy(
        Math.max(0, cfg.maxRetries()),
        Math.max(0, cfg.backoffStep().toMillis()),
        Math.max(0, cfg.maxJitter().toMillis())
    );
  }
}
