package com.usagelens.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "usage")
public record UsageProperties(
    @Valid ClickHouse clickhouse,
    @Valid SqlLimits sql,
    @Valid Batching batching,
    @Valid Cache cache
) {

  public UsageProperties {
    if (clickhouse == null) {
      clickhouse = defaultClickHouse();
    }
    if (sql == null) {
      sql = new SqlLimits(null);
    }
    if (batching == null) {
      batching = new Batching(null, null);
    }
    if (cache == null) {
      cache = new Cache(null);
    }
  }

  private static ClickHouse defaultClickHouse() {
    return new ClickHouse(null, null, null, null, null, null, null, null, null, null, null);
  }

  public record ClickHouse(
      @Pattern(regexp = "https?") String protocol,
      String host,
      @Min(1) @Max(65535) Integer port,
      String username,
      String password,
      /**
       * Global ceiling for a single request. Caller timeouts above it are capped.
       */
      @NotNull Duration requestTimeoutCeiling,
      @NotNull Duration connectTimeout,
      @NotNull @Positive Integer maxSockets,
      @Valid Retry readRetry,
      @Valid Retry insertRetry,
      @Valid Insert insert
  ) {
    public ClickHouse {
      if (protocol == null || protocol.isBlank()) {
        protocol = "http";
      }
      if (host == null || host.isBlank()) {
        host = "localhost";
      }
      if (port == null) {
        port = 8123;
      }
      if (username == null) {
        username = "default";
      }
      if (password == null) {
        password = "";
      }
      if (requestTimeoutCeiling == null) {
        requestTimeoutCeiling = Duration.ofSeconds(60);
      }
      if (connectTimeout == null) {
        connectTimeout = Duration.ofSeconds(5);
      }
      if (maxSockets == null) {
        maxSockets = 32;
      }
      if (readRetry == null) {
        readRetry = new Retry(5, Duration.ofMillis(250), Duration.ofMillis(100));
      }
      if (insertRetry == null) {
        insertRetry = new Retry(5, Duration.ofMillis(500), Duration.ofMillis(100));
      }
      if (insert == null) {
        insert = new Insert(null, null);
      }
    }
  }

  public record Retry(
      @NotNull @PositiveOrZero Integer maxRetries,
      @NotNull Duration backoffStep,
      @NotNull Duration maxJitter
  ) {
    public Retry {
      if (maxRetries == null) {
        maxRetries = 5;
      }
      if (backoffStep == null) {
        backoffStep = Duration.ofMillis(250);
      }
      if (maxJitter == null) {
        maxJitter = Duration.ofMillis(100);
      }
    }
  }

  public record Insert(
      @NotNull Duration asyncInsertBusyTimeout,
      @NotNull @Positive Long asyncInsertMaxDataSize
  ) {
    public Insert {
      if (asyncInsertBusyTimeout == null) {
        asyncInsertBusyTimeout = Duration.ofSeconds(30);
      }
      if (asyncInsertMaxDataSize == null) {
        asyncInsertMaxDataSize = 200_000_000L;
      }
    }
  }

  public record SqlLimits(@NotNull @Positive Integer longArrayCharLimit) {
    public SqlLimits {
      if (longArrayCharLimit == null) {
        longArrayCharLimit = 10_000;
      }
    }
  }

  public record Batching(@NotNull Duration window, @NotNull @Positive Integer maxBatchSize) {
    public Batching {
      if (window == null) {
        window = Duration.ofMillis(2);
      }
      if (maxBatchSize == null) {
        maxBatchSize = 200;
      }
    }
  }

  public record Cache(@Valid CollectedOperations collectedOperations) {
    public Cache {
      if (collectedOperations == null) {
        collectedOperations = new CollectedOperations(null, null);
      }
    }
  }

  public record CollectedOperations(@NotNull @Positive Long capacity, @NotNull Duration ttl) {
    public CollectedOperations {
      if (capacity == null) {
        capacity = 500L;
      }
      if (ttl == null) {
        ttl = Duration.ofDays(30);
      }
    }
  }
}
