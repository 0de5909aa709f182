package com.usagelens.engine.clickhouse;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.usagelens.engine.sql.SqlStatement;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.zip.GZIPOutputStream;

/**
 * Async client for the ClickHouse HTTP interface. Reads return {@code FORMAT JSON} rows decoded into
 * {@code rowType}; identical concurrent reads share one execution. Every store failure is retried with a
 * fresh execution id.
 */
@Slf4j
public class ClickHouseClient {

  private final ClickHouseHttpPool pool;
  private final ClickHouseRequestFactory requestFactory;
  private final ObjectMapper objectMapper;
  private final CsvMapper csvMapper = new CsvMapper();
  private final QueryDeduplicator<ClickHouseResponse> deduplicator;
  private final ClickHouseClientSettings settings;
  private final QueryCompletionListener listener;

  public ClickHouseClient(
      ClickHouseHttpPool pool,
      ClickHouseRequestFactory requestFactory,
      ObjectMapper objectMapper,
      QueryDeduplicator<ClickHouseResponse> deduplicator,
      ClickHouseClientSettings settings,
      QueryCompletionListener listener
  ) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.requestFactory = Objects.requireNonNull(requestFactory, "requestFactory");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.listener = listener == null ? QueryCompletionListener.noop() : listener;
  }

  public <T> CompletableFuture<QueryResult<T>> query(QueryRequest request, Class<T> rowType) {
    ObjectReader reader = objectMapper.readerFor(rowType)
        .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    return execute(request).thenApply(response -> {
      List<T> rows = new ArrayList<>(response.data().size());
      for (JsonNode row : response.data()) {
        try {
          rows.add(reader.readValue(row));
        } catch (IOException e) {
          throw new ClickHouseException(request.queryId(), null, 200,
              "Failed to decode row of " + request.queryId() + " as " + rowType.getSimpleName() + ": "
                  + e.getMessage(), e);
        }
      }
      return new QueryResult<>(rows, response.rows(), response.elapsedSeconds());
    });
  }

  /**
   * Executes a read, joining an identical in-flight one when present.
   */
  public CompletableFuture<ClickHouseResponse> execute(QueryRequest request) {
    String key = QueryDeduplicator.keyOf(request.statement());
    return deduplicator.run(key, () -> {
      Duration timeout = effectiveTimeout(request.timeout());
      if (log.isDebugEnabled()) {
        log.debug("clickhouse query queryId={} timeout={} sql={}", request.queryId(), timeout,
            request.statement().printWithValues());
      }
      return withRetries(request.queryId(), settings.readRetry(),
          executionId -> sendQuery(request.statement(), request.queryId(), executionId, timeout));
    });
  }

  public CompletableFuture<Void> insert(InsertRequest request) {
    byte[] body = gzip(toCsv(request.rows()));
    Duration timeout = effectiveTimeout(request.timeout());
    log.debug("clickhouse insert queryId={} table={} rows={} bytes={}", request.queryId(), request.table(),
        request.rows().size(), body.length);
    return withRetries(request.queryId(), settings.insertRetry(),
        executionId -> sendInsert(request, executionId, body, timeout));
  }

  Duration effectiveTimeout(Duration requested) {
    Duration ceiling = settings.requestTimeoutCeiling();
    if (requested == null || requested.compareTo(ceiling) > 0) {
      return ceiling;
    }
    return requested;
  }

  private <T> CompletableFuture<T> withRetries(
      String queryId,
      RetryPolicy policy,
      Function<String, CompletableFuture<T>> send
  ) {
    CompletableFuture<T> result = new CompletableFuture<>();
    attempt(queryId, ExecutionIds.create(queryId), policy, send, 0, System.nanoTime(), result);
    return result;
  }

  private <T> void attempt(
      String queryId,
      String baseExecutionId,
      RetryPolicy policy,
      Function<String, CompletableFuture<T>> send,
      int retry,
      long startedNanos,
      CompletableFuture<T> result
  ) {
    String executionId = ExecutionIds.forAttempt(baseExecutionId, retry);
    CompletableFuture<T> call;
    try {
      call = send.apply(executionId);
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }
    call.whenComplete((value, error) -> {
      if (error == null) {
        complete(queryId, executionId, startedNanos, retry, null);
        result.complete(value);
        return;
      }
      Throwable cause = unwrap(error);
      if (!policy.canRetry(retry)) {
        log.warn("clickhouse query failed queryId={} executionId={} retries={} error={}", queryId, executionId,
            retry, cause.toString());
        complete(queryId, executionId, startedNanos, retry, cause);
        result.completeExceptionally(cause);
        return;
      }
      int next = retry + 1;
      ClickHouseException ch = cause instanceof ClickHouseException c ? c : null;
      log.warn("clickhouse query retry queryId={} executionId={} attempt={} code={} error={} message={}",
          queryId, executionId, next,
          ch == null ? null : ch.errorCode(),
          ch == null || ch.errorName() == null ? cause.getClass().getSimpleName() : ch.errorName(),
          ch == null ? cause.getMessage() : ch.responseSnippet());
      listener.onRetry(queryId, next);
      long delayMillis = policy.delayWithJitterMillis(next);
      CompletableFuture.delayedExecutor(delayMillis, TimeUnit.MILLISECONDS)
          .execute(() -> attempt(queryId, baseExecutionId, policy, send, next, startedNanos, result));
    });
  }

  private void complete(String queryId, String executionId, long startedNanos, int retries, Throwable error) {
    try {
      listener.onCompleted(new QueryCompletion(queryId, executionId,
          Duration.ofNanos(System.nanoTime() - startedNanos), retries, error));
    } catch (RuntimeException e) {
      log.warn("clickhouse completion listener failed queryId={}", queryId, e);
    }
  }

  private CompletableFuture<ClickHouseResponse> sendQuery(
      SqlStatement statement,
      String queryId,
      String executionId,
      Duration timeout
  ) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("default_format", "JSON");
    query.put("query_id", executionId);
    query.put("max_execution_time", Long.toString(Math.max(1, timeout.toSeconds())));
    statement.toQueryParams().forEach((name, value) -> query.put("param_" + name, value));

    HttpRequest request = requestFactory.request(query)
        .timeout(timeout)
        .header("Content-Type", "text/plain; charset=utf-8")
        .POST(HttpRequest.BodyPublishers.ofString(statement.text()))
        .build();

    return pool.send(request, HttpResponse.BodyHandlers.ofString())
        .handle((response, error) -> {
          if (error != null) {
            throw transportFailure(queryId, executionId, unwrap(error));
          }
          String body = response.body();
          if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ClickHouseException(queryId, executionId, response.statusCode(), body == null ? "" : body.trim());
          }
          JsonNode root;
          try {
            root = objectMapper.readTree(body);
          } catch (IOException e) {
            throw new ClickHouseException(queryId, executionId, response.statusCode(), body, e);
          }
          if (root.hasNonNull("exception")) {
            throw new ClickHouseException(queryId, executionId, response.statusCode(), root.get("exception").asText());
          }
          return ClickHouseResponse.from(root);
        });
  }

  private CompletableFuture<Void> sendInsert(InsertRequest insert, String executionId, byte[] body, Duration timeout) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("query", insert.statement());
    query.put("query_id", executionId);
    query.put("async_insert", "1");
    query.put("wait_for_async_insert", "1");
    query.put("async_insert_busy_timeout_ms", Long.toString(settings.asyncInsertBusyTimeout().toMillis()));
    query.put("async_insert_max_data_size", Long.toString(settings.asyncInsertMaxDataSize()));

    HttpRequest request = requestFactory.request(query)
        .timeout(timeout)
        .header("Content-Type", "text/csv")
        .header("Content-Encoding", "gzip")
        .POST(HttpRequest.BodyPublishers.ofByteArray(body))
        .build();

    return pool.send(request, HttpResponse.BodyHandlers.ofString())
        .handle((response, error) -> {
          if (error != null) {
            throw transportFailure(insert.queryId(), executionId, unwrap(error));
          }
          if (response.statusCode() < 200 || response.statusCode() >= 300) {
            String text = response.body() == null ? "" : response.body().trim();
            throw new ClickHouseException(insert.queryId(), executionId, response.statusCode(), text);
          }
          return null;
        });
  }

  private static ClickHouseException transportFailure(String queryId, String executionId, Throwable error) {
    if (error instanceof ClickHouseException ch) {
      return ch;
    }
    if (error instanceof HttpTimeoutException) {
      return new ClickHouseTimeoutException(queryId, executionId,
          "ClickHouse request timed out: " + error.getMessage(), error);
    }
    return new ClickHouseException(queryId, executionId, 0,
        "ClickHouse request failed: " + error, error);
  }

  private byte[] toCsv(List<List<String>> rows) {
    try {
      return csvMapper.writeValueAsBytes(rows);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode insert rows as CSV", e);
    }
  }

  private static byte[] gzip(byte[] raw) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, raw.length / 4));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(raw);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to compress insert body", e);
    }
    return out.toByteArray();
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
