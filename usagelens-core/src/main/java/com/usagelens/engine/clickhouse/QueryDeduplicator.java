package com.usagelens.engine.clickhouse;

import com.usagelens.engine.sql.SqlStatement;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Collapses concurrent identical reads into one execution. The slot is released as soon as the execution
 * settles, so nothing is cached beyond the in-flight window.
 *
 * @param <T> the shared execution's result, {@link ClickHouseResponse} for the client
 */
@Slf4j
public final class QueryDeduplicator<T> {

  private final ConcurrentMap<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();

  public static String keyOf(SqlStatement statement) {
    MessageDigest digest = sha256();
    digest.update(statement.text().getBytes(StandardCharsets.UTF_8));
    for (Map.Entry<String, String> param : statement.toQueryParams().entrySet()) {
      digest.update((byte) 0);
      digest.update(param.getKey().getBytes(StandardCharsets.UTF_8));
      digest.update((byte) 1);
      digest.update(param.getValue().getBytes(StandardCharsets.UTF_8));
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  public CompletableFuture<T> run(String key, Supplier<CompletableFuture<T>> execution) {
    CompletableFuture<T> slot = new CompletableFuture<>();
    CompletableFuture<T> existing = inFlight.putIfAbsent(key, slot);
    if (existing != null) {
      log.debug("clickhouse query joined in-flight execution key={}", key);
      return existing.copy();
    }
    CompletableFuture<T> started;
    try {
      started = execution.get();
    } catch (RuntimeException e) {
      inFlight.remove(key, slot);
      slot.completeExceptionally(e);
      return slot.copy();
    }
    started.whenComplete((value, error) -> {
      inFlight.remove(key, slot);
      if (error != null) {
        slot.completeExceptionally(error instanceof CompletionException && error.getCause() != null
            ? error.getCause() : error);
      } else {
        slot.complete(value);
      }
    });
    return slot.copy();
  }

  public int inFlight() {
    return inFlight.size();
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
