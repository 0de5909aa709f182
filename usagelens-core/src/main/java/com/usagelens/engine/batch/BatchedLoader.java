package com.usagelens.engine.batch;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Coalesces single-argument calls arriving within one window into one loader call per group key.
 * <p>
 * The loader receives the group's arguments in call order and must return exactly one result per argument,
 * in the same order. A group that reaches {@code maxBatchSize} is flushed without waiting for the window.
 *
 * @param <A> argument type
 * @param <R> result type
 */
@Slf4j
public final class BatchedLoader<A, R> {

  private final String name;
  private final Function<A, String> keyFn;
  private final Function<List<A>, CompletableFuture<List<R>>> loader;
  private final int maxBatchSize;
  private final Executor flushExecutor;

  private final Map<String, List<Pending<A, R>>> groups = new LinkedHashMap<>();
  private boolean flushScheduled;

  public BatchedLoader(
      String name,
      Function<A, String> keyFn,
      Function<List<A>, CompletableFuture<List<R>>> loader,
      int maxBatchSize,
      Duration window
  ) {
    this(name, keyFn, loader, maxBatchSize,
        CompletableFuture.delayedExecutor(Math.max(0, window.toNanos()), TimeUnit.NANOSECONDS));
  }

  /**
   * @param flushExecutor runs the window flush; its delay defines the window
   */
  public BatchedLoader(
      String name,
      Function<A, String> keyFn,
      Function<List<A>, CompletableFuture<List<R>>> loader,
      int maxBatchSize,
      Executor flushExecutor
  ) {
    if (maxBatchSize <= 0) {
      throw new IllegalArgumentException("maxBatchSize must be > 0");
    }
    this.name = Objects.requireNonNull(name, "name");
    this.keyFn = Objects.requireNonNull(keyFn, "keyFn");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.maxBatchSize = maxBatchSize;
    this.flushExecutor = Objects.requireNonNull(flushExecutor, "flushExecutor");
  }

  public CompletableFuture<R> load(A argument) {
    CompletableFuture<R> result = new CompletableFuture<>();
    String key = keyFn.apply(argument);
    List<Pending<A, R>> full = null;
    boolean schedule = false;
    synchronized (this) {
      List<Pending<A, R>> group = groups.computeIfAbsent(key, k -> new ArrayList<>());
      group.add(new Pending<>(argument, result));
      if (group.size() >= maxBatchSize) {
        full = groups.remove(key);
      } else if (!flushScheduled) {
        flushScheduled = true;
        schedule = true;
      }
    }
    if (full != null) {
      dispatch(key, full);
    }
    if (schedule) {
      flushExecutor.execute(this::flush);
    }
    return result;
  }

  /**
   * Dispatches every pending group now.
   */
  public void flush() {
    Map<String, List<Pending<A, R>>> ready;
    synchronized (this) {
      flushScheduled = false;
      if (groups.isEmpty()) {
        return;
      }
      ready = new LinkedHashMap<>(groups);
      groups.clear();
    }
    ready.forEach(this::dispatch);
  }

  public synchronized int pending() {
    return groups.values().stream().mapToInt(List::size).sum();
  }

  private void dispatch(String key, List<Pending<A, R>> batch) {
    List<A> arguments = new ArrayList<>(batch.size());
    for (Pending<A, R> pending : batch) {
      arguments.add(pending.argument());
    }
    log.debug("batch dispatch loader={} key={} size={}", name, key, batch.size());
    CompletableFuture<List<R>> call;
    try {
      call = Objects.requireNonNull(loader.apply(arguments), "loader returned null");
    } catch (RuntimeException e) {
      call = CompletableFuture.failedFuture(e);
    }
    call.whenComplete((results, error) -> {
      if (error != null) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        batch.forEach(p -> p.result().completeExceptionally(cause));
        return;
      }
      if (results == null || results.size() != batch.size()) {
        BatchContractException mismatch = new BatchContractException(batch.size(), results == null ? 0 : results.size());
        log.error("batch loader={} key={} {}", name, key, mismatch.getMessage());
        batch.forEach(p -> p.result().completeExceptionally(mismatch));
        return;
      }
      for (int i = 0; i < batch.size(); i++) {
        batch.get(i).result().complete(results.get(i));
      }
    });
  }

  private record Pending<A, R>(A argument, CompletableFuture<R> result) {
  }
}
