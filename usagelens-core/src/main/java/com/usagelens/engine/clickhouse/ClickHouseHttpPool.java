package com.usagelens.engine.clickhouse;

import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared keep-alive HTTP client for the store. At most {@code maxSockets} requests are in flight; further
 * requests queue without blocking the caller and start as earlier ones complete.
 * <p>
 * The JDK client reads its idle-connection TTL once per process from {@code -Djdk.httpclient.keepalive.timeout}
 * (seconds), so that is a JVM flag rather than a pool setting.
 */
@Slf4j
public final class ClickHouseHttpPool implements AutoCloseable {

  static final String KEEP_ALIVE_PROPERTY = "jdk.httpclient.keepalive.timeout";

  private final HttpClient httpClient;
  private final ExecutorService executor;
  private final int maxSockets;
  private final Queue<Pending> waiting = new ArrayDeque<>();
  private int inFlight;
  private boolean closed;

  public ClickHouseHttpPool(Duration connectTimeout, int maxSockets) {
    if (maxSockets <= 0) {
      throw new IllegalArgumentException("maxSockets must be > 0");
    }
    this.maxSockets = maxSockets;
    this.executor = Executors.newFixedThreadPool(Math.max(2, Math.min(maxSockets, 16)), threadFactory());
    this.httpClient = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
        .executor(executor)
        .build();
    log.info("clickhouse pool started maxSockets={} keepAliveSeconds={}", maxSockets,
        System.getProperty(KEEP_ALIVE_PROPERTY, "default"));
  }

  public <T> CompletableFuture<HttpResponse<T>> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
    CompletableFuture<HttpResponse<T>> result = new CompletableFuture<>();
    Runnable start = () -> {
      CompletableFuture<HttpResponse<T>> call;
      try {
        call = httpClient.sendAsync(request, handler);
      } catch (RuntimeException e) {
        call = CompletableFuture.failedFuture(e);
      }
      call.whenComplete((response, error) -> {
        release();
        if (error != null) {
          result.completeExceptionally(error);
        } else {
          result.complete(response);
        }
      });
    };
    synchronized (this) {
      if (closed) {
        return CompletableFuture.failedFuture(new IllegalStateException("ClickHouse connection pool is closed"));
      }
      if (inFlight >= maxSockets) {
        waiting.add(new Pending(start, result));
        return result;
      }
      inFlight++;
    }
    start.run();
    return result;
  }

  public synchronized int inFlight() {
    return inFlight;
  }

  public synchronized int queued() {
    return waiting.size();
  }

  private void release() {
    Pending next;
    synchronized (this) {
      next = closed ? null : waiting.poll();
      if (next == null) {
        inFlight--;
      }
    }
    if (next != null) {
      next.start().run();
    }
  }

  @Override
  public void close() {
    List<Pending> abandoned;
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
      abandoned = new ArrayList<>(waiting);
      waiting.clear();
    }
    abandoned.forEach(p -> p.result().completeExceptionally(
        new IllegalStateException("ClickHouse connection pool closed before the request started")));
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("clickhouse pool did not drain within 5s, forcing shutdown");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    log.info("clickhouse pool closed abandoned={}", abandoned.size());
  }

  private static ThreadFactory threadFactory() {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "clickhouse-http-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  private record Pending(Runnable start, CompletableFuture<?> result) {
  }
}
