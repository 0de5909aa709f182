package com.usagelens.engine.reader;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Remembers targets that have reported operations. Only positive answers are kept: a target that starts
 * reporting must be noticed on the next check.
 */
@Slf4j
public final class CollectedOperationsCache {

  private final Cache<String, Boolean> cache;

  public CollectedOperationsCache(long capacity, Duration ttl) {
    this.cache = Caffeine.newBuilder()
        .maximumSize(capacity)
        .expireAfterWrite(ttl)
        .build();
  }

  public CompletableFuture<Boolean> get(String key, Supplier<CompletableFuture<Boolean>> loader) {
    if (Boolean.TRUE.equals(cache.getIfPresent(key))) {
      return CompletableFuture.completedFuture(true);
    }
    return loader.get().thenApply(collected -> {
      if (Boolean.TRUE.equals(collected)) {
        cache.put(key, true);
        log.debug("collected operations cached key={}", key);
      }
      return collected;
    });
  }

  public void invalidate(String key) {
    cache.invalidate(key);
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
