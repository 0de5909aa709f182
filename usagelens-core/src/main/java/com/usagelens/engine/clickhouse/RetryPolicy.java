package com.usagelens.engine.clickhouse;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retries with a linear backoff: retry {@code n} waits {@code n * backoffStepMillis} plus up to
 * {@code maxJitterMillis} of random jitter.
 */
public record RetryPolicy(
    int maxRetries,
    long backoffStepMillis,
    long maxJitterMillis
) {

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    backoffStepMillis = Math.max(0, backoffStepMillis);
    maxJitterMillis = Math.max(0, maxJitterMillis);
  }

  public static RetryPolicy reads() {
    return new RetryPolicy(5, 250, 100);
  }

  public static RetryPolicy inserts() {
    return new RetryPolicy(5, 500, 100);
  }

  public static RetryPolicy none() {
    return new RetryPolicy(0, 0, 0);
  }

  /**
   * @param retriesSoFar retries already performed for this call
   */
  public boolean canRetry(int retriesSoFar) {
    return retriesSoFar < maxRetries;
  }

  public long computeDelayMillis(int retry) {
    return Math.max(0, retry) * backoffStepMillis;
  }

  public long delayWithJitterMillis(int retry) {
    long delayMillis = computeDelayMillis(retry);
    if (delayMillis <= 0 || maxJitterMillis == 0) {
      return delayMillis;
    }
    return delayMillis + ThreadLocalRandom.current().nextLong(0, Math.min(maxJitterMillis, delayMillis) + 1);
  }
}
