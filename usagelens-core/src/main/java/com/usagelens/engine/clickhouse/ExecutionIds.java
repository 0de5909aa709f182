package com.usagelens.engine.clickhouse;

import lombok.experimental.UtilityClass;

import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Store-visible query ids. ClickHouse rejects a query whose id is still running, so each retry gets its own
 * {@code -r<N>} suffix.
 */
@UtilityClass
public class ExecutionIds {

  private static final Pattern RETRY_SUFFIX = Pattern.compile("-r\\d+$");
  private static final int SUFFIX_LENGTH = 13;

  public static String create(String queryId) {
    return queryId + "-" + randomSuffix();
  }

  public static String forAttempt(String executionId, int retry) {
    String base = RETRY_SUFFIX.matcher(executionId).replaceFirst("");
    return retry <= 0 ? base : base + "-r" + retry;
  }

  static String randomSuffix() {
    StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
    ThreadLocalRandom random = ThreadLocalRandom.current();
    while (sb.length() < SUFFIX_LENGTH) {
      sb.append(Character.forDigit(random.nextInt(16), 16));
    }
    return sb.toString();
  }
}
