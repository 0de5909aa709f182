package com.usagelens.engine.window;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * The precomputed aggregation tables. Coarser tables keep rows longer and answer faster.
 */
public enum Granularity {
  DAILY("daily", 365 * 24, 3, ChronoUnit.DAYS),
  HOURLY("hourly", 30 * 24, 2, ChronoUnit.HOURS),
  MINUTELY("minutely", 24, 1, ChronoUnit.MINUTES);

  /** Slack for client-side minute rounding and request latency. */
  public static final Duration SAFETY_BUFFER = Duration.ofMinutes(2);

  private final String suffix;
  private final long retentionHours;
  private final int performanceRank;
  private final ChronoUnit boundary;

  Granularity(String suffix, long retentionHours, int performanceRank, ChronoUnit boundary) {
    this.suffix = suffix;
    this.retentionHours = retentionHours;
    this.performanceRank = performanceRank;
    this.boundary = boundary;
  }

  public String suffix() {
    return suffix;
  }

  public long retentionHours() {
    return retentionHours;
  }

  public int performanceRank() {
    return performanceRank;
  }

  public Duration bucketWidth() {
    return boundary.getDuration();
  }

  /** e.g. {@code operations_hourly}. */
  public String table(String prefix) {
    return prefix + "_" + suffix;
  }

  /**
   * Oldest instant this table can still answer for: {@code now - retention}, floored to the table's natural
   * boundary, minus {@link #SAFETY_BUFFER}.
   */
  public Instant oldestAvailable(Instant now) {
    return now.minus(Duration.ofHours(retentionHours))
        .truncatedTo(boundary)
        .minus(SAFETY_BUFFER);
  }

  public static List<Granularity> byPerformance() {
    return Stream.of(values())
        .sorted(Comparator.comparingInt(Granularity::performanceRank).reversed())
        .toList();
  }

  public static Granularity fromSuffix(String raw) {
    for (Granularity granularity : values()) {
      if (granularity.suffix.equalsIgnoreCase(raw.trim())) {
        return granularity;
      }
    }
    throw new IllegalArgumentException("Unknown granularity '" + raw + "'");
  }
}
