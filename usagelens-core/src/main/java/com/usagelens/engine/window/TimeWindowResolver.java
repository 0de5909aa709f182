package com.usagelens.engine.window;

import com.usagelens.engine.sql.QueryBuildException;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the aggregation table for a period and computes bucket-aligned windows for time series.
 */
@Slf4j
@UtilityClass
public class TimeWindowResolver {

  public static final int MIN_RESOLUTION = 10;
  public static final int MAX_RESOLUTION = 90;

  public static Granularity pickGranularity(Instant now, DateRange period) {
    return pickGranularity(now, period, null, null);
  }

  /**
   * @param interval  requested bucket width, or {@code null}
   * @param precision table the caller insists on, or {@code null}
   * @throws UnresolvableRangeException when the period is too old or no table satisfies all constraints
   */
  public static Granularity pickGranularity(
      Instant now,
      DateRange period,
      ParsedInterval interval,
      Granularity precision
  ) {
    Instant dailyOldest = Granularity.DAILY.oldestAvailable(now);
    if (period.from().isBefore(dailyOldest) || period.to().isBefore(dailyOldest)) {
      throw new UnresolvableRangeException(
          UnresolvableRangeException.Reason.TOO_OLD,
          "The requested date range " + describe(period) + " is too old, the oldest available data point is "
              + dailyOldest + ".");
    }

    List<Granularity> candidates = candidates(period, interval, precision);
    if (precision != null) {
      candidates = candidates.contains(precision) ? List.of(precision) : List.of();
    }
    if (candidates.isEmpty()) {
      log.error("time window unresolvable period={} interval={} precision={}", describe(period), interval, precision);
      throw new UnresolvableRangeException(
          UnresolvableRangeException.Reason.UNRESOLVABLE,
          "The requested date range " + describe(period) + " with interval " + interval + " and precision "
              + (precision == null ? null : precision.suffix()) + " cannot be resolved.");
    }

    for (Granularity candidate : candidates) {
      Instant oldest = candidate.oldestAvailable(now);
      if (!oldest.isAfter(period.from()) && !oldest.isAfter(period.to())) {
        if (interval == null && precision == null && candidate.bucketWidth().compareTo(period.span()) >= 0) {
          log.warn("time window coarser than period period={} granularity={}", describe(period), candidate.suffix());
        }
        return candidate;
      }
    }

    Granularity finest = candidates.get(candidates.size() - 1);
    throw new UnresolvableRangeException(
        UnresolvableRangeException.Reason.TOO_OLD,
        "The requested date range " + describe(period) + " is too old for the selected query type "
            + finest.suffix() + " (oldest available data point " + finest.oldestAvailable(now) + ").");
  }

  /**
   * Candidates in order of preference.
   *
   * <p>With an interval, every table that can be re-bucketed to the interval's unit, fastest first. Without
   * one, the tables whose bucket is strictly shorter than the period come first (fastest first) and the
   * coarser ones follow as a fallback for periods that finer tables no longer retain.
   */
  private static List<Granularity> candidates(DateRange period, ParsedInterval interval, Granularity precision) {
    List<Granularity> ordered = Granularity.byPerformance();
    if (interval != null) {
      return ordered.stream().filter(g -> interval.unit().allows(g)).toList();
    }
    if (precision != null) {
      return ordered;
    }

    Duration span = period.span();
    List<Granularity> fitting = new ArrayList<>();
    List<Granularity> coarser = new ArrayList<>();
    for (Granularity granularity : ordered) {
      if (granularity == Granularity.MINUTELY || granularity.bucketWidth().compareTo(span) < 0) {
        fitting.add(granularity);
      } else {
        coarser.add(0, granularity);
      }
    }
    fitting.addAll(coarser);
    return fitting;
  }

  /**
   * Bucket width for a target number of points: {@code ceil(periodMinutes / resolution)} minutes, rounded up
   * to whole hours from one hour on and to whole days from one day on.
   */
  public static ParsedInterval calculateInterval(DateRange period, int resolution) {
    if (resolution < MIN_RESOLUTION || resolution > MAX_RESOLUTION) {
      throw new QueryBuildException(
          "Invalid resolution " + resolution + ", expected a value between " + MIN_RESOLUTION + " and "
              + MAX_RESOLUTION + ".");
    }
    double periodMinutes = period.span().toSeconds() / 60.0;
    long minutes = Math.max(1, (long) Math.ceil(periodMinutes / resolution));

    if (minutes < IntervalUnit.HOUR.minutes()) {
      return ParsedInterval.ofMinutes(minutes);
    }
    if (minutes < IntervalUnit.DAY.minutes()) {
      long hours = (minutes + IntervalUnit.HOUR.minutes() - 1) / IntervalUnit.HOUR.minutes();
      return ParsedInterval.ofMinutes(hours * IntervalUnit.HOUR.minutes());
    }
    long days = (minutes + IntervalUnit.DAY.minutes() - 1) / IntervalUnit.DAY.minutes();
    return ParsedInterval.ofMinutes(days * IntervalUnit.DAY.minutes());
  }

  /**
   * Snaps the period outward to whole buckets of {@code interval}, aligned to the UNIX epoch in UTC.
   */
  public static BucketedPeriod bucketize(DateRange period, ParsedInterval interval) {
    long bucket = interval.toSeconds();
    long from = Math.floorDiv(period.from().getEpochSecond(), bucket) * bucket;
    long to = Math.floorDiv(period.to().getEpochSecond(), bucket) * bucket + bucket;
    return new BucketedPeriod(Instant.ofEpochSecond(from), Instant.ofEpochSecond(to), interval, bucket);
  }

  private static String describe(DateRange period) {
    return period.from() + " - " + period.to();
  }
}
