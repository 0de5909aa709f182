package com.usagelens.engine.window;

import com.usagelens.engine.sql.QueryBuildException;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A bucket width normalized to the largest unit that divides it evenly: {@code 1440m} becomes {@code 1d}.
 */
public record ParsedInterval(long value, IntervalUnit unit) {

  private static final Pattern FORMAT = Pattern.compile("^\\s*(\\d+)\\s*([mhdMHD])\\s*$");

  // toSeconds() must not overflow
  private static final long MAX_MINUTES = Long.MAX_VALUE / 60;

  public ParsedInterval {
    if (value <= 0) {
      throw new QueryBuildException("Interval value must be > 0");
    }
    if (unit == null) {
      throw new QueryBuildException("Interval unit is required");
    }
    if (value > MAX_MINUTES / unit.minutes()) {
      throw new QueryBuildException("Interval " + value + unit.symbol() + " is too large");
    }
  }

  /**
   * Parses strings like {@code 15m}, {@code 24h} or {@code 7d}.
   */
  public static ParsedInterval parse(String raw) {
    if (raw == null) {
      throw new QueryBuildException("Interval cannot be bound an undefined value.");
    }
    Matcher matcher = FORMAT.matcher(raw);
    if (!matcher.matches()) {
      throw new QueryBuildException("Invalid interval '" + raw + "', expected <number><m|h|d>");
    }
    long value;
    try {
      value = Long.parseLong(matcher.group(1));
    } catch (NumberFormatException e) {
      throw new QueryBuildException("Invalid interval '" + raw + "'", e);
    }
    IntervalUnit unit = IntervalUnit.fromSymbol(matcher.group(2).charAt(0));
    long minutes;
    try {
      minutes = Math.multiplyExact(value, unit.minutes());
    } catch (ArithmeticException e) {
      throw new QueryBuildException("Interval '" + raw + "' is too large", e);
    }
    return ofMinutes(minutes);
  }

  public static ParsedInterval ofMinutes(long minutes) {
    if (minutes <= 0) {
      throw new QueryBuildException("Interval must be at least one minute");
    }
    if (minutes % IntervalUnit.DAY.minutes() == 0) {
      return new ParsedInterval(minutes / IntervalUnit.DAY.minutes(), IntervalUnit.DAY);
    }
    if (minutes % IntervalUnit.HOUR.minutes() == 0) {
      return new ParsedInterval(minutes / IntervalUnit.HOUR.minutes(), IntervalUnit.HOUR);
    }
    return new ParsedInterval(minutes, IntervalUnit.MINUTE);
  }

  public long toMinutes() {
    return value * unit.minutes();
  }

  public long toSeconds() {
    return toMinutes() * 60;
  }

  public Duration toDuration() {
    return Duration.ofMinutes(toMinutes());
  }

  /** {@code 2 HOUR}, for use after {@code INTERVAL}. */
  public String toClickHouse() {
    return value + " " + unit.keyword();
  }

  @Override
  public String toString() {
    return value + String.valueOf(unit.symbol());
  }
}
