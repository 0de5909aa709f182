package com.usagelens.engine.window;

import java.util.EnumSet;
import java.util.Set;

public enum IntervalUnit {
  MINUTE('m', 1, "MINUTE", EnumSet.of(Granularity.MINUTELY)),
  HOUR('h', 60, "HOUR", EnumSet.of(Granularity.HOURLY, Granularity.MINUTELY)),
  DAY('d', 24 * 60, "DAY", EnumSet.allOf(Granularity.class));

  private final char symbol;
  private final long minutes;
  private final String keyword;
  private final Set<Granularity> compatible;

  IntervalUnit(char symbol, long minutes, String keyword, Set<Granularity> compatible) {
    this.symbol = symbol;
    this.minutes = minutes;
    this.keyword = keyword;
    this.compatible = compatible;
  }

  public char symbol() {
    return symbol;
  }

  public long minutes() {
    return minutes;
  }

  /** ClickHouse interval keyword, e.g. {@code HOUR} in {@code INTERVAL 2 HOUR}. */
  public String keyword() {
    return keyword;
  }

  /**
   * Tables whose rows can be re-bucketed into a bucket of this unit. A finer table can always be rolled up,
   * a coarser one never split.
   */
  public boolean allows(Granularity granularity) {
    return compatible.contains(granularity);
  }

  public static IntervalUnit fromSymbol(char symbol) {
    for (IntervalUnit unit : values()) {
      if (unit.symbol == Character.toLowerCase(symbol)) {
        return unit;
      }
    }
    throw new IllegalArgumentException("Unknown interval unit '" + symbol + "'");
  }
}
