package com.usagelens.engine.window;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Requested period, inclusive on both ends. Callers guarantee {@code from <= to}.
 */
public record DateRange(Instant from, Instant to) {

  public DateRange {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }

  public static DateRange lastHours(Instant now, long hours) {
    return new DateRange(now.minus(Duration.ofHours(hours)), now);
  }

  public Duration span() {
    return Duration.between(from, to);
  }

  /** Stable string form, used to group requests for the same period. */
  public String key() {
    return from + ";" + to;
  }
}
