package com.usagelens.engine.window;

import java.time.Instant;

/**
 * A period snapped outward to whole buckets: {@code from} is the start of the bucket holding the requested
 * start, {@code to} the exclusive end of the bucket holding the requested end.
 */
public record BucketedPeriod(Instant from, Instant to, ParsedInterval interval, long bucketSeconds) {

  public long expectedPoints() {
    return (to.getEpochSecond() - from.getEpochSecond()) / bucketSeconds;
  }

  public DateRange toDateRange() {
    return new DateRange(from, to);
  }
}
