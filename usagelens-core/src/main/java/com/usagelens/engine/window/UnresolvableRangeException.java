package com.usagelens.engine.window;

public class UnresolvableRangeException extends RuntimeException {

  public enum Reason {
    /** The period predates the retention window of every usable table. */
    TOO_OLD,
    /** No table satisfies the period, interval and precision together. */
    UNRESOLVABLE,
  }

  private final Reason reason;

  public UnresolvableRangeException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
