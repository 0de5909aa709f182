package com.usagelens.engine.clickhouse;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The store rejected a query or could not be reached. The message is the store's exception text, unmodified.
 */
public class ClickHouseException extends RuntimeException {

  private static final Pattern CODE = Pattern.compile("Code:\\s*(\\d+)");
  private static final Pattern NAME = Pattern.compile("\\(([A-Z][A-Z0-9_]+)\\)");
  private static final int SNIPPET_MAX_LEN = 2000;

  private final String queryId;
  private final String executionId;
  private final int statusCode;
  private final String errorCode;
  private final String errorName;

  public ClickHouseException(String queryId, String executionId, int statusCode, String message) {
    this(queryId, executionId, statusCode, message, null);
  }

  public ClickHouseException(String queryId, String executionId, int statusCode, String message, Throwable cause) {
    super(message == null ? "" : message, cause);
    this.queryId = queryId;
    this.executionId = executionId;
    this.statusCode = statusCode;
    this.errorCode = find(CODE, message);
    this.errorName = find(NAME, message);
  }

  public String queryId() {
    return queryId;
  }

  public String executionId() {
    return executionId;
  }

  /** HTTP status, or 0 when no response was received. */
  public int statusCode() {
    return statusCode;
  }

  /** ClickHouse error code such as {@code 202}, when the store reported one. */
  public String errorCode() {
    return errorCode;
  }

  /** ClickHouse error name such as {@code TOO_MANY_SIMULTANEOUS_QUERIES}, when the store reported one. */
  public String errorName() {
    return errorName;
  }

  public String responseSnippet() {
    String message = getMessage();
    return message.length() <= SNIPPET_MAX_LEN ? message : message.substring(0, SNIPPET_MAX_LEN) + "...";
  }

  private static String find(Pattern pattern, String message) {
    if (message == null) {
      return null;
    }
    Matcher matcher = pattern.matcher(message);
    return matcher.find() ? matcher.group(1) : null;
  }
}
