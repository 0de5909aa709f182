package com.usagelens.engine.sql;

/**
 * A structurally invalid request: malformed fragment composition, an unbound template slot, or caller input
 * outside its contractual range. Raised before anything reaches the store, never retried.
 */
public class QueryBuildException extends IllegalArgumentException {

  public QueryBuildException(String message) {
    super(message);
  }

  public QueryBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
