package com.usagelens.engine.batch;

/**
 * A batch loader returned a different number of results than it was given arguments.
 */
public class BatchContractException extends IllegalStateException {

  public BatchContractException(int expected, int actual) {
    super("Batch loader returned " + actual + " results for " + expected + " arguments.");
  }
}
