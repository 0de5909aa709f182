package com.usagelens.engine.clickhouse;

@FunctionalInterface
public interface QueryCompletionListener {

  void onCompleted(QueryCompletion completion);

  default void onRetry(String queryId, int retry) {
  }

  static QueryCompletionListener noop() {
    return completion -> {
    };
  }
}
