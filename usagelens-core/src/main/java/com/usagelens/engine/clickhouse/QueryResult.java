package com.usagelens.engine.clickhouse;

import java.util.List;
import java.util.Optional;

public record QueryResult<T>(List<T> data, long rows, double elapsedSeconds) {

  public QueryResult {
    data = data == null ? List.of() : List.copyOf(data);
  }

  public Optional<T> first() {
    return data.isEmpty() ? Optional.empty() : Optional.of(data.get(0));
  }

  public boolean isEmpty() {
    return data.isEmpty();
  }
}
