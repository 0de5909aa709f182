package com.usagelens.engine.clickhouse;

import com.usagelens.engine.sql.QueryBuildException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rows for a {@code INSERT INTO table (columns) FORMAT CSV}. Each row holds one value per column.
 */
public record InsertRequest(String table, List<String> columns, List<List<String>> rows, String queryId,
                            Duration timeout) {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

  public InsertRequest {
    if (table == null || !IDENTIFIER.matcher(table).matches()) {
      throw new QueryBuildException("Invalid table name: " + table);
    }
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    if (columns.isEmpty()) {
      throw new QueryBuildException("Insert requires at least one column.");
    }
    for (String column : columns) {
      if (!IDENTIFIER.matcher(column).matches()) {
        throw new QueryBuildException("Invalid column name: " + column);
      }
    }
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    for (List<String> row : rows) {
      if (row.size() != columns.size()) {
        throw new QueryBuildException(
            "Insert row has " + row.size() + " values but " + columns.size() + " columns were declared.");
      }
    }
    if (queryId == null || queryId.isBlank()) {
      throw new IllegalArgumentException("queryId is required");
    }
  }

  public String statement() {
    return "INSERT INTO " + table + " (" + String.join(", ", columns) + ") FORMAT CSV";
  }
}
