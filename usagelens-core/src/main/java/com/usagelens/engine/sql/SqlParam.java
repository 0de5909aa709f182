package com.usagelens.engine.sql;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A bound statement parameter: either a scalar string or an array of strings.
 */
public sealed interface SqlParam permits SqlParam.Scalar, SqlParam.StringArray {

  /** ClickHouse type used in the placeholder, e.g. {@code String} in {@code {p1: String}}. */
  String dataType();

  /** Value as sent in the {@code param_pN} query parameter. */
  String wireValue();

  /** Quoted SQL literal, for debug output only. */
  String literal();

  record Scalar(String value) implements SqlParam {

    public Scalar {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String dataType() {
      return "String";
    }

    @Override
    public String wireValue() {
      return value;
    }

    @Override
    public String literal() {
      return quote(value);
    }
  }

  record StringArray(List<String> values) implements SqlParam {

    public StringArray {
      values = List.copyOf(values);
    }

    @Override
    public String dataType() {
      return "Array(String)";
    }

    @Override
    public String wireValue() {
      return values.stream().map(SqlParam::quote).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String literal() {
      return wireValue();
    }
  }

  static String quote(String value) {
    return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
  }
}
