package com.usagelens.engine.sql;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL text with 1-indexed, contiguous {@code {pN: Type}} placeholders and the ordered values bound to them.
 */
public record SqlStatement(String text, List<SqlParam> params) implements SqlExpr {

  public static final SqlStatement EMPTY = new SqlStatement("", List.of());

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{p(\\d+): [^}]*}");

  public SqlStatement {
    Objects.requireNonNull(text, "text");
    params = List.copyOf(params);
  }

  @Override
  public void render(SqlRenderer out) {
    out.appendFragment(this);
  }

  public int parameterCount() {
    return params.size();
  }

  public boolean isBlank() {
    return text.isBlank() && params.isEmpty();
  }

  /**
   * Named parameters {@code p1..pN} in binding order.
   */
  public Map<String, String> toQueryParams() {
    Map<String, String> named = new LinkedHashMap<>();
    for (int i = 0; i < params.size(); i++) {
      named.put("p" + (i + 1), params.get(i).wireValue());
    }
    return named;
  }

  /**
   * Substitutes quoted literals for the placeholders. For log output only, never for execution.
   */
  public String printWithValues() {
    Matcher matcher = PLACEHOLDER.matcher(text);
    StringBuilder sb = new StringBuilder(text.length() + 32);
    while (matcher.find()) {
      int index = Integer.parseInt(matcher.group(1)) - 1;
      String replacement = index >= 0 && index < params.size() ? params.get(index).literal() : matcher.group();
      matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  @Override
  public String toString() {
    return text;
  }
}
