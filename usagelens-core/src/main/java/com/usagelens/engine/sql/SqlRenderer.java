package com.usagelens.engine.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accumulates SQL text and parameters while a template is expanded.
 */
public final class SqlRenderer {

  private static final Pattern PARAM_INDEX = Pattern.compile("\\{p(\\d+)");

  private final StringBuilder text = new StringBuilder();
  private final List<SqlParam> params = new ArrayList<>();

  SqlRenderer() {
  }

  void appendRaw(String sql) {
    text.append(sql);
  }

  void appendParam(SqlParam param) {
    params.add(param);
    text.append("{p").append(params.size()).append(": ").append(param.dataType()).append('}');
  }

  /**
   * Splices a built statement, shifting its placeholders past the parameters accumulated so far.
   */
  void appendFragment(SqlStatement fragment) {
    int offset = params.size();
    int least = Integer.MAX_VALUE;
    int greatest = 0;

    Matcher matcher = PARAM_INDEX.matcher(fragment.text());
    StringBuilder shifted = new StringBuilder(fragment.text().length() + 8);
    while (matcher.find()) {
      int position = Integer.parseInt(matcher.group(1));
      least = Math.min(least, position);
      greatest = Math.max(greatest, position);
      matcher.appendReplacement(shifted, "{p" + (position + offset));
    }
    matcher.appendTail(shifted);

    if (greatest > fragment.params().size()) {
      throw new QueryBuildException(
          "The greatest parameter position is greater than the number of parameter values.");
    }
    if (least != Integer.MAX_VALUE && least != 1) {
      throw new QueryBuildException("Parameter position must start at 1.");
    }

    text.append(shifted);
    params.addAll(fragment.params());
  }

  SqlStatement build() {
    return new SqlStatement(text.toString(), params);
  }
}
