package com.usagelens.engine.sql;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Entry point of the statement builder.
 *
 * <pre>{@code
 * SqlStatement filter = Sql.sql("target = {} AND hash IN ({})", Sql.value(target), Sql.array(hashes));
 * SqlStatement query = Sql.sql("SELECT sum(total) AS total FROM {} PREWHERE {}", Sql.raw(table), filter);
 * }</pre>
 *
 * Every {@code {}} in a template is a slot filled by the matching expression. Scalars and arrays become
 * parameters, {@link SqlStatement}s are spliced with their placeholders renumbered.
 */
@UtilityClass
public class Sql {

  public static final String SLOT = "{}";

  public static SqlStatement sql(String template, SqlExpr... values) {
    if (template == null) {
      throw new QueryBuildException("SQL template cannot be null.");
    }
    List<String> parts = splitTemplate(template);
    int slots = parts.size() - 1;
    int bound = values == null ? 0 : values.length;
    if (slots != bound) {
      throw new QueryBuildException("SQL template has " + slots + " slots but " + bound + " values were bound.");
    }

    SqlRenderer out = new SqlRenderer();
    for (int i = 0; i < parts.size(); i++) {
      out.appendRaw(parts.get(i));
      if (i < slots) {
        SqlExpr value = values[i];
        if (value == null) {
          throw new QueryBuildException("SQL tag cannot be bound an undefined value.");
        }
        value.render(out);
      }
    }
    return out.build();
  }

  public static SqlExpr.Raw raw(String sql) {
    if (sql == null) {
      throw new QueryBuildException("sql.raw cannot be bound an undefined value.");
    }
    return new SqlExpr.Raw(sql);
  }

  public static SqlExpr.Scalar value(String value) {
    if (value == null) {
      throw new QueryBuildException("SQL tag cannot be bound an undefined value.");
    }
    return new SqlExpr.Scalar(value);
  }

  public static SqlExpr.StringArray array(Collection<String> values) {
    return new SqlExpr.StringArray(checked(values));
  }

  public static SqlExpr.StringArray array(String single) {
    return new SqlExpr.StringArray(List.of(value(single).value()));
  }

  public static SqlExpr.LongArray longArray(Collection<String> values) {
    return longArray(values, LongArraySplitter.DEFAULT_CHAR_LIMIT);
  }

  public static SqlExpr.LongArray longArray(Collection<String> values, int charLimit) {
    return new SqlExpr.LongArray(checked(values), charLimit);
  }

  public static SqlExpr.Join join(List<? extends SqlExpr> members, String separator) {
    return new SqlExpr.Join(members, separator);
  }

  /** Joins plain strings, each bound as a scalar parameter. */
  public static SqlExpr.Join joinValues(Collection<String> values, String separator) {
    return new SqlExpr.Join(checked(values).stream().map(Sql::value).toList(), separator);
  }

  public static SqlStatement empty() {
    return SqlStatement.EMPTY;
  }

  private static List<String> checked(Collection<String> values) {
    if (values == null) {
      throw new QueryBuildException("SQL array cannot be bound an undefined value.");
    }
    for (String value : values) {
      if (value == null) {
        throw new QueryBuildException("SQL array cannot contain an undefined value.");
      }
    }
    return List.copyOf(values);
  }

  private static List<String> splitTemplate(String template) {
    List<String> parts = new ArrayList<>();
    int start = 0;
    int slot;
    while ((slot = template.indexOf(SLOT, start)) >= 0) {
      parts.add(template.substring(start, slot));
      start = slot + SLOT.length();
    }
    parts.add(template.substring(start));
    return parts;
  }
}
