package com.usagelens.engine.sql;

import java.util.List;
import java.util.Objects;

/**
 * A value expression that can fill a slot of an SQL template.
 *
 * <p>Every variant renders itself into a {@link SqlRenderer}, so the set of variants is closed and adding one
 * forces an implementation of {@link #render(SqlRenderer)}.
 */
public sealed interface SqlExpr
    permits SqlStatement, SqlExpr.Raw, SqlExpr.Scalar, SqlExpr.StringArray, SqlExpr.LongArray, SqlExpr.Join {

  void render(SqlRenderer out);

  /** Unescaped SQL text; only for identifiers and constants the caller controls. */
  record Raw(String sql) implements SqlExpr {

    public Raw {
      Objects.requireNonNull(sql, "sql");
    }

    @Override
    public void render(SqlRenderer out) {
      out.appendRaw(sql);
    }
  }

  record Scalar(String value) implements SqlExpr {

    @Override
    public void render(SqlRenderer out) {
      out.appendParam(new SqlParam.Scalar(value));
    }
  }

  record StringArray(List<String> values) implements SqlExpr {

    public StringArray {
      values = List.copyOf(values);
    }

    @Override
    public void render(SqlRenderer out) {
      out.appendParam(new SqlParam.StringArray(values));
    }
  }

  /**
   * An array that may be too large for a single statement. It is split into batches under
   * {@code charLimit} and, when more than one batch results, re-assembled with {@code arrayConcat}.
   */
  record LongArray(List<String> values, int charLimit) implements SqlExpr {

    public LongArray {
      values = List.copyOf(values);
      if (charLimit <= 0) {
        throw new QueryBuildException("long array char limit must be > 0");
      }
    }

    @Override
    public void render(SqlRenderer out) {
      List<List<String>> batches = LongArraySplitter.split(values, charLimit);
      if (batches.size() == 1) {
        out.appendParam(new SqlParam.StringArray(batches.get(0)));
        return;
      }
      out.appendRaw("arrayConcat(");
      for (int i = 0; i < batches.size(); i++) {
        if (i > 0) {
          out.appendRaw(", ");
        }
        out.appendParam(new SqlParam.StringArray(batches.get(i)));
      }
      out.appendRaw(")");
    }
  }

  record Join(List<? extends SqlExpr> members, String separator) implements SqlExpr {

    public Join {
      Objects.requireNonNull(separator, "separator");
      if (members == null || members.isEmpty()) {
        throw new QueryBuildException("sql.join must have at least one member");
      }
      for (SqlExpr member : members) {
        if (member == null) {
          throw new QueryBuildException("sql.join cannot contain an undefined member");
        }
      }
      members = List.copyOf(members);
    }

    @Override
    public void render(SqlRenderer out) {
      for (int i = 0; i < members.size(); i++) {
        if (i > 0) {
          out.appendRaw(separator);
        }
        members.get(i).render(out);
      }
    }
  }
}
