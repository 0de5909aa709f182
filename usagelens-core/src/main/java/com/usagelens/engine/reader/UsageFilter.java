package com.usagelens.engine.reader;

import com.usagelens.engine.sql.LongArraySplitter;
import com.usagelens.engine.sql.Sql;
import com.usagelens.engine.sql.SqlStatement;
import com.usagelens.engine.window.DateRange;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Builds the {@code PREWHERE} clause shared by every aggregation query: target, time range, operation
 * hashes, client names and free-form predicates, joined with {@code AND}.
 */
public final class UsageFilter {

  private static final DateTimeFormatter DATE_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  private List<String> targets = List.of();
  private DateRange period;
  private boolean endExclusive;
  private List<String> operations = List.of();
  private List<String> clients = List.of();
  private final List<SqlStatement> extra = new ArrayList<>();
  private String namespace;
  private boolean skipWhere;
  private int longArrayCharLimit = LongArraySplitter.DEFAULT_CHAR_LIMIT;

  public static UsageFilter builder() {
    return new UsageFilter();
  }

  public static String formatDate(Instant instant) {
    return DATE_FORMAT.format(instant);
  }

  public UsageFilter target(String target) {
    this.targets = List.of(target);
    return this;
  }

  public UsageFilter targets(Collection<String> targets) {
    this.targets = List.copyOf(targets);
    return this;
  }

  public UsageFilter period(DateRange period) {
    this.period = period;
    this.endExclusive = false;
    return this;
  }

  /** Period whose {@code to} is the exclusive end of the last bucket. */
  public UsageFilter bucketedPeriod(DateRange period) {
    this.period = period;
    this.endExclusive = true;
    return this;
  }

  public UsageFilter operations(Collection<String> operations) {
    this.operations = operations == null ? List.of() : List.copyOf(operations);
    return this;
  }

  public UsageFilter clients(Collection<String> clients) {
    this.clients = clients == null ? List.of() : List.copyOf(clients);
    return this;
  }

  public UsageFilter extra(SqlStatement condition) {
    if (condition != null && !condition.isBlank()) {
      this.extra.add(condition);
    }
    return this;
  }

  public UsageFilter namespace(String namespace) {
    this.namespace = namespace;
    return this;
  }

  /** Emit the bare conditions, for callers that put them after their own keyword. */
  public UsageFilter skipWhere() {
    this.skipWhere = true;
    return this;
  }

  public UsageFilter longArrayCharLimit(int limit) {
    this.longArrayCharLimit = limit;
    return this;
  }

  public SqlStatement build() {
    String prefix = namespace == null || namespace.isBlank() ? "" : namespace + ".";
    List<SqlStatement> where = new ArrayList<>();

    if (targets.size() == 1) {
      where.add(Sql.sql(prefix + "target = {}", Sql.value(targets.get(0))));
    } else if (!targets.isEmpty()) {
      where.add(Sql.sql(prefix + "target IN ({})", Sql.array(targets)));
    }

    if (period != null) {
      where.add(Sql.sql(prefix + "timestamp >= toDateTime({}, 'UTC')", Sql.value(formatDate(period.from()))));
      where.add(Sql.sql(prefix + "timestamp " + (endExclusive ? "<" : "<=") + " toDateTime({}, 'UTC')",
          Sql.value(formatDate(period.to()))));
    }

    if (!operations.isEmpty()) {
      where.add(Sql.sql("(" + prefix + "hash) IN ({})", Sql.longArray(operations, longArrayCharLimit)));
    }

    if (!clients.isEmpty()) {
      where.add(Sql.sql(prefix + "client_name IN ({})", Sql.array(clients)));
    }

    where.addAll(extra);

    if (where.isEmpty()) {
      return Sql.empty();
    }
    return Sql.sql(skipWhere ? " {} " : " PREWHERE {} ", Sql.join(where, " AND "));
  }
}
