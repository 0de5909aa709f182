package com.usagelens.engine.reader;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.JsonNode;
import com.usagelens.engine.window.DateRange;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only aggregations over collected usage. Argument errors (bad resolution, empty filter lists,
 * unresolvable periods) are thrown synchronously; store failures complete the returned future exceptionally.
 */
public interface UsageAnalyticsReader {

  CompletableFuture<RequestCounts> countRequests(TargetSelector selector, DateRange period, UsageFilters filters);

  CompletableFuture<Long> countFailures(TargetSelector selector, DateRange period, UsageFilters filters);

  CompletableFuture<Long> countOperations(TargetSelector selector, DateRange period);

  CompletableFuture<Long> countUniqueOperations(TargetSelector selector, DateRange period, UsageFilters filters);

  CompletableFuture<List<OperationStats>> readOperationStats(TargetSelector selector, DateRange period,
                                                            UsageFilters filters);

  CompletableFuture<Optional<String>> readOperationBody(TargetSelector selector, String hash);

  CompletableFuture<Set<String>> reportedSchemaCoordinates(TargetSelector selector, DateRange period);

  /**
   * @return coordinate to total, with a zero for every requested field the store has no rows for
   */
  CompletableFuture<Map<String, Long>> countFields(TargetSelector selector, DateRange period,
                                                   List<FieldSelector> fields, List<String> operations,
                                                   List<String> excludedClients);

  CompletableFuture<List<CoordinateCount>> countCoordinatesOfTarget(TargetSelector selector, DateRange period);

  /** Coordinates of one type (the type itself and its members). Batched per target and period. */
  CompletableFuture<List<CoordinateCount>> countCoordinatesOfType(String targetId, DateRange period,
                                                                  String typeName);

  /** Top {@code limit} operations per coordinate of one type. Batched per target, period and limit. */
  CompletableFuture<Map<String, List<TopOperation>>> topOperationsForCoordinate(String targetId, DateRange period,
                                                                                int limit, String typeName);

  /** Client names per coordinate of one type. Batched per target and period. */
  CompletableFuture<Map<String, Set<String>>> topClientsForCoordinate(String targetId, DateRange period,
                                                                      String typeName);

  CompletableFuture<List<ClientStats>> clientBreakdown(TargetSelector selector, DateRange period,
                                                       UsageFilters filters);

  CompletableFuture<List<VersionStats>> readClientVersions(TargetSelector selector, DateRange period,
                                                           String clientName, int limit);

  CompletableFuture<Long> countClientVersions(TargetSelector selector, DateRange period, String clientName);

  CompletableFuture<List<NamedCount>> readUniqueClientNames(TargetSelector selector, DateRange period,
                                                            List<String> operations);

  CompletableFuture<List<String>> clientNames(TargetSelector selector, DateRange period);

  CompletableFuture<List<TimeSeriesPoint>> requestsOverTime(TargetSelector selector, DateRange period,
                                                            int resolution, UsageFilters filters);

  CompletableFuture<List<TimeSeriesPoint>> failuresOverTime(TargetSelector selector, DateRange period,
                                                            int resolution, UsageFilters filters);

  CompletableFuture<List<DurationPoint>> durationOverTime(TargetSelector selector, DateRange period,
                                                          int resolution, UsageFilters filters);

  /**
   * One series per target for each selector. Selectors sharing period and resolution are answered by a
   * single query; the result list matches {@code selectors} by position.
   */
  CompletableFuture<List<Map<String, List<TimeSeriesPoint>>>> requestsOverTimeOfTargets(
      List<TargetsSeriesSelector> selectors);

  CompletableFuture<Percentiles> generalDurationPercentiles(TargetSelector selector, DateRange period,
                                                            UsageFilters filters);

  CompletableFuture<Map<String, Percentiles>> durationPercentiles(TargetSelector selector, DateRange period,
                                                                  UsageFilters filters);

  CompletableFuture<Boolean> hasCollectedOperations(TargetSelector selector);

  CompletableFuture<List<TargetTotal>> adminCountOperationsPerTarget(DateRange period);

  CompletableFuture<List<TimeSeriesPoint>> adminOperationsOverTime(DateRange period);

  record RequestCounts(long total, long ok, long notOk) {

    public static RequestCounts of(long total, long ok) {
      return new RequestCounts(total, ok, total - ok);
    }
  }

  /**
   * Duration percentiles in milliseconds. The store returns either a {@code [p75, p90, p95, p99]} tuple or
   * an object with named fields; both bind here.
   */
  record Percentiles(double p75, double p90, double p95, double p99) {

    public static final Percentiles ZERO = new Percentiles(0, 0, 0, 0);

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Percentiles from(JsonNode node) {
      if (node == null || node.isNull() || node.isMissingNode()) {
        return ZERO;
      }
      if (node.isArray()) {
        return new Percentiles(
            node.path(0).asDouble(0),
            node.path(1).asDouble(0),
            node.path(2).asDouble(0),
            node.path(3).asDouble(0)
        );
      }
      return new Percentiles(
          node.path("p75").asDouble(0),
          node.path("p90").asDouble(0),
          node.path("p95").asDouble(0),
          node.path("p99").asDouble(0)
      );
    }
  }

  record OperationStats(
      String operationHash,
      String operationName,
      String kind,
      long count,
      long countOk,
      double percentage
  ) {
  }

  record FieldSelector(String type, String field, String argument) {

    public static FieldSelector of(String type, String field) {
      return new FieldSelector(type, field, null);
    }

    /** {@code Type}, {@code Type.field} or {@code Type.field.argument}. */
    public String coordinate() {
      StringBuilder sb = new StringBuilder(type);
      if (field != null && !field.isEmpty()) {
        sb.append('.').append(field);
      }
      if (argument != null && !argument.isEmpty()) {
        sb.append('.').append(argument);
      }
      return sb.toString();
    }
  }

  record CoordinateCount(String coordinate, long total) {
  }

  record TopOperation(String operationName, String operationHash, long count) {
  }

  record ClientStats(String name, long count, double percentage, List<VersionStats> versions) {
  }

  record VersionStats(String version, long count, double percentage) {
  }

  record NamedCount(String name, long count) {
  }

  /** @param date bucket start, epoch milliseconds */
  record TimeSeriesPoint(long date, long value) {
  }

  record DurationPoint(long date, Percentiles duration) {
  }

  record TargetTotal(String target, long total) {
  }

  record TargetsSeriesSelector(List<String> targets, DateRange period, int resolution) {

    public TargetsSeriesSelector {
      targets = List.copyOf(targets);
    }

    String groupKey() {
      return period.key() + ";" + resolution;
    }
  }
}
