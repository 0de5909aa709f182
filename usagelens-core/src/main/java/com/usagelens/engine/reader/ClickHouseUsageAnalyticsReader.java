package com.usagelens.engine.reader;

import com.usagelens.engine.batch.BatchedLoader;
import com.usagelens.engine.clickhouse.ClickHouseClient;
import com.usagelens.engine.clickhouse.QueryRequest;
import com.usagelens.engine.clickhouse.QueryResult;
import com.usagelens.engine.reader.UsageRows.BodyRow;
import com.usagelens.engine.reader.UsageRows.ClientNameCountRow;
import com.usagelens.engine.reader.UsageRows.ClientNameRow;
import com.usagelens.engine.reader.UsageRows.ClientVersionRow;
import com.usagelens.engine.reader.UsageRows.CoordinateClientsRow;
import com.usagelens.engine.reader.UsageRows.CoordinateRow;
import com.usagelens.engine.reader.UsageRows.CoordinateTotalRow;
import com.usagelens.engine.reader.UsageRows.DateTotalRow;
import com.usagelens.engine.reader.UsageRows.ExistsRow;
import com.usagelens.engine.reader.UsageRows.HashPercentilesRow;
import com.usagelens.engine.reader.UsageRows.HashTotalsRow;
import com.usagelens.engine.reader.UsageRows.PercentilesRow;
import com.usagelens.engine.reader.UsageRows.RegistryRow;
import com.usagelens.engine.reader.UsageRows.SeriesRow;
import com.usagelens.engine.reader.UsageRows.TargetSeriesRow;
import com.usagelens.engine.reader.UsageRows.TargetTotalRow;
import com.usagelens.engine.reader.UsageRows.TopOperationRow;
import com.usagelens.engine.reader.UsageRows.TotalOkRow;
import com.usagelens.engine.reader.UsageRows.TotalRow;
import com.usagelens.engine.sql.QueryBuildException;
import com.usagelens.engine.sql.Sql;
import com.usagelens.engine.sql.SqlStatement;
import com.usagelens.engine.window.BucketedPeriod;
import com.usagelens.engine.window.DateRange;
import com.usagelens.engine.window.Granularity;
import com.usagelens.engine.window.ParsedInterval;
import com.usagelens.engine.window.TimeWindowResolver;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Slf4j
public class ClickHouseUsageAnalyticsReader implements UsageAnalyticsReader {

  private static final String PERCENTILES = "quantilesMerge(0.75, 0.90, 0.95, 0.99)(duration_quantiles)";
  private static final String UNKNOWN_CLIENT = "unknown";
  private static final Duration SERIES_TIMEOUT = Duration.ofSeconds(15);
  private static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration COORDINATE_TIMEOUT = Duration.ofSeconds(15);
  private static final Duration FIELDS_TIMEOUT = Duration.ofSeconds(30);

  private final ClickHouseClient client;
  private final Clock clock;
  private final CollectedOperationsCache collectedOperations;
  private final int longArrayCharLimit;

  private final BatchedLoader<TypeLookup, List<CoordinateCount>> coordinatesOfType;
  private final BatchedLoader<TypeLookup, Map<String, List<TopOperation>>> topOperations;
  private final BatchedLoader<TypeLookup, Map<String, Set<String>>> topClients;

  public ClickHouseUsageAnalyticsReader(
      ClickHouseClient client,
      Clock clock,
      CollectedOperationsCache collectedOperations,
      int longArrayCharLimit,
      int maxBatchSize,
      Executor batchFlushExecutor
  ) {
    this.client = Objects.requireNonNull(client, "client");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.collectedOperations = Objects.requireNonNull(collectedOperations, "collectedOperations");
    this.longArrayCharLimit = longArrayCharLimit;
    this.coordinatesOfType = new BatchedLoader<>("coordinates_of_type", TypeLookup::targetAndPeriod,
        this::loadCoordinatesOfTypes, maxBatchSize, batchFlushExecutor);
    this.topOperations = new BatchedLoader<>("top_operations_for_types", TypeLookup::targetPeriodAndLimit,
        this::loadTopOperations, maxBatchSize, batchFlushExecutor);
    this.topClients = new BatchedLoader<>("clients_per_coordinate", TypeLookup::targetAndPeriod,
        this::loadTopClients, maxBatchSize, batchFlushExecutor);
  }

  @Override
  public CompletableFuture<RequestCounts> countRequests(TargetSelector selector, DateRange period,
                                                        UsageFilters filters) {
    Granularity granularity = granularity(period);
    SqlStatement query = Sql.sql("SELECT sum(total) AS total, sum(total_ok) AS totalOk FROM {}{}",
        Sql.raw(granularity.table("operations")),
        filtered(selector, period, filters).build());
    return client.query(request(query, "count_operations", granularity), TotalOkRow.class)
        .thenApply(result -> result.first()
            .map(row -> RequestCounts.of(row.total(), row.totalOk()))
            .orElse(RequestCounts.of(0, 0)));
  }

  @Override
  public CompletableFuture<Long> countFailures(TargetSelector selector, DateRange period, UsageFilters filters) {
    return countRequests(selector, period, filters).thenApply(RequestCounts::notOk);
  }

  @Override
  public CompletableFuture<Long> countOperations(TargetSelector selector, DateRange period) {
    Granularity granularity = granularity(period);
    SqlStatement query = Sql.sql("SELECT sum(total) AS total FROM {}{}",
        Sql.raw(granularity.table("operations")),
        filter(selector).period(period).build());
    return client.query(request(query, "count_operations_total", granularity), TotalRow.class)
        .thenApply(ClickHouseUsageAnalyticsReader::firstTotal);
  }

  @Override
  public CompletableFuture<Long> countUniqueOperations(TargetSelector selector, DateRange period,
                                                       UsageFilters filters) {
    Granularity granularity = granularity(period);
    SqlStatement query = Sql.sql("SELECT count(distinct hash) AS total FROM {}{}",
        Sql.raw(granularity.table("operations")),
        filtered(selector, period, filters).build());
    return client.query(request(query, "count_unique_documents", granularity), TotalRow.class)
        .thenApply(ClickHouseUsageAnalyticsReader::firstTotal);
  }

  @Override
  public CompletableFuture<List<OperationStats>> readOperationStats(TargetSelector selector, DateRange period,
                                                                   UsageFilters filters) {
    filters = UsageFilters.orNone(filters);
    Granularity granularity = granularity(period);
    String table = granularity.table("operations");
    SqlStatement totals = Sql.sql(
        "SELECT hash, sum(total) AS total, sum(total_ok) AS totalOk FROM {}{} GROUP BY hash",
        Sql.raw(table),
        filtered(selector, period, filters).build());
    SqlStatement hashes = Sql.sql("SELECT hash FROM {}{} GROUP BY hash",
        Sql.raw(table),
        filter(selector)
            .period(period)
            .operations(filters.operations())
            .extra(coordinateCondition(selector, period, filters.schemaCoordinate()))
            .build());
    SqlStatement registry = Sql.sql(
        "SELECT name, hash, operation_kind FROM operation_collection_details{} GROUP BY name, hash, operation_kind",
        filter(selector).extra(Sql.sql("hash IN ({})", hashes)).build());

    CompletableFuture<QueryResult<HashTotalsRow>> totalsFuture =
        client.query(request(totals, "read_unique_documents", granularity), HashTotalsRow.class);
    CompletableFuture<QueryResult<RegistryRow>> registryFuture =
        client.query(QueryRequest.of(registry, "operations_registry", COORDINATE_TIMEOUT), RegistryRow.class);

    return totalsFuture.thenCombine(registryFuture, (totalRows, registryRows) -> {
      Map<String, RegistryRow> byHash = new HashMap<>();
      for (RegistryRow row : registryRows.data()) {
        byHash.put(row.hash(), row);
      }
      long total = totalRows.data().stream().mapToLong(HashTotalsRow::total).sum();
      List<OperationStats> stats = new ArrayList<>(totalRows.data().size());
      for (HashTotalsRow row : totalRows.data()) {
        RegistryRow registered = byHash.get(row.hash());
        String name = registered == null ? "missing" : registered.name();
        String kind = registered == null ? "missing" : registered.operationKind();
        stats.add(new OperationStats(
            row.hash(),
            operationName(row.hash(), name),
            kind,
            row.total(),
            row.totalOk(),
            percentage(row.total(), total)
        ));
      }
      return stats;
    });
  }

  @Override
  public CompletableFuture<Optional<String>> readOperationBody(TargetSelector selector, String hash) {
    SqlStatement query = Sql.sql(
        "SELECT body FROM operation_collection_body{} LIMIT 1 "
            + "SETTINGS allow_asynchronous_read_from_io_pool_for_merge_tree = 1",
        filter(selector).extra(Sql.sql("hash = {}", Sql.value(hash))).build());
    return client.query(QueryRequest.of(query, "read_body", LOOKUP_TIMEOUT), BodyRow.class)
        .thenApply(result -> result.first().map(BodyRow::body));
  }

  @Override
  public CompletableFuture<Set<String>> reportedSchemaCoordinates(TargetSelector selector, DateRange period) {
    SqlStatement query = Sql.sql("SELECT coordinate FROM coordinates_daily{} GROUP BY coordinate",
        filter(selector)
            .period(period)
            .extra(Sql.sql("coordinate NOT ILIKE '%.__typename'"))
            .build());
    return client.query(QueryRequest.of(query, "reported_schema_coordinates", LOOKUP_TIMEOUT), CoordinateRow.class)
        .thenApply(result -> {
          Set<String> coordinates = new LinkedHashSet<>();
          result.data().forEach(row -> coordinates.add(row.coordinate()));
          return coordinates;
        });
  }

  @Override
  public CompletableFuture<Map<String, Long>> countFields(TargetSelector selector, DateRange period,
                                                          List<FieldSelector> fields, List<String> operations,
                                                          List<String> excludedClients) {
    List<String> coordinates = fields.stream().map(FieldSelector::coordinate).toList();
    UsageFilter where = filter(selector)
        .period(period)
        .operations(operations)
        .extra(Sql.sql("(coordinate IN ({}))", Sql.longArray(coordinates, longArrayCharLimit)));
    if (excludedClients != null && !excludedClients.isEmpty()) {
      // keep operations sent by at least one client outside the excluded set
      where.extra(Sql.sql(
          "hash IN (SELECT hash FROM clients_daily{} GROUP BY hash HAVING countIf(client_name NOT IN ({})) > 0)",
          filter(selector).period(period).build(),
          Sql.array(excludedClients)));
    }
    SqlStatement query = Sql.sql("SELECT coordinate, sum(total) AS total FROM coordinates_daily{} GROUP BY coordinate",
        where.build());
    return client.query(QueryRequest.of(query, "count_fields_v2", FIELDS_TIMEOUT), CoordinateTotalRow.class)
        .thenApply(result -> {
          Map<String, Long> stats = new LinkedHashMap<>();
          for (CoordinateTotalRow row : result.data()) {
            stats.put(row.coordinate(), row.total());
          }
          for (String coordinate : coordinates) {
            stats.putIfAbsent(coordinate, 0L);
          }
          return stats;
        });
  }

  @Override
  public CompletableFuture<List<CoordinateCount>> countCoordinatesOfTarget(TargetSelector selector,
                                                                         DateRange period) {
    SqlStatement query = Sql.sql("SELECT coordinate, sum(total) AS total FROM coordinates_daily{} GROUP BY coordinate",
        filter(selector).period(period).build());
    return client.query(QueryRequest.of(query, "coordinates_per_target", COORDINATE_TIMEOUT), CoordinateTotalRow.class)
        .thenApply(result -> result.data().stream()
            .map(row -> new CoordinateCount(row.coordinate(), row.total()))
            .toList());
  }

  @Override
  public CompletableFuture<List<CoordinateCount>> countCoordinatesOfType(String targetId, DateRange period,
                                                                         String typeName) {
    return coordinatesOfType.load(TypeLookup.of(targetId, period, typeName, 0));
  }

  @Override
  public CompletableFuture<Map<String, List<TopOperation>>> topOperationsForCoordinate(String targetId,
                                                                                       DateRange period,
                                                                                       int limit,
                                                                                       String typeName) {
    if (limit <= 0) {
      throw new QueryBuildException("limit must be > 0");
    }
    return topOperations.load(TypeLookup.of(targetId, period, typeName, limit));
  }

  @Override
  public CompletableFuture<Map<String, Set<String>>> topClientsForCoordinate(String targetId, DateRange period,
                                                                             String typeName) {
    return topClients.load(TypeLookup.of(targetId, period, typeName, 0));
  }

  @Override
  public CompletableFuture<List<ClientStats>> clientBreakdown(TargetSelector selector, DateRange period,
                                                              UsageFilters filters) {
    filters = UsageFilters.orNone(filters);
    Granularity granularity = granularity(period);
    SqlStatement query = Sql.sql(
        "SELECT sum(total) AS total, client_name, client_version FROM {}{} "
            + "GROUP BY client_name, client_version ORDER BY total DESC",
        Sql.raw(clientsTable(granularity)),
        filter(selector)
            .period(period)
            .operations(filters.operations())
            .extra(coordinateCondition(selector, period, filters.schemaCoordinate()))
            .build());
    return client.query(request(query, "count_clients", granularity), ClientVersionRow.class)
        .thenApply(result -> {
          long total = result.data().stream().mapToLong(ClientVersionRow::total).sum();
          Map<String, List<ClientVersionRow>> byName = new LinkedHashMap<>();
          for (ClientVersionRow row : result.data()) {
            byName.computeIfAbsent(orUnknown(row.clientName()), k -> new ArrayList<>()).add(row);
          }
          List<ClientStats> clients = new ArrayList<>(byName.size());
          byName.forEach((name, rows) -> {
            long clientTotal = rows.stream().mapToLong(ClientVersionRow::total).sum();
            List<VersionStats> versions = rows.stream()
                .map(row -> new VersionStats(orUnknown(row.clientVersion()), row.total(),
                    percentage(row.total(), clientTotal)))
                .toList();
            clients.add(new ClientStats(name, clientTotal, percentage(clientTotal, total), versions));
          });
          return clients;
        });
  }

  @Override
  public CompletableFuture<List<VersionStats>> readClientVersions(TargetSelector selector, DateRange period,
                                                                  String clientName, int limit) {
    if (limit <= 0) {
      throw new QueryBuildException("limit must be > 0");
    }
    Granularity granularity = granularity(period);
    SqlStatement query = Sql.sql(
        "SELECT sum(total) AS total, client_version FROM {}{} GROUP BY client_version ORDER BY total DESC LIMIT {}",
        Sql.raw(clientsTable(granularity)),
        filter(selector).period(period).clients(clientNameVariants(clientName)).build(),
        Sql.raw(Integer.toString(limit)));
    return client.query(request(query, "read_client_versions", granularity), ClientVersionRow.class)
        .thenApply(result -> {
          long total = result.data().stream().mapToLong(ClientVersionRow::total).sum();
          return result.data().stream()
              .map(row -> new VersionStats(orUnknown(row.clientVersion()), row.total(), percentage(row.total(), total)))
              .toList();
        });
  }

  @Override
  public CompletableFuture<Long> countClientVersions(TargetSelector selector, DateRange period, String clientName) {
    Granularity granularity = granularity(period);
    SqlStatement query = Sql.sql("SELECT count(distinct client_version) AS total FROM {}{}",
        Sql.raw(clientsTable(granularity)),
        filter(selector).period(period).clients(clientNameVariants(clientName)).build());
    return client.query(request(query, "count_client_versions", granularity), TotalRow.class)
        .thenApply(ClickHouseUsageAnalyticsReader::firstTotal);
  }

  @Override
  public CompletableFuture<List<NamedCount>> readUniqueClientNames(TargetSelector selector, DateRange period,
                                                                   List<String> operations) {
    SqlStatement query = Sql.sql("SELECT sum(total) AS count, client_name FROM clients_daily{} GROUP BY client_name",
        filter(selector)
            .period(period)
            .operations(operations)
            .extra(Sql.sql("notEmpty(client_name)"))
            .build());
    return client.query(QueryRequest.of(query, "count_client_names", LOOKUP_TIMEOUT), ClientNameCountRow.class)
        .thenApply(result -> result.data().stream()
            .map(row -> new NamedCount(row.clientName(), row.count()))
            .toList());
  }

  @Override
  public CompletableFuture<List<String>> clientNames(TargetSelector selector, DateRange period) {
    SqlStatement query = Sql.sql("SELECT client_name FROM clients_daily{} GROUP BY client_name",
        filter(selector).period(period).build());
    return client.query(QueryRequest.of(query, "client_names_per_target_v2", LOOKUP_TIMEOUT), ClientNameRow.class)
        .thenApply(result -> result.data().stream().map(ClientNameRow::clientName).toList());
  }

  @Override
  public CompletableFuture<List<TimeSeriesPoint>> requestsOverTime(TargetSelector selector, DateRange period,
                                                                   int resolution, UsageFilters filters) {
    return durationAndCountOverTime(selector, period, resolution, filters)
        .thenApply(rows -> rows.stream().map(row -> new TimeSeriesPoint(row.date(), row.total())).toList());
  }

  @Override
  public CompletableFuture<List<TimeSeriesPoint>> failuresOverTime(TargetSelector selector, DateRange period,
                                                                   int resolution, UsageFilters filters) {
    return durationAndCountOverTime(selector, period, resolution, filters)
        .thenApply(rows -> rows.stream()
            .map(row -> new TimeSeriesPoint(row.date(), row.total() - row.totalOk()))
            .toList());
  }

  @Override
  public CompletableFuture<List<DurationPoint>> durationOverTime(TargetSelector selector, DateRange period,
                                                                 int resolution, UsageFilters filters) {
    return durationAndCountOverTime(selector, period, resolution, filters)
        .thenApply(rows -> rows.stream()
            .map(row -> new DurationPoint(row.date(), orZero(row.percentiles())))
            .toList());
  }

  @Override
  public CompletableFuture<List<Map<String, List<TimeSeriesPoint>>>> requestsOverTimeOfTargets(
      List<TargetsSeriesSelector> selectors) {
    Map<String, TargetsSeriesSelector> groups = new LinkedHashMap<>();
    Map<String, Set<String>> groupTargets = new LinkedHashMap<>();
    for (TargetsSeriesSelector selector : selectors) {
      groups.putIfAbsent(selector.groupKey(), selector);
      groupTargets.computeIfAbsent(selector.groupKey(), k -> new LinkedHashSet<>()).addAll(selector.targets());
    }

    Map<String, CompletableFuture<QueryResult<TargetSeriesRow>>> results = new LinkedHashMap<>();
    groups.forEach((key, selector) -> {
      ParsedInterval interval = TimeWindowResolver.calculateInterval(selector.period(), selector.resolution());
      Granularity granularity = granularity(selector.period(), interval);
      SqlStatement query = Sql.sql(
          "SELECT multiply(toUnixTimestamp({}, 'UTC'), 1000) AS date, sum(total) AS total, target "
              + "FROM {}{} GROUP BY date, target ORDER BY date",
          bucketExpression(interval),
          Sql.raw(granularity.table("operations")),
          UsageFilter.builder()
              .targets(groupTargets.get(key))
              .period(selector.period())
              .longArrayCharLimit(longArrayCharLimit)
              .build());
      results.put(key, client.query(
          QueryRequest.of(query, "targets_count_over_time_" + granularity.suffix(), SERIES_TIMEOUT),
          TargetSeriesRow.class));
    });

    CompletableFuture<?>[] all = results.values().toArray(CompletableFuture[]::new);
    return CompletableFuture.allOf(all).thenApply(ignored -> {
      List<Map<String, List<TimeSeriesPoint>>> out = new ArrayList<>(selectors.size());
      for (TargetsSeriesSelector selector : selectors) {
        QueryResult<TargetSeriesRow> rows = results.get(selector.groupKey()).join();
        Map<String, List<TimeSeriesPoint>> perTarget = new LinkedHashMap<>();
        for (TargetSeriesRow row : rows.data()) {
          if (selector.targets().contains(row.target())) {
            perTarget.computeIfAbsent(row.target(), k -> new ArrayList<>())
                .add(new TimeSeriesPoint(row.date(), row.total()));
          }
        }
        out.add(perTarget);
      }
      return out;
    });
  }

  @Override
  public CompletableFuture<Percentiles> generalDurationPercentiles(TargetSelector selector, DateRange period,
                                                                   UsageFilters filters) {
    filters = UsageFilters.orNone(filters);
    Granularity granularity = granularity(period);
    SqlStatement query = Sql.sql("SELECT {} AS percentiles FROM {}{}",
        Sql.raw(PERCENTILES),
        Sql.raw(granularity.table("operations")),
        filter(selector)
            .period(period)
            .operations(filters.operations())
            .clients(filters.clients())
            .build());
    return client.query(request(query, "general_duration_percentiles", granularity), PercentilesRow.class)
        .thenApply(result -> result.first()
            .map(row -> orZero(row.percentiles()))
            .orElse(Percentiles.ZERO));
  }

  @Override
  public CompletableFuture<Map<String, Percentiles>> durationPercentiles(TargetSelector selector, DateRange period,
                                                                         UsageFilters filters) {
    Granularity granularity = granularity(period);
    SqlStatement query = Sql.sql("SELECT hash, {} AS percentiles FROM {}{} GROUP BY hash",
        Sql.raw(PERCENTILES),
        Sql.raw(granularity.table("operations")),
        filtered(selector, period, filters).build());
    return client.query(request(query, "duration_percentiles", granularity), HashPercentilesRow.class)
        .thenApply(result -> {
          Map<String, Percentiles> byHash = new LinkedHashMap<>();
          result.data().forEach(row -> byHash.put(row.hash(), orZero(row.percentiles())));
          return byHash;
        });
  }

  @Override
  public CompletableFuture<Boolean> hasCollectedOperations(TargetSelector selector) {
    return collectedOperations.get(selector.key(), () -> {
      SqlStatement query = Sql.sql("SELECT 1 AS exists FROM target_existence{} GROUP BY target LIMIT 1",
          filter(selector).build());
      return client.query(QueryRequest.of(query, "has_collected_operations", LOOKUP_TIMEOUT), ExistsRow.class)
          .thenApply(result -> result.rows() > 0);
    });
  }

  @Override
  public CompletableFuture<List<TargetTotal>> adminCountOperationsPerTarget(DateRange period) {
    SqlStatement query = Sql.sql("SELECT sum(total) AS total, target FROM operations_daily{} GROUP BY target",
        UsageFilter.builder().period(period).build());
    return client.query(QueryRequest.of(query, "admin_operations_per_target", COORDINATE_TIMEOUT),
            TargetTotalRow.class)
        .thenApply(result -> result.data().stream()
            .map(row -> new TargetTotal(row.target(), row.total()))
            .toList());
  }

  @Override
  public CompletableFuture<List<TimeSeriesPoint>> adminOperationsOverTime(DateRange period) {
    long days = period.span().toDays();
    int resolution = (int) Math.max(TimeWindowResolver.MIN_RESOLUTION,
        Math.min(TimeWindowResolver.MAX_RESOLUTION, days <= 1 ? 60 : days));
    ParsedInterval interval = TimeWindowResolver.calculateInterval(period, resolution);
    Granularity granularity = granularity(period, interval);
    SqlStatement query = Sql.sql(
        "SELECT multiply(toUnixTimestamp({}, 'UTC'), 1000) AS date, sum(total) AS total FROM {}{} "
            + "GROUP BY date ORDER BY date",
        bucketExpression(interval),
        Sql.raw(granularity.table("operations")),
        UsageFilter.builder().period(period).build());
    return client.query(request(query, "admin_operations_over_time", granularity), DateTotalRow.class)
        .thenApply(result -> result.data().stream()
            .map(row -> new TimeSeriesPoint(row.date(), row.total()))
            .toList());
  }

  private CompletableFuture<List<SeriesRow>> durationAndCountOverTime(TargetSelector selector, DateRange period,
                                                                     int resolution, UsageFilters filters) {
    filters = UsageFilters.orNone(filters);
    ParsedInterval interval = TimeWindowResolver.calculateInterval(period, resolution);
    Granularity granularity = granularity(period, interval);
    BucketedPeriod buckets = TimeWindowResolver.bucketize(period, interval);

    SqlStatement query = Sql.sql(
        "SELECT multiply(toUnixTimestamp(bucket, 'UTC'), 1000) AS date, percentiles, total, totalOk FROM ("
            + " SELECT {} AS bucket, {} AS percentiles, sum(total) AS total, sum(total_ok) AS totalOk"
            + " FROM {}{}"
            + " GROUP BY bucket ORDER BY bucket"
            + " WITH FILL FROM toDateTime({}, 'UTC') TO toDateTime({}, 'UTC') STEP INTERVAL {}"
            + ")",
        bucketExpression(interval),
        Sql.raw(PERCENTILES),
        Sql.raw(granularity.table("operations")),
        filter(selector)
            .bucketedPeriod(buckets.toDateRange())
            .operations(filters.operations())
            .clients(filters.clients())
            .extra(coordinateCondition(selector, period, filters.schemaCoordinate()))
            .build(),
        Sql.value(UsageFilter.formatDate(buckets.from())),
        Sql.value(UsageFilter.formatDate(buckets.to())),
        Sql.raw(interval.toClickHouse()));

    log.debug("usage series granularity={} interval={} points={}", granularity.suffix(), interval,
        buckets.expectedPoints());
    return client.query(QueryRequest.of(query, "duration_and_count_over_time_" + granularity.suffix(), SERIES_TIMEOUT),
            SeriesRow.class)
        .thenApply(QueryResult::data);
  }

  private CompletableFuture<List<List<CoordinateCount>>> loadCoordinatesOfTypes(List<TypeLookup> lookups) {
    TypeLookup first = lookups.get(0);
    Set<String> typeNames = typeNames(lookups);
    SqlStatement query = Sql.sql("SELECT coordinate, sum(total) AS total FROM coordinates_daily{} GROUP BY coordinate",
        UsageFilter.builder()
            .target(first.targetId())
            .period(first.period())
            .extra(Sql.sql("({})", typeConditions(typeNames, "")))
            .build());
    return client.query(QueryRequest.of(query, "coordinates_per_types", COORDINATE_TIMEOUT), CoordinateTotalRow.class)
        .thenApply(result -> lookups.stream()
            .map(lookup -> result.data().stream()
                .filter(row -> belongsTo(row.coordinate(), lookup.typeName()))
                .map(row -> new CoordinateCount(row.coordinate(), row.total()))
                .toList())
            .toList());
  }

  private CompletableFuture<List<Map<String, List<TopOperation>>>> loadTopOperations(List<TypeLookup> lookups) {
    TypeLookup first = lookups.get(0);
    SqlStatement query = Sql.sql(
        "WITH coordinates AS ("
            + " SELECT cd.total, cd.hash, cd.coordinate FROM ("
            + " SELECT sum(cdi.total) AS total, cdi.hash AS hash, cdi.coordinate AS coordinate"
            + " FROM coordinates_daily AS cdi{}"
            + " GROUP BY cdi.hash, cdi.coordinate ORDER BY total DESC, cdi.hash ASC LIMIT {} BY cdi.coordinate"
            + " ) AS cd WHERE {}"
            + ")"
            + " SELECT c.coordinate AS coordinate, c.hash AS hash, ocd.name AS name, c.total AS total"
            + " FROM coordinates AS c LEFT JOIN ("
            + " SELECT ocd.name, ocd.hash FROM operation_collection_details AS ocd"
            + " WHERE ocd.target = {} AND hash IN (SELECT hash FROM coordinates)"
            + " LIMIT 1 BY ocd.hash"
            + " ) AS ocd ON ocd.hash = c.hash",
        UsageFilter.builder()
            .target(first.targetId())
            .period(first.period())
            .namespace("cdi")
            .extra(Sql.sql("cdi.coordinate NOT LIKE '%.%.%'"))
            .build(),
        Sql.raw(Integer.toString(first.limit())),
        typeConditions(typeNames(lookups), "cd."),
        Sql.value(first.targetId()));
    return client.query(QueryRequest.of(query, "get_top_operations_for_types", COORDINATE_TIMEOUT),
            TopOperationRow.class)
        .thenApply(result -> lookups.stream()
            .map(lookup -> {
              Map<String, List<TopOperation>> byCoordinate = new LinkedHashMap<>();
              result.data().stream()
                  .filter(row -> belongsTo(row.coordinate(), lookup.typeName()))
                  .sorted(Comparator.comparingLong(TopOperationRow::total).reversed()
                      .thenComparing(TopOperationRow::hash))
                  .forEach(row -> byCoordinate.computeIfAbsent(row.coordinate(), k -> new ArrayList<>())
                      .add(new TopOperation(row.name(), row.hash(), row.total())));
              return byCoordinate;
            })
            .toList());
  }

  private CompletableFuture<List<Map<String, Set<String>>>> loadTopClients(List<TypeLookup> lookups) {
    TypeLookup first = lookups.get(0);
    SqlStatement query = Sql.sql(
        "SELECT co.coordinate AS coordinate, groupUniqArrayArray(cl.client_names) AS client_names FROM ("
            + " SELECT co.coordinate, co.hash FROM coordinates_daily AS co{}"
            + " GROUP BY co.coordinate, co.hash"
            + " ) AS co LEFT JOIN ("
            + " SELECT arrayDistinct(groupArray(client_name)) AS client_names, cl.hash AS hash"
            + " FROM clients_daily AS cl{}"
            + " GROUP BY cl.hash"
            + " ) AS cl ON co.hash = cl.hash"
            + " GROUP BY co.coordinate"
            + " SETTINGS join_algorithm = 'parallel_hash'",
        UsageFilter.builder()
            .target(first.targetId())
            .period(first.period())
            .namespace("co")
            .extra(Sql.sql("({})", typeConditions(typeNames(lookups), "co.")))
            .build(),
        UsageFilter.builder()
            .target(first.targetId())
            .period(first.period())
            .namespace("cl")
            .build());
    return client.query(QueryRequest.of(query, "get_hashes_for_schema_coordinates", COORDINATE_TIMEOUT),
            CoordinateClientsRow.class)
        .thenApply(result -> lookups.stream()
            .map(lookup -> {
              Map<String, Set<String>> byCoordinate = new LinkedHashMap<>();
              result.data().stream()
                  .filter(row -> belongsTo(row.coordinate(), lookup.typeName()))
                  .forEach(row -> byCoordinate.put(row.coordinate(), row.clientNames() == null
                      ? Set.of() : new LinkedHashSet<>(row.clientNames())));
              return byCoordinate;
            })
            .toList());
  }

  private Granularity granularity(DateRange period) {
    return TimeWindowResolver.pickGranularity(clock.instant(), period);
  }

  private Granularity granularity(DateRange period, ParsedInterval interval) {
    return TimeWindowResolver.pickGranularity(clock.instant(), period, interval, null);
  }

  private static Percentiles orZero(Percentiles percentiles) {
    return percentiles == null ? Percentiles.ZERO : percentiles;
  }

  private UsageFilter filter(TargetSelector selector) {
    return UsageFilter.builder()
        .targets(selector.targetIds())
        .longArrayCharLimit(longArrayCharLimit);
  }

  private UsageFilter filtered(TargetSelector selector, DateRange period, UsageFilters filters) {
    UsageFilters narrowing = UsageFilters.orNone(filters);
    return filter(selector)
        .period(period)
        .operations(narrowing.operations())
        .clients(narrowing.clients())
        .extra(coordinateCondition(selector, period, narrowing.schemaCoordinate()));
  }

  private SqlStatement coordinateCondition(TargetSelector selector, DateRange period, String coordinate) {
    if (coordinate == null || coordinate.isBlank()) {
      return null;
    }
    return Sql.sql("hash IN (SELECT hash FROM coordinates_daily{})",
        filter(selector)
            .period(period)
            .extra(Sql.sql("coordinate = {}", Sql.value(coordinate)))
            .build());
  }

  private static QueryRequest request(SqlStatement query, String name, Granularity granularity) {
    return QueryRequest.of(query, name + "_" + granularity.suffix(), timeoutFor(granularity));
  }

  static Duration timeoutFor(Granularity granularity) {
    return switch (granularity) {
      case DAILY -> Duration.ofSeconds(10);
      case HOURLY -> Duration.ofSeconds(15);
      case MINUTELY -> Duration.ofSeconds(30);
    };
  }

  private static String clientsTable(Granularity granularity) {
    return granularity == Granularity.DAILY ? "clients_daily" : granularity.table("operations");
  }

  private static List<String> clientNameVariants(String clientName) {
    return UNKNOWN_CLIENT.equals(clientName) ? List.of(UNKNOWN_CLIENT, "") : List.of(clientName);
  }

  private static String orUnknown(String value) {
    return value == null || value.isEmpty() ? UNKNOWN_CLIENT : value;
  }

  private static String operationName(String hash, String name) {
    String prefix = hash.length() > 4 ? hash.substring(0, 4) : hash;
    return prefix + "_" + (name == null || name.isEmpty() ? "anonymous" : name);
  }

  private static double percentage(long part, long whole) {
    return whole == 0 ? 0.0 : part * 100.0 / whole;
  }

  private static long firstTotal(QueryResult<TotalRow> result) {
    return result.first().map(TotalRow::total).orElse(0L);
  }

  private static Set<String> typeNames(List<TypeLookup> lookups) {
    Set<String> names = new LinkedHashSet<>();
    lookups.forEach(lookup -> names.add(lookup.typeName()));
    return names;
  }

  private static SqlStatement typeConditions(Set<String> typeNames, String prefix) {
    List<SqlStatement> conditions = typeNames.stream()
        .map(typeName -> Sql.sql("(" + prefix + "coordinate = {} OR " + prefix + "coordinate LIKE {})",
            Sql.value(typeName), Sql.value(typeName + ".%")))
        .toList();
    return Sql.sql("{}", Sql.join(conditions, " OR "));
  }

  static boolean belongsTo(String coordinate, String typeName) {
    return coordinate.equals(typeName) || coordinate.startsWith(typeName + ".");
  }

  /** Epoch-aligned bucket start, matching {@link TimeWindowResolver#bucketize}. */
  private static SqlStatement bucketExpression(ParsedInterval interval) {
    String seconds = Long.toString(interval.toSeconds());
    return Sql.sql("toDateTime(intDiv(toUInt32(timestamp), {}) * {}, 'UTC')", Sql.raw(seconds), Sql.raw(seconds));
  }

  record TypeLookup(String targetId, DateRange period, String typeName, int limit) {

    static TypeLookup of(String targetId, DateRange period, String typeName, int limit) {
      if (targetId == null || targetId.isBlank()) {
        throw new QueryBuildException("targetId is required");
      }
      if (typeName == null || typeName.isBlank()) {
        throw new QueryBuildException("typeName is required");
      }
      return new TypeLookup(targetId, Objects.requireNonNull(period, "period"), typeName, limit);
    }

    String targetAndPeriod() {
      return targetId + ";" + period.key();
    }

    String targetPeriodAndLimit() {
      return targetAndPeriod() + ";" + limit;
    }
  }
}
