package com.usagelens.engine.reader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.usagelens.engine.clickhouse.ClickHouseClient;
import com.usagelens.engine.clickhouse.ClickHouseException;
import com.usagelens.engine.clickhouse.QueryRequest;
import com.usagelens.engine.clickhouse.QueryResult;
import com.usagelens.engine.reader.UsageAnalyticsReader.ClientStats;
import com.usagelens.engine.reader.UsageAnalyticsReader.CoordinateCount;
import com.usagelens.engine.reader.UsageAnalyticsReader.DurationPoint;
import com.usagelens.engine.reader.UsageAnalyticsReader.FieldSelector;
import com.usagelens.engine.reader.UsageAnalyticsReader.OperationStats;
import com.usagelens.engine.reader.UsageAnalyticsReader.Percentiles;
import com.usagelens.engine.reader.UsageAnalyticsReader.RequestCounts;
import com.usagelens.engine.reader.UsageAnalyticsReader.TargetsSeriesSelector;
import com.usagelens.engine.reader.UsageAnalyticsReader.TimeSeriesPoint;
import com.usagelens.engine.reader.UsageAnalyticsReader.TopOperation;
import com.usagelens.engine.reader.UsageAnalyticsReader.VersionStats;
import com.usagelens.engine.reader.UsageRows.ClientVersionRow;
import com.usagelens.engine.reader.UsageRows.CoordinateClientsRow;
import com.usagelens.engine.reader.UsageRows.CoordinateTotalRow;
import com.usagelens.engine.reader.UsageRows.DateTotalRow;
import com.usagelens.engine.reader.UsageRows.ExistsRow;
import com.usagelens.engine.reader.UsageRows.HashPercentilesRow;
import com.usagelens.engine.reader.UsageRows.HashTotalsRow;
import com.usagelens.engine.reader.UsageRows.PercentilesRow;
import com.usagelens.engine.reader.UsageRows.RegistryRow;
import com.usagelens.engine.reader.UsageRows.SeriesRow;
import com.usagelens.engine.reader.UsageRows.TargetSeriesRow;
import com.usagelens.engine.reader.UsageRows.TopOperationRow;
import com.usagelens.engine.reader.UsageRows.TotalOkRow;
import com.usagelens.engine.reader.UsageRows.TotalRow;
import com.usagelens.engine.sql.QueryBuildException;
import com.usagelens.engine.window.DateRange;
import com.usagelens.engine.window.Granularity;
import com.usagelens.engine.window.UnresolvableRangeException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ClickHouseUsageAnalyticsReaderTest {

  private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");
  private static final DateRange LAST_DAY = DateRange.lastHours(NOW, 24);
  private static final DateRange LAST_60_DAYS = DateRange.lastHours(NOW, 24 * 60);
  private static final TargetSelector TARGET = TargetSelector.of("org", "project", "target-1");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ClickHouseClient client = mock(ClickHouseClient.class);
  private final List<Runnable> flushes = new ArrayList<>();
  private final ClickHouseUsageAnalyticsReader reader = new ClickHouseUsageAnalyticsReader(
      client,
      Clock.fixed(NOW, ZoneOffset.UTC),
      new CollectedOperationsCache(100, Duration.ofMinutes(5)),
      10_000,
      200,
      flushes::add
  );

  @Test
  void countRequestsUsesHourlyTableForLastDay() {
    givenRows(TotalOkRow.class, "[{\"total\":\"10\",\"totalOk\":\"7\"}]");

    RequestCounts counts = reader.countRequests(TARGET, LAST_DAY, UsageFilters.none()).join();

    assertThat(counts).isEqualTo(new RequestCounts(10, 7, 3));
    QueryRequest request = captured(TotalOkRow.class);
    assertThat(request.queryId()).isEqualTo("count_operations_hourly");
    assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(15));
    assertThat(request.statement().text()).isEqualTo(
        "SELECT sum(total) AS total, sum(total_ok) AS totalOk FROM operations_hourly"
            + " PREWHERE target = {p1: String}"
            + " AND timestamp >= toDateTime({p2: String}, 'UTC')"
            + " AND timestamp <= toDateTime({p3: String}, 'UTC') ");
    assertThat(request.statement().toQueryParams().values())
        .containsExactly("target-1", "2024-06-14 12:00:00", "2024-06-15 12:00:00");
  }

  @Test
  void countRequestsWithoutRowsIsZero() {
    givenRows(TotalOkRow.class, "[]");

    assertThat(reader.countRequests(TARGET, LAST_DAY, UsageFilters.none()).join())
        .isEqualTo(new RequestCounts(0, 0, 0));
    assertThat(reader.countFailures(TARGET, LAST_DAY, UsageFilters.none()).join()).isZero();
  }

  @Test
  void multipleTargetsAndFiltersNarrowTheQuery() {
    givenRows(TotalOkRow.class, "[{\"total\":1,\"totalOk\":1}]");
    TargetSelector targets = TargetSelector.ofTargets(List.of("a", "b"));

    reader.countRequests(targets, LAST_60_DAYS,
        new UsageFilters(List.of("h1", "h2"), List.of("web"), "Query.user")).join();

    QueryRequest request = captured(TotalOkRow.class);
    assertThat(request.queryId()).isEqualTo("count_operations_daily");
    assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(10));
    assertThat(request.statement().text())
        .contains("FROM operations_daily PREWHERE target IN ({p1: Array(String)})")
        .contains("(hash) IN ({p4: Array(String)})")
        .contains("client_name IN ({p5: Array(String)})")
        .contains("hash IN (SELECT hash FROM coordinates_daily PREWHERE target IN ({p6: Array(String)})")
        .contains("coordinate = {p9: String}");
    assertThat(request.statement().toQueryParams())
        .containsEntry("p1", "['a', 'b']")
        .containsEntry("p4", "['h1', 'h2']")
        .containsEntry("p5", "['web']")
        .containsEntry("p9", "Query.user");
  }

  @Test
  void largeCountsKeepEveryDigit() {
    givenRows(TotalRow.class, "[{\"total\":\"9007199254740993\"}]");
    givenRows(TotalOkRow.class, "[{\"total\":\"9007199254740993\",\"totalOk\":\"9007199254740992\"}]");

    assertThat(reader.countOperations(TARGET, LAST_DAY).join()).isEqualTo(9_007_199_254_740_993L);
    assertThat(reader.countFailures(TARGET, LAST_DAY, UsageFilters.none()).join()).isEqualTo(1L);
  }

  @Test
  void missingFiltersReadEverything() {
    givenRows(TotalOkRow.class, "[{\"total\":3,\"totalOk\":3}]");
    givenRows(PercentilesRow.class, "[{\"percentiles\":[1,2,3,4]}]");

    assertThat(reader.countRequests(TARGET, LAST_DAY, null).join()).isEqualTo(new RequestCounts(3, 3, 0));
    assertThat(reader.generalDurationPercentiles(TARGET, LAST_DAY, null).join())
        .isEqualTo(new Percentiles(1, 2, 3, 4));

    assertThat(captured(TotalOkRow.class).statement().text()).doesNotContain("hash IN", "client_name");
    assertThat(captured(PercentilesRow.class).statement().text()).doesNotContain("hash IN", "client_name");
  }

  @Test
  void storeFailureCompletesTheFutureExceptionally() {
    when(client.query(any(QueryRequest.class), eq(TotalOkRow.class)))
        .thenReturn(CompletableFuture.failedFuture(new ClickHouseException("q", "q-1", 500, "Code: 159. timeout")));

    assertThatThrownBy(() -> reader.countRequests(TARGET, LAST_DAY, UsageFilters.none()).join())
        .hasCauseInstanceOf(ClickHouseException.class);
  }

  @Test
  void tooOldPeriodIsRejectedBeforeQuerying() {
    DateRange ancient = DateRange.lastHours(NOW, 24 * 400);

    assertThatThrownBy(() -> reader.countRequests(TARGET, ancient, UsageFilters.none()))
        .isInstanceOf(UnresolvableRangeException.class);
    verifyNoInteractions(client);
  }

  @Test
  void operationStatsJoinRegistryNames() {
    givenRows(HashTotalsRow.class, """
        [{"hash":"abcdef","total":"75","totalOk":"70"},
         {"hash":"123456","total":"20","totalOk":"20"},
         {"hash":"ffff00","total":"5","totalOk":"0"}]
        """);
    givenRows(RegistryRow.class, """
        [{"name":"GetUser","hash":"abcdef","operation_kind":"query"},
         {"name":"","hash":"123456","operation_kind":"mutation"}]
        """);

    List<OperationStats> stats = reader.readOperationStats(TARGET, LAST_DAY, UsageFilters.none()).join();

    assertThat(stats).hasSize(3);
    assertThat(stats.get(0)).isEqualTo(new OperationStats("abcdef", "abcd_GetUser", "query", 75, 70, 75.0));
    assertThat(stats.get(1).operationName()).isEqualTo("1234_anonymous");
    assertThat(stats.get(1).kind()).isEqualTo("mutation");
    assertThat(stats.get(2).operationName()).isEqualTo("ffff_missing");
    assertThat(stats.get(2).kind()).isEqualTo("missing");
    assertThat(stats.get(2).percentage()).isCloseTo(5.0, within(1e-9));
    assertThat(captured(HashTotalsRow.class).queryId()).isEqualTo("read_unique_documents_hourly");
    assertThat(captured(RegistryRow.class).statement().text())
        .startsWith("SELECT name, hash, operation_kind FROM operation_collection_details PREWHERE target = {p1: String}")
        .contains("hash IN (SELECT hash FROM operations_hourly PREWHERE target = {p2: String}");
  }

  @Test
  void countFieldsReportsZeroForFieldsWithoutRows() {
    givenRows(CoordinateTotalRow.class, "[{\"coordinate\":\"Query.user\",\"total\":\"9\"}]");

    Map<String, Long> counts = reader.countFields(TARGET, LAST_DAY,
        List.of(FieldSelector.of("Query", "user"), new FieldSelector("Query", "user", "id")),
        List.of(), List.of("internal-tool")).join();

    assertThat(counts).containsExactly(Map.entry("Query.user", 9L), Map.entry("Query.user.id", 0L));
    QueryRequest request = captured(CoordinateTotalRow.class);
    assertThat(request.queryId()).isEqualTo("count_fields_v2");
    assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(request.statement().text())
        .contains("(coordinate IN ({p4: Array(String)}))")
        .contains("GROUP BY hash HAVING countIf(client_name NOT IN ({p8: Array(String)})) > 0)");
    assertThat(request.statement().toQueryParams())
        .containsEntry("p4", "['Query.user', 'Query.user.id']")
        .containsEntry("p8", "['internal-tool']");
  }

  @Test
  void coordinateLookupsInOneWindowShareOneQuery() {
    givenRows(CoordinateTotalRow.class, """
        [{"coordinate":"User","total":"5"},
         {"coordinate":"User.id","total":"3"},
         {"coordinate":"UserProfile.name","total":"1"},
         {"coordinate":"Post.title","total":"2"}]
        """);

    CompletableFuture<List<CoordinateCount>> users = reader.countCoordinatesOfType("target-1", LAST_DAY, "User");
    CompletableFuture<List<CoordinateCount>> posts = reader.countCoordinatesOfType("target-1", LAST_DAY, "Post");
    verifyNoInteractions(client);

    runFlushes();

    assertThat(users.join()).containsExactly(new CoordinateCount("User", 5), new CoordinateCount("User.id", 3));
    assertThat(posts.join()).containsExactly(new CoordinateCount("Post.title", 2));
    QueryRequest request = captured(CoordinateTotalRow.class);
    assertThat(request.queryId()).isEqualTo("coordinates_per_types");
    assertThat(request.statement().text())
        .contains("((coordinate = {p4: String} OR coordinate LIKE {p5: String})"
            + " OR (coordinate = {p6: String} OR coordinate LIKE {p7: String}))");
    assertThat(request.statement().toQueryParams().values()).contains("User", "User.%", "Post", "Post.%");
  }

  @Test
  void topOperationsAreGroupedPerCoordinateAndOrdered() {
    givenRows(TopOperationRow.class, """
        [{"coordinate":"Query.user","hash":"b","name":"B","total":"10"},
         {"coordinate":"Query.user","hash":"a","name":"A","total":"30"},
         {"coordinate":"Query.posts","hash":"c","name":"C","total":"7"},
         {"coordinate":"Mutation.addPost","hash":"d","name":"D","total":"4"}]
        """);

    CompletableFuture<Map<String, List<TopOperation>>> query =
        reader.topOperationsForCoordinate("target-1", LAST_DAY, 5, "Query");
    CompletableFuture<Map<String, List<TopOperation>>> mutation =
        reader.topOperationsForCoordinate("target-1", LAST_DAY, 5, "Mutation");
    runFlushes();

    assertThat(query.join()).containsOnlyKeys("Query.user", "Query.posts");
    assertThat(query.join().get("Query.user"))
        .containsExactly(new TopOperation("A", "a", 30), new TopOperation("B", "b", 10));
    assertThat(mutation.join()).containsOnlyKeys("Mutation.addPost");
    QueryRequest request = captured(TopOperationRow.class);
    assertThat(request.queryId()).isEqualTo("get_top_operations_for_types");
    assertThat(request.statement().text()).contains("LIMIT 5 BY cdi.coordinate");
  }

  @Test
  void differentLimitsAreSeparateBatches() {
    givenRows(TopOperationRow.class, "[]");

    reader.topOperationsForCoordinate("target-1", LAST_DAY, 5, "Query");
    reader.topOperationsForCoordinate("target-1", LAST_DAY, 10, "Query");
    runFlushes();

    verify(client, times(2)).query(any(QueryRequest.class), eq(TopOperationRow.class));
  }

  @Test
  void nonPositiveLimitIsRejected() {
    assertThatThrownBy(() -> reader.topOperationsForCoordinate("target-1", LAST_DAY, 0, "Query"))
        .isInstanceOf(QueryBuildException.class);
    assertThatThrownBy(() -> reader.readClientVersions(TARGET, LAST_DAY, "web", 0))
        .isInstanceOf(QueryBuildException.class);
    assertThat(flushes).isEmpty();
  }

  @Test
  void clientsPerCoordinateAreDemultiplexedByType() {
    givenRows(CoordinateClientsRow.class, """
        [{"coordinate":"Query.user","client_names":["web","ios"]},
         {"coordinate":"User.id","client_names":["web"]}]
        """);

    CompletableFuture<Map<String, Set<String>>> query = reader.topClientsForCoordinate("target-1", LAST_DAY, "Query");
    CompletableFuture<Map<String, Set<String>>> user = reader.topClientsForCoordinate("target-1", LAST_DAY, "User");
    runFlushes();

    assertThat(query.join()).containsExactly(Map.entry("Query.user", Set.of("web", "ios")));
    assertThat(user.join()).containsExactly(Map.entry("User.id", Set.of("web")));
    verify(client, times(1)).query(any(QueryRequest.class), eq(CoordinateClientsRow.class));
  }

  @Test
  void clientBreakdownGroupsVersionsUnderClientNames() {
    givenRows(ClientVersionRow.class, """
        [{"total":"60","client_name":"web","client_version":"1.0"},
         {"total":"20","client_name":"web","client_version":"2.0"},
         {"total":"20","client_name":"","client_version":""}]
        """);

    List<ClientStats> clients = reader.clientBreakdown(TARGET, LAST_60_DAYS, UsageFilters.none()).join();

    assertThat(clients).containsExactly(
        new ClientStats("web", 80, 80.0, List.of(new VersionStats("1.0", 60, 75.0), new VersionStats("2.0", 20, 25.0))),
        new ClientStats("unknown", 20, 20.0, List.of(new VersionStats("unknown", 20, 100.0))));
    QueryRequest request = captured(ClientVersionRow.class);
    assertThat(request.queryId()).isEqualTo("count_clients_daily");
    assertThat(request.statement().text()).contains("FROM clients_daily PREWHERE");
  }

  @Test
  void finerClientReadsUseOperationsTables() {
    givenRows(ClientVersionRow.class, "[]");

    reader.readClientVersions(TARGET, LAST_DAY, "unknown", 10).join();

    QueryRequest request = captured(ClientVersionRow.class);
    assertThat(request.queryId()).isEqualTo("read_client_versions_hourly");
    assertThat(request.statement().text())
        .contains("FROM operations_hourly PREWHERE")
        .endsWith("GROUP BY client_version ORDER BY total DESC LIMIT 10");
    assertThat(request.statement().toQueryParams().values()).contains("['unknown', '']");
  }

  @Test
  void seriesAreBucketedAndZeroFilled() {
    givenRows(SeriesRow.class, """
        [{"date":1718366400000,"total":"5","totalOk":"4","percentiles":[10.5,20,30,40]},
         {"date":1718367840000,"total":"0","totalOk":"0","percentiles":[0,0,0,0]}]
        """);

    List<TimeSeriesPoint> requests = reader.requestsOverTime(TARGET, LAST_DAY, 60, UsageFilters.none()).join();
    List<TimeSeriesPoint> failures = reader.failuresOverTime(TARGET, LAST_DAY, 60, UsageFilters.none()).join();
    List<DurationPoint> durations = reader.durationOverTime(TARGET, LAST_DAY, 60, UsageFilters.none()).join();

    assertThat(requests).containsExactly(new TimeSeriesPoint(1718366400000L, 5), new TimeSeriesPoint(1718367840000L, 0));
    assertThat(failures).extracting(TimeSeriesPoint::value).containsExactly(1L, 0L);
    assertThat(durations.get(0).duration()).isEqualTo(new Percentiles(10.5, 20, 30, 40));

    QueryRequest request = captured(SeriesRow.class);
    assertThat(request.queryId()).isEqualTo("duration_and_count_over_time_minutely");
    assertThat(request.timeout()).isEqualTo(Duration.ofSeconds(15));
    assertThat(request.statement().text())
        .contains("toDateTime(intDiv(toUInt32(timestamp), 1440) * 1440, 'UTC') AS bucket")
        .contains("FROM operations_minutely PREWHERE")
        .contains("timestamp < toDateTime(")
        .contains("STEP INTERVAL 24 MINUTE");
    assertThat(request.statement().toQueryParams().values())
        .contains("2024-06-14 12:00:00", "2024-06-15 12:24:00");
  }

  @Test
  void namedPercentileFieldsAreDecoded() {
    givenRows(PercentilesRow.class, "[{\"percentiles\":{\"p75\":1.5,\"p90\":2,\"p95\":3,\"p99\":4}}]");
    givenRows(HashPercentilesRow.class, """
        [{"hash":"h1","percentiles":{"p75":5,"p90":6.5,"p95":7,"p99":8}},
         {"hash":"h2","percentiles":[1,2,3,4]}]
        """);

    assertThat(reader.generalDurationPercentiles(TARGET, LAST_DAY, UsageFilters.none()).join())
        .isEqualTo(new Percentiles(1.5, 2, 3, 4));
    assertThat(reader.durationPercentiles(TARGET, LAST_DAY, UsageFilters.none()).join())
        .containsExactly(
            Map.entry("h1", new Percentiles(5, 6.5, 7, 8)),
            Map.entry("h2", new Percentiles(1, 2, 3, 4)));
  }

  @Test
  void nullPercentilesReadAsZero() {
    givenRows(PercentilesRow.class, "[{\"percentiles\":null}]");
    givenRows(HashPercentilesRow.class, "[{\"hash\":\"h1\",\"percentiles\":null}]");
    givenRows(SeriesRow.class, "[{\"date\":1718366400000,\"total\":0,\"totalOk\":0,\"percentiles\":null}]");

    assertThat(reader.generalDurationPercentiles(TARGET, LAST_DAY, UsageFilters.none()).join())
        .isEqualTo(Percentiles.ZERO);
    assertThat(reader.durationPercentiles(TARGET, LAST_DAY, UsageFilters.none()).join())
        .containsExactly(Map.entry("h1", Percentiles.ZERO));
    assertThat(reader.durationOverTime(TARGET, LAST_DAY, 60, UsageFilters.none()).join())
        .extracting(DurationPoint::duration)
        .containsExactly(Percentiles.ZERO);
  }

  @Test
  void invalidResolutionIsRejectedBeforeQuerying() {
    assertThatThrownBy(() -> reader.requestsOverTime(TARGET, LAST_DAY, 5, UsageFilters.none()))
        .isInstanceOf(QueryBuildException.class);
    assertThatThrownBy(() -> reader.durationOverTime(TARGET, LAST_DAY, 91, UsageFilters.none()))
        .isInstanceOf(QueryBuildException.class);
    verifyNoInteractions(client);
  }

  @Test
  void targetSeriesShareQueriesPerPeriodAndResolution() {
    givenRows(TargetSeriesRow.class, """
        [{"date":1,"total":"3","target":"a"},
         {"date":1,"total":"4","target":"b"},
         {"date":2,"total":"5","target":"c"}]
        """);

    List<Map<String, List<TimeSeriesPoint>>> series = reader.requestsOverTimeOfTargets(List.of(
        new TargetsSeriesSelector(List.of("a"), LAST_DAY, 60),
        new TargetsSeriesSelector(List.of("b", "c"), LAST_DAY, 60),
        new TargetsSeriesSelector(List.of("a"), LAST_DAY, 30)
    )).join();

    assertThat(series).hasSize(3);
    assertThat(series.get(0)).containsOnlyKeys("a");
    assertThat(series.get(1)).containsOnlyKeys("b", "c");
    assertThat(series.get(1).get("c")).containsExactly(new TimeSeriesPoint(2, 5));
    verify(client, times(2)).query(any(QueryRequest.class), eq(TargetSeriesRow.class));
  }

  @Test
  void collectedOperationsArePositivelyCached() {
    when(client.query(any(QueryRequest.class), eq(ExistsRow.class)))
        .thenReturn(CompletableFuture.completedFuture(new QueryResult<>(List.of(new ExistsRow(1)), 1, 0.0)));

    assertThat(reader.hasCollectedOperations(TARGET).join()).isTrue();
    assertThat(reader.hasCollectedOperations(TARGET).join()).isTrue();

    verify(client, times(1)).query(any(QueryRequest.class), eq(ExistsRow.class));
  }

  @Test
  void targetsWithoutOperationsAreCheckedAgain() {
    when(client.query(any(QueryRequest.class), eq(ExistsRow.class)))
        .thenReturn(CompletableFuture.completedFuture(new QueryResult<>(List.of(), 0, 0.0)));

    assertThat(reader.hasCollectedOperations(TARGET).join()).isFalse();
    assertThat(reader.hasCollectedOperations(TARGET).join()).isFalse();

    verify(client, times(2)).query(any(QueryRequest.class), eq(ExistsRow.class));
  }

  @Test
  void adminSeriesResolutionFollowsPeriodLength() {
    givenRows(DateTotalRow.class, "[{\"date\":1718366400000,\"total\":\"12\"}]");

    List<TimeSeriesPoint> points = reader.adminOperationsOverTime(DateRange.lastHours(NOW, 24 * 7)).join();

    assertThat(points).containsExactly(new TimeSeriesPoint(1718366400000L, 12));
    QueryRequest request = captured(DateTotalRow.class);
    assertThat(request.queryId()).isEqualTo("admin_operations_over_time_hourly");
    assertThat(request.statement().text()).contains("intDiv(toUInt32(timestamp), 61200) * 61200");
  }

  @Test
  void timeoutsFollowGranularity() {
    assertThat(ClickHouseUsageAnalyticsReader.timeoutFor(Granularity.DAILY)).isEqualTo(Duration.ofSeconds(10));
    assertThat(ClickHouseUsageAnalyticsReader.timeoutFor(Granularity.HOURLY)).isEqualTo(Duration.ofSeconds(15));
    assertThat(ClickHouseUsageAnalyticsReader.timeoutFor(Granularity.MINUTELY)).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void coordinateBelongsToTypeOnlyOnExactPrefix() {
    assertThat(ClickHouseUsageAnalyticsReader.belongsTo("User", "User")).isTrue();
    assertThat(ClickHouseUsageAnalyticsReader.belongsTo("User.id", "User")).isTrue();
    assertThat(ClickHouseUsageAnalyticsReader.belongsTo("UserProfile.id", "User")).isFalse();
  }

  private <T> void givenRows(Class<T> rowType, String json) {
    when(client.query(any(QueryRequest.class), eq(rowType)))
        .thenAnswer(invocation -> CompletableFuture.completedFuture(rows(rowType, json)));
  }

  private <T> QueryResult<T> rows(Class<T> rowType, String json) {
    try {
      List<T> data = objectMapper.readerForListOf(rowType).readValue(json);
      return new QueryResult<>(data, data.size(), 0.001);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private QueryRequest captured(Class<?> rowType) {
    ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(client, atLeastOnce()).query(captor.capture(), eq(rowType));
    return captor.getValue();
  }

  private void runFlushes() {
    List<Runnable> pending = new ArrayList<>(flushes);
    flushes.clear();
    pending.forEach(Runnable::run);
  }
}
