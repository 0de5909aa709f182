package com.usagelens.analytics.web;

import com.usagelens.engine.clickhouse.ClickHouseException;
import com.usagelens.engine.clickhouse.ClickHouseTimeoutException;
import com.usagelens.engine.reader.TargetSelector;
import com.usagelens.engine.reader.UsageAnalyticsReader;
import com.usagelens.engine.reader.UsageAnalyticsReader.RequestCounts;
import com.usagelens.engine.reader.UsageAnalyticsReader.TimeSeriesPoint;
import com.usagelens.engine.reader.UsageFilters;
import com.usagelens.engine.window.DateRange;
import com.usagelens.engine.window.UnresolvableRangeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class UsageAnalyticsControllerTest {

  private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");
  private static final String BASE = "/api/usage/org-1/project-1/target-1";

  private final UsageAnalyticsReader reader = mock(UsageAnalyticsReader.class);
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    UsageAnalyticsController controller = new UsageAnalyticsController(reader, Clock.fixed(NOW, ZoneOffset.UTC));
    mockMvc = MockMvcBuilders.standaloneSetup(controller)
        .setControllerAdvice(new UsageExceptionHandler())
        .build();
  }

  @Test
  void requestsUseTrailingRangeByDefault() throws Exception {
    when(reader.countRequests(any(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(RequestCounts.of(10, 7)));

    MvcResult started = mockMvc.perform(get(BASE + "/requests").param("operations", "h1", "h2"))
        .andExpect(request().asyncStarted())
        .andReturn();
    mockMvc.perform(asyncDispatch(started))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(10))
        .andExpect(jsonPath("$.ok").value(7))
        .andExpect(jsonPath("$.notOk").value(3));

    ArgumentCaptor<TargetSelector> selector = ArgumentCaptor.forClass(TargetSelector.class);
    ArgumentCaptor<DateRange> period = ArgumentCaptor.forClass(DateRange.class);
    ArgumentCaptor<UsageFilters> filters = ArgumentCaptor.forClass(UsageFilters.class);
    verify(reader).countRequests(selector.capture(), period.capture(), filters.capture());
    assertThat(selector.getValue()).isEqualTo(TargetSelector.of("org-1", "project-1", "target-1"));
    assertThat(period.getValue()).isEqualTo(new DateRange(NOW.minus(Duration.ofHours(24)), NOW));
    assertThat(filters.getValue().operations()).containsExactly("h1", "h2");
  }

  @Test
  void explicitPeriodIsPassedThrough() throws Exception {
    when(reader.requestsOverTime(any(), any(), anyInt(), any()))
        .thenReturn(CompletableFuture.completedFuture(List.of(new TimeSeriesPoint(1000, 4))));

    MvcResult started = mockMvc.perform(get(BASE + "/requests/series")
            .param("from", "2024-06-01T00:00:00Z")
            .param("to", "2024-06-08T00:00:00Z")
            .param("resolution", "30"))
        .andExpect(request().asyncStarted())
        .andReturn();
    mockMvc.perform(asyncDispatch(started))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].date").value(1000))
        .andExpect(jsonPath("$[0].value").value(4));

    verify(reader).requestsOverTime(any(), eq(new DateRange(Instant.parse("2024-06-01T00:00:00Z"),
        Instant.parse("2024-06-08T00:00:00Z"))), eq(30), any());
  }

  @Test
  void halfOpenPeriodIsABadRequest() throws Exception {
    mockMvc.perform(get(BASE + "/requests").param("from", "2024-06-01T00:00:00Z"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));

    verifyNoInteractions(reader);
  }

  @Test
  void malformedRangeIsABadRequest() throws Exception {
    mockMvc.perform(get(BASE + "/durations").param("range", "forever"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));
  }

  @Test
  void oversizedRangeIsABadRequest() throws Exception {
    mockMvc.perform(get(BASE + "/durations").param("range", "999999999999999999d"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));
    mockMvc.perform(get(BASE + "/durations").param("range", "99999999999999d"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));

    verifyNoInteractions(reader);
  }

  @Test
  void unresolvablePeriodReportsTheReason() throws Exception {
    when(reader.countUniqueOperations(any(), any(), any()))
        .thenThrow(new UnresolvableRangeException(UnresolvableRangeException.Reason.TOO_OLD, "too old"));

    mockMvc.perform(get(BASE + "/operations/unique").param("range", "500d"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("too_old"))
        .andExpect(jsonPath("$.message").value("too old"));
  }

  @Test
  void storeFailureIsABadGateway() throws Exception {
    when(reader.clientBreakdown(any(), any(), any())).thenReturn(CompletableFuture.failedFuture(
        new ClickHouseException("count_clients_hourly", "count_clients_hourly-abc", 500,
            "Code: 241. DB::Exception: Memory limit exceeded. (MEMORY_LIMIT_EXCEEDED)")));

    MvcResult started = mockMvc.perform(get(BASE + "/clients"))
        .andExpect(request().asyncStarted())
        .andReturn();
    mockMvc.perform(asyncDispatch(started))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.error").value("store_error"))
        .andExpect(jsonPath("$.queryId").value("count_clients_hourly"))
        .andExpect(jsonPath("$.message").value("Code: 241. DB::Exception: Memory limit exceeded. (MEMORY_LIMIT_EXCEEDED)"));
  }

  @Test
  void storeTimeoutIsAGatewayTimeout() throws Exception {
    when(reader.generalDurationPercentiles(any(), any(), any())).thenReturn(CompletableFuture.failedFuture(
        new ClickHouseTimeoutException("general_duration_percentiles_daily", "x", "ClickHouse request timed out", null)));

    MvcResult started = mockMvc.perform(get(BASE + "/durations").param("range", "30d"))
        .andExpect(request().asyncStarted())
        .andReturn();
    mockMvc.perform(asyncDispatch(started))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.error").value("store_timeout"));
  }
}
