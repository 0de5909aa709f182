package com.usagelens.analytics.web;

import com.usagelens.engine.reader.TargetSelector;
import com.usagelens.engine.reader.UsageAnalyticsReader;
import com.usagelens.engine.reader.UsageFilters;
import com.usagelens.engine.sql.QueryBuildException;
import com.usagelens.engine.window.DateRange;
import com.usagelens.engine.window.ParsedInterval;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only usage statistics of one target. Callers are trusted to be authorized for the path selector.
 * <p>
 * The period is either {@code from}/{@code to} (ISO-8601 instants) or {@code range}, a trailing window such
 * as {@code 24h} or {@code 7d} ending now.
 */
@RestController
@RequestMapping("/api/usage/{organizationId}/{projectId}/{targetId}")
@RequiredArgsConstructor
public class UsageAnalyticsController {

  private final UsageAnalyticsReader reader;
  private final Clock clock;

  @GetMapping("/requests")
  public CompletableFuture<UsageAnalyticsReader.RequestCounts> requests(
      @PathVariable("organizationId") String organizationId,
      @PathVariable("projectId") String projectId,
      @PathVariable("targetId") String targetId,
      @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
      @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
      @RequestParam(name = "range", required = false, defaultValue = "24h") String range,
      @RequestParam(name = "operations", required = false) List<String> operations,
      @RequestParam(name = "clients", required = false) List<String> clients,
      @RequestParam(name = "coordinate", required = false) String coordinate
  ) {
    return reader.countRequests(
        TargetSelector.of(organizationId, projectId, targetId),
        period(from, to, range),
        new UsageFilters(operations, clients, coordinate)
    );
  }

  @GetMapping("/operations/unique")
  public CompletableFuture<CountResponse> uniqueOperations(
      @PathVariable("organizationId") String organizationId,
      @PathVariable("projectId") String projectId,
      @PathVariable("targetId") String targetId,
      @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
      @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
      @RequestParam(name = "range", required = false, defaultValue = "24h") String range,
      @RequestParam(name = "clients", required = false) List<String> clients
  ) {
    return reader.countUniqueOperations(
            TargetSelector.of(organizationId, projectId, targetId),
            period(from, to, range),
            UsageFilters.ofClients(clients))
        .thenApply(CountResponse::new);
  }

  @GetMapping("/durations")
  public CompletableFuture<UsageAnalyticsReader.Percentiles> durations(
      @PathVariable("organizationId") String organizationId,
      @PathVariable("projectId") String projectId,
      @PathVariable("targetId") String targetId,
      @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
      @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
      @RequestParam(name = "range", required = false, defaultValue = "24h") String range,
      @RequestParam(name = "operations", required = false) List<String> operations
  ) {
    return reader.generalDurationPercentiles(
        TargetSelector.of(organizationId, projectId, targetId),
        period(from, to, range),
        UsageFilters.ofOperations(operations)
    );
  }

  @GetMapping("/requests/series")
  public CompletableFuture<List<UsageAnalyticsReader.TimeSeriesPoint>> requestSeries(
      @PathVariable("organizationId") String organizationId,
      @PathVariable("projectId") String projectId,
      @PathVariable("targetId") String targetId,
      @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
      @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
      @RequestParam(name = "range", required = false, defaultValue = "24h") String range,
      @RequestParam(name = "resolution", required = false, defaultValue = "60") int resolution,
      @RequestParam(name = "operations", required = false) List<String> operations,
      @RequestParam(name = "clients", required = false) List<String> clients
  ) {
    return reader.requestsOverTime(
        TargetSelector.of(organizationId, projectId, targetId),
        period(from, to, range),
        resolution,
        new UsageFilters(operations, clients, null)
    );
  }

  @GetMapping("/clients")
  public CompletableFuture<List<UsageAnalyticsReader.ClientStats>> clients(
      @PathVariable("organizationId") String organizationId,
      @PathVariable("projectId") String projectId,
      @PathVariable("targetId") String targetId,
      @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
      @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
      @RequestParam(name = "range", required = false, defaultValue = "24h") String range,
      @RequestParam(name = "operations", required = false) List<String> operations
  ) {
    return reader.clientBreakdown(
        TargetSelector.of(organizationId, projectId, targetId),
        period(from, to, range),
        UsageFilters.ofOperations(operations)
    );
  }

  private DateRange period(Instant from, Instant to, String range) {
    if (from != null || to != null) {
      if (from == null || to == null) {
        throw new QueryBuildException("Both from and to are required when either is given.");
      }
      if (from.isAfter(to)) {
        throw new QueryBuildException("from must not be after to.");
      }
      return new DateRange(from, to);
    }
    ParsedInterval trailing = ParsedInterval.parse(range);
    Instant now = clock.instant();
    try {
      return new DateRange(now.minus(trailing.toDuration()), now);
    } catch (DateTimeException | ArithmeticException e) {
      throw new QueryBuildException("Range " + trailing + " reaches before the earliest supported instant", e);
    }
  }

  public record CountResponse(long total) {
  }
}
