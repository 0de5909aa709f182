package com.usagelens.engine.reader;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.usagelens.engine.reader.UsageAnalyticsReader.Percentiles;

import java.util.List;

/**
 * Row shapes of the aggregation queries. Counts arrive as quoted 64-bit integers and bind to {@code long}.
 */
final class UsageRows {

  private UsageRows() {
  }

  record TotalRow(long total) {
  }

  record TotalOkRow(long total, long totalOk) {
  }

  record HashTotalsRow(String hash, long total, long totalOk) {
  }

  record RegistryRow(String name, String hash, @JsonProperty("operation_kind") String operationKind) {
  }

  record BodyRow(String body) {
  }

  record CoordinateRow(String coordinate) {
  }

  record CoordinateTotalRow(String coordinate, long total) {
  }

  record ClientVersionRow(
      long total,
      @JsonProperty("client_name") String clientName,
      @JsonProperty("client_version") String clientVersion
  ) {
  }

  record ClientNameCountRow(long count, @JsonProperty("client_name") String clientName) {
  }

  record ClientNameRow(@JsonProperty("client_name") String clientName) {
  }

  record SeriesRow(long date, long total, long totalOk, Percentiles percentiles) {
  }

  record TargetSeriesRow(long date, long total, String target) {
  }

  record DateTotalRow(long date, long total) {
  }

  record TargetTotalRow(String target, long total) {
  }

  record PercentilesRow(Percentiles percentiles) {
  }

  record HashPercentilesRow(String hash, Percentiles percentiles) {
  }

  record TopOperationRow(String coordinate, String hash, String name, long total) {
  }

  record CoordinateClientsRow(String coordinate, @JsonProperty("client_names") List<String> clientNames) {
  }

  record ExistsRow(int exists) {
  }
}
