package com.usagelens.engine.clickhouse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Untyped {@code FORMAT JSON} envelope as returned by the store.
 */
public record ClickHouseResponse(ArrayNode data, long rows, double elapsedSeconds) {

  static ClickHouseResponse from(JsonNode root) {
    JsonNode data = root.path("data");
    ArrayNode rowsNode = data.isArray() ? (ArrayNode) data : JsonNodeFactory.instance.arrayNode();
    long rows = root.path("rows").asLong(rowsNode.size());
    double elapsed = root.path("statistics").path("elapsed").asDouble(0.0);
    return new ClickHouseResponse(rowsNode, rows, elapsed);
  }
}
