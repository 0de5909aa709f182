package com.usagelens.engine.reader;

import java.util.List;

/**
 * Optional narrowing of a read.
 *
 * @param operations       operation hashes
 * @param clients          client names
 * @param schemaCoordinate only operations that touched this coordinate
 */
public record UsageFilters(List<String> operations, List<String> clients, String schemaCoordinate) {

  private static final UsageFilters NONE = new UsageFilters(List.of(), List.of(), null);

  public UsageFilters {
    operations = operations == null ? List.of() : List.copyOf(operations);
    clients = clients == null ? List.of() : List.copyOf(clients);
  }

  public static UsageFilters none() {
    return NONE;
  }

  /** A missing narrowing reads everything. */
  public static UsageFilters orNone(UsageFilters filters) {
    return filters == null ? NONE : filters;
  }

  public static UsageFilters ofOperations(List<String> operations) {
    return new UsageFilters(operations, List.of(), null);
  }

  public static UsageFilters ofClients(List<String> clients) {
    return new UsageFilters(List.of(), clients, null);
  }

  public UsageFilters withSchemaCoordinate(String coordinate) {
    return new UsageFilters(operations, clients, coordinate);
  }
}
