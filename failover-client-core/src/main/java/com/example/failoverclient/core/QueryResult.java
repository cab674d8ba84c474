package com.example.failoverclient.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Materialized result of {@link DatabaseSession#execute(String, Object...)}.
 *
 * <p>A query yields column labels and rows (label to value, in column order) with {@code
 * updateCount == -1}. An update yields no columns, no rows and the affected row count.
 *
 * @param columns column labels in result-set order
 * @param rows rows keyed by column label
 * @param updateCount affected rows for updates, {@code -1} for queries
 */
public record QueryResult(List<String> columns, List<Map<String, Object>> rows, long updateCount) {

  public QueryResult {
    columns = List.copyOf(columns);
    final var copied = new ArrayList<Map<String, Object>>(rows.size());
    for (final var row : rows) copied.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    rows = Collections.unmodifiableList(copied);
  }

  /**
   * Creates the result of a query.
   *
   * @param columns column labels
   * @param rows rows keyed by column label
   * @return query result
   */
  public static QueryResult ofRows(
      final List<String> columns, final List<Map<String, Object>> rows) {
    return new QueryResult(columns, rows, -1L);
  }

  /**
   * Creates the result of an update.
   *
   * @param updateCount affected row count
   * @return update result
   */
  public static QueryResult ofUpdateCount(final long updateCount) {
    return new QueryResult(List.of(), List.of(), updateCount);
  }

  /**
   * Returns whether this result carries rows.
   *
   * @return true for query results
   */
  public boolean hasRows() {
    return updateCount < 0;
  }

  /**
   * Returns the first row, if any.
   *
   * @return first row
   */
  public Optional<Map<String, Object>> first() {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /**
   * Looks up a value by column label, ignoring case.
   *
   * @param row row index
   * @param column column label
   * @return the value, empty if the row or column does not exist or the value is SQL NULL
   */
  public Optional<Object> value(final int row, final String column) {
    if (row < 0 || row >= rows.size()) return Optional.empty();
    final var values = rows.get(row);
    if (values.containsKey(column)) return Optional.ofNullable(values.get(column));
    for (final var entry : values.entrySet())
      if (entry.getKey().equalsIgnoreCase(column)) return Optional.ofNullable(entry.getValue());
    return Optional.empty();
  }
}
