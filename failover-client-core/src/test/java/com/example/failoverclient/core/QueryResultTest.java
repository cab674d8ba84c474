package com.example.failoverclient.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class QueryResultTest {

  @Test
  @DisplayName("Should look up values ignoring column case")
  void shouldLookUpIgnoringCase() {
    final var result =
        QueryResult.ofRows(
            List.of("Variable_name", "Value"),
            List.of(Map.of("Variable_name", "innodb_read_only", "Value", "OFF")));

    assertTrue(result.hasRows());
    assertEquals(Optional.of("OFF"), result.value(0, "value"));
    assertEquals(Optional.empty(), result.value(0, "missing"));
  }

  @Test
  @DisplayName("Should keep null values and copy rows")
  void shouldKeepNullsAndCopy() {
    final var row = new HashMap<String, Object>();
    row.put("a", null);
    final var result = QueryResult.ofRows(List.of("a"), List.of(row));
    row.put("a", 1);

    assertEquals(Optional.empty(), result.value(0, "a"));
    assertThrows(UnsupportedOperationException.class, () -> result.rows().get(0).put("b", 2));
  }

  @Test
  @DisplayName("Should report update count without rows")
  void shouldReportUpdateCount() {
    final var result = QueryResult.ofUpdateCount(3);

    assertFalse(result.hasRows());
    assertEquals(3, result.updateCount());
    assertTrue(result.first().isEmpty());
  }

  @Test
  @DisplayName("Should return empty for rows that do not exist")
  void shouldReturnEmptyForMissingRow() {
    final var empty = QueryResult.ofRows(List.of("now"), List.of());
    final var one = QueryResult.ofRows(List.of("now"), List.of(Map.of("now", "12:00")));

    assertEquals(Optional.empty(), empty.value(0, "now"));
    assertEquals(Optional.empty(), one.value(1, "now"));
    assertEquals(Optional.empty(), one.value(-1, "now"));
    assertEquals(Optional.empty(), QueryResult.ofUpdateCount(1).value(0, "now"));
  }
}
