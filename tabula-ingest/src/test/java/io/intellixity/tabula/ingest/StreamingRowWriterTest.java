package io.intellixity.tabula.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.tabula.model.Column;
import io.intellixity.tabula.model.ColumnType;
import io.intellixity.tabula.patch.TabulaJson;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class StreamingRowWriterTest {
  private static final Instant NOW = Instant.parse("2025-01-29T00:00:00Z");
  private static final List<Column> COLUMNS = List.of(
      new Column("c-name", "t1", "Name", ColumnType.TEXT, NOW),
      new Column("c-email", "t1", "Email", ColumnType.TEXT, NOW),
      new Column("c-age", "t1", "Age", ColumnType.NUMBER, NOW),
      new Column("c-notes", "t1", "Notes", ColumnType.TEXT, NOW),
      new Column("c-score", "t1", "Score", ColumnType.NUMBER, NOW));

  @Test
  void writesOneRowLinePerRow_andOneCellLinePerCell_thenCommits() {
    RecordingCopySessions sessions = new RecordingCopySessions();
    StreamingRowWriter w = new StreamingRowWriter(sessions, 256);

    assertEquals(200, w.writeBatch("t1", COLUMNS, 200, 42L));

    assertEquals(200, sessions.committedRowLines.size());
    assertEquals(200 * COLUMNS.size(), sessions.committedCellLines.size());
    assertEquals(1, sessions.commits.get());
    assertEquals(0, sessions.rollbacks.get());
    assertEquals(1, sessions.closes.get());
    assertTrue(sessions.drains.get() > 2, "small buffer must drain repeatedly");
  }

  @Test
  void cellsAgreeWithRowCacheAndSearch() throws Exception {
    RecordingCopySessions sessions = new RecordingCopySessions();
    new StreamingRowWriter(sessions, 256).writeBatch("t1", COLUMNS, 50, 7L);

    Map<String, Map<String, List<String>>> cellsByRow = new HashMap<>();
    for (String line : sessions.committedCellLines) {
      List<String> f = CsvLines.parse(line);
      cellsByRow.computeIfAbsent(f.get(1), k -> new HashMap<>()).put(f.get(2), f);
    }

    Set<String> rowIds = new HashSet<>();
    for (String line : sessions.committedRowLines) {
      List<String> f = CsvLines.parse(line);
      String rowId = f.get(0);
      assertTrue(rowIds.add(rowId));
      assertEquals("t1", f.get(1));
      JsonNode cache = TabulaJson.mapper().readTree(f.get(2));
      assertEquals(COLUMNS.size(), cache.size());

      Map<String, List<String>> cells = cellsByRow.get(rowId);
      assertEquals(COLUMNS.size(), cells.size());

      String name = cache.get("c-name").asText();
      assertTrue(SyntheticValues.FIRST_NAMES.contains(name));
      assertEquals(name, cells.get("c-name").get(3));
      assertNull(cells.get("c-name").get(4));

      assertTrue(cache.get("c-email").asText().matches("user\\d{6}@example\\.com"));
      assertTrue(SyntheticValues.WORDS.contains(cache.get("c-notes").asText()));

      int age = cache.get("c-age").asInt();
      assertTrue(age >= 18 && age <= 80);
      assertNull(cells.get("c-age").get(3));
      assertEquals(String.valueOf(age), cells.get("c-age").get(4));

      int score = cache.get("c-score").asInt();
      assertTrue(score >= 1 && score <= 100);

      String search = f.get(3);
      assertEquals(search.toLowerCase(), search);
      assertTrue(search.startsWith(name.toLowerCase() + " user"));
    }
  }

  @Test
  void copyFailure_rollsBackAndPropagates() {
    RecordingCopySessions sessions = new RecordingCopySessions();
    sessions.failSession = n -> true;

    assertThrows(IllegalStateException.class,
        () -> new StreamingRowWriter(sessions, 256).writeBatch("t1", COLUMNS, 10, 1L));

    assertEquals(0, sessions.commits.get());
    assertEquals(1, sessions.rollbacks.get());
    assertEquals(1, sessions.closes.get());
    assertTrue(sessions.committedRowLines.isEmpty());
  }

  @Test
  void tableWithoutColumns_writesRowsWithEmptyCache() {
    RecordingCopySessions sessions = new RecordingCopySessions();

    new StreamingRowWriter(sessions, 1024).writeBatch("t1", List.of(), 3, 9L);

    assertEquals(3, sessions.committedRowLines.size());
    assertTrue(sessions.committedCellLines.isEmpty());
    List<String> f = CsvLines.parse(sessions.committedRowLines.get(0));
    assertEquals("{}", f.get(2));
    assertEquals("", f.get(3));
  }

  @Test
  void sameSeed_regeneratesIdenticalRows() {
    RecordingCopySessions a = new RecordingCopySessions();
    RecordingCopySessions b = new RecordingCopySessions();

    new StreamingRowWriter(a, 512).writeBatch("t1", COLUMNS, 20, 99L);
    new StreamingRowWriter(b, 512).writeBatch("t1", COLUMNS, 20, 99L);

    assertEquals(a.committedRowLines, b.committedRowLines);
  }
}
